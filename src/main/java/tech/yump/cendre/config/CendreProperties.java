package tech.yump.cendre.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Cendre application under the 'cendre' prefix.
 * Every section is optional; missing sections fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "cendre")
@Validated
public record CendreProperties(

        @Valid
        SecretsProperties secrets,

        @Valid
        StorageProperties storage,

        @Valid
        RateLimitProperties rateLimit,

        @Valid
        AuditProperties audit
) {

    public CendreProperties {
        if (secrets == null) {
            secrets = new SecretsProperties(null, null, null, null);
        }
        if (storage == null) {
            storage = new StorageProperties(null, null, null);
        }
        if (rateLimit == null) {
            rateLimit = new RateLimitProperties(null, null, null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null);
        }
    }

    // --- SecretsProperties ---

    /**
     * Bounds applied to every secret at creation time.
     */
    @Validated
    public record SecretsProperties(
            @Min(value = 1, message = "Minimum TTL (cendre.secrets.min-ttl-secs) must be at least 1 second.")
            Long minTtlSecs,

            @Min(value = 1, message = "Maximum TTL (cendre.secrets.max-ttl-secs) must be at least 1 second.")
            Long maxTtlSecs,

            @Min(value = 1, message = "Maximum ciphertext length (cendre.secrets.max-ciphertext-length) must be positive.")
            Integer maxCiphertextLength,

            @Min(value = 1, message = "Maximum IV length (cendre.secrets.max-iv-length) must be positive.")
            Integer maxIvLength
    ) {
        public static final long DEFAULT_MIN_TTL_SECS = 1;
        public static final long DEFAULT_MAX_TTL_SECS = 24 * 60 * 60;
        public static final int DEFAULT_MAX_CIPHERTEXT_LENGTH = 1024 * 1024;
        public static final int DEFAULT_MAX_IV_LENGTH = 1024;

        public SecretsProperties {
            if (minTtlSecs == null) {
                minTtlSecs = DEFAULT_MIN_TTL_SECS;
            }
            if (maxTtlSecs == null) {
                maxTtlSecs = DEFAULT_MAX_TTL_SECS;
            }
            if (maxCiphertextLength == null) {
                maxCiphertextLength = DEFAULT_MAX_CIPHERTEXT_LENGTH;
            }
            if (maxIvLength == null) {
                maxIvLength = DEFAULT_MAX_IV_LENGTH;
            }
        }

        @AssertTrue(message = "Maximum TTL (cendre.secrets.max-ttl-secs) must not be lower than the minimum TTL (cendre.secrets.min-ttl-secs).")
        public boolean isTtlRangeValid() {
            return minTtlSecs == null || maxTtlSecs == null || maxTtlSecs >= minTtlSecs;
        }
    }

    // --- StorageProperties ---

    /**
     * Which {@code SecretStore} backs the service, plus per-backend settings.
     */
    @Validated
    public record StorageProperties(
            @NotNull(message = "Storage backend (cendre.storage.backend) must be 'memory' or 'redis'.")
            BackendType backend,

            @Valid
            MemoryProperties memory,

            @Valid
            RedisStoreProperties redis
    ) {
        public StorageProperties {
            if (backend == null) {
                backend = BackendType.MEMORY;
            }
            if (memory == null) {
                memory = new MemoryProperties(null);
            }
            if (redis == null) {
                redis = new RedisStoreProperties(null, null, null);
            }
        }

        @Validated
        public record MemoryProperties(
                Duration sweepInterval
        ) {
            public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

            public MemoryProperties {
                if (sweepInterval == null) {
                    sweepInterval = DEFAULT_SWEEP_INTERVAL;
                }
            }

            @AssertTrue(message = "Sweep interval (cendre.storage.memory.sweep-interval) must be positive.")
            public boolean isSweepIntervalValid() {
                return sweepInterval != null && !sweepInterval.isNegative() && !sweepInterval.isZero();
            }
        }

        @Validated
        public record RedisStoreProperties(
                @NotBlank(message = "Redis key prefix (cendre.storage.redis.key-prefix) must not be blank.")
                String keyPrefix,

                @NotNull
                TakeStrategy takeStrategy,

                @Min(value = 1, message = "WATCH retries (cendre.storage.redis.max-watch-retries) must be at least 1.")
                Integer maxWatchRetries
        ) {
            public static final String DEFAULT_KEY_PREFIX = "secret:";
            public static final int DEFAULT_MAX_WATCH_RETRIES = 16;

            public RedisStoreProperties {
                if (keyPrefix == null) {
                    keyPrefix = DEFAULT_KEY_PREFIX;
                }
                if (takeStrategy == null) {
                    takeStrategy = TakeStrategy.AUTO;
                }
                if (maxWatchRetries == null) {
                    maxWatchRetries = DEFAULT_MAX_WATCH_RETRIES;
                }
            }
        }
    }

    public enum BackendType {
        MEMORY, REDIS
    }

    /**
     * How the Redis store performs its atomic fetch-and-delete.
     */
    public enum TakeStrategy {
        /** Native GETDEL (Redis 6.2+). */
        GETDEL,
        /** WATCH / GET / MULTI / DEL / EXEC, retried on conflict. */
        WATCH,
        /** GETDEL, switching to WATCH if the server does not know GETDEL. */
        AUTO
    }

    // --- RateLimitProperties ---

    @Validated
    public record RateLimitProperties(
            Boolean enabled,

            @Min(value = 1, message = "Rate limit (cendre.rate-limit.max-requests) must be at least 1.")
            Integer maxRequests,

            Duration window,

            @Min(value = 1, message = "Tracked client limit (cendre.rate-limit.max-tracked-clients) must be at least 1.")
            Integer maxTrackedClients
    ) {
        public static final int DEFAULT_MAX_REQUESTS = 60;
        public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
        public static final int DEFAULT_MAX_TRACKED_CLIENTS = 10_000;

        public RateLimitProperties {
            if (enabled == null) {
                enabled = true;
            }
            if (maxRequests == null) {
                maxRequests = DEFAULT_MAX_REQUESTS;
            }
            if (window == null) {
                window = DEFAULT_WINDOW;
            }
            if (maxTrackedClients == null) {
                maxTrackedClients = DEFAULT_MAX_TRACKED_CLIENTS;
            }
        }

        @AssertTrue(message = "Rate limit window (cendre.rate-limit.window) must be positive.")
        public boolean isWindowValid() {
            return window != null && !window.isNegative() && !window.isZero();
        }
    }

    // --- AuditProperties ---

    @Validated
    public record AuditProperties(
            AuditBackendType backend,

            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            if (backend == null) {
                backend = AuditBackendType.SLF4J;
            }
        }

        /**
         * Only consulted by logback-spring.xml; kept here so the key is documented and validated.
         */
        @Validated
        public record FileAuditProperties(
                @NotBlank(message = "Audit file path (cendre.audit.file.path) must not be blank when set.")
                String path
        ) {
            public static final String PATH_PROPERTY = "cendre.audit.file.path";
        }
    }

    public enum AuditBackendType {
        SLF4J, FILE
    }
}
