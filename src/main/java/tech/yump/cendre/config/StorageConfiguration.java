package tech.yump.cendre.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import tech.yump.cendre.secrets.SecretValidator;
import tech.yump.cendre.storage.InMemorySecretStore;
import tech.yump.cendre.storage.RedisSecretStore;
import tech.yump.cendre.storage.SecretStore;

import java.time.Clock;

/**
 * Creates the single {@link SecretStore} for this process, selected by {@code cendre.storage.backend}.
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    private final CendreProperties cendreProperties;

    public StorageConfiguration(CendreProperties cendreProperties) {
        this.cendreProperties = cendreProperties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(name = "cendre.storage.backend", havingValue = "memory", matchIfMissing = true)
    public SecretStore inMemorySecretStore(SecretValidator secretValidator, Clock clock) {
        log.info("Configuring in-memory secret store. Secrets do not survive a restart and are not shared between instances.");
        return new InMemorySecretStore(secretValidator, clock, cendreProperties.storage().memory().sweepInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(name = "cendre.storage.backend", havingValue = "redis")
    public SecretStore redisSecretStore(
            SecretValidator secretValidator,
            Clock clock,
            StringRedisTemplate stringRedisTemplate,
            ObjectMapper objectMapper) {
        log.info("Configuring Redis secret store.");
        return new RedisSecretStore(
                secretValidator,
                clock,
                stringRedisTemplate,
                objectMapper,
                cendreProperties.storage().redis()
        );
    }
}
