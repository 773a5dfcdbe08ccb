package tech.yump.cendre.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import tech.yump.cendre.config.CendreProperties;
import tech.yump.cendre.config.CendreProperties.TakeStrategy;
import tech.yump.cendre.secrets.Secret;
import tech.yump.cendre.secrets.SecretValidator;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Redis-backed {@link SecretStore}.
 * <p>
 * Each secret is one JSON string under {@code keyPrefix + id}, written with {@code SET NX EX} so Redis expires it
 * on its own. Reads consume the key atomically, either with {@code GETDEL} or with a WATCH/MULTI/EXEC
 * conditional delete that is retried on conflict. A separate GET followed by DEL is never used: two readers
 * could both see the value before either deletes it.
 */
@Slf4j
public class RedisSecretStore extends AbstractSecretStore {

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;
  private final TakeStrategy configuredStrategy;
  private final int maxWatchRetries;

  // Set once AUTO discovers that the server has no GETDEL.
  private volatile boolean getDelUnavailable;

  public RedisSecretStore(
          SecretValidator validator,
          Clock clock,
          StringRedisTemplate redisTemplate,
          ObjectMapper objectMapper,
          CendreProperties.StorageProperties.RedisStoreProperties properties
  ) {
    super(validator, clock);
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = properties.keyPrefix();
    this.configuredStrategy = properties.takeStrategy();
    this.maxWatchRetries = properties.maxWatchRetries();
    log.info("RedisSecretStore initialized with key prefix '{}' and take strategy {}", keyPrefix, configuredStrategy);
  }

  /**
   * Checks connectivity once at startup. An unreachable Redis is reported but does not stop the application;
   * requests fail with {@link StorageException} and the health endpoint reports the outage.
   */
  @Override
  public void start() {
    try {
      ping();
      log.info("Connected to Redis for secret storage.");
    } catch (StorageException e) {
      log.error("Redis is not reachable at startup: {}", e.getMessage());
    }
  }

  @Override
  protected void write(Secret secret) {
    String key = keyFor(secret.id());
    String json = serialize(secret);

    Boolean created;
    try {
      created = redisTemplate.opsForValue().setIfAbsent(key, json, Duration.ofSeconds(secret.ttlSecs()));
    } catch (DataAccessException e) {
      log.error("Failed to write secret '{}' to Redis: {}", secret.id(), e.getMessage(), e);
      throw new StorageException("Failed to write secret: " + secret.id(), e);
    }

    if (created == null) {
      throw new StorageException("Redis returned no result for SET NX of secret: " + secret.id());
    }
    if (!created) {
      log.error("Refusing to overwrite existing Redis key for secret '{}'", secret.id());
      throw new InvariantViolationException("Secret id collision detected for id '" + secret.id() + "'");
    }
  }

  @Override
  protected Optional<Secret> fetchAndDelete(String id) {
    String key = keyFor(id);
    String json;
    try {
      json = useWatch() ? takeWithWatch(key) : takeWithGetDel(key);
    } catch (DataAccessException e) {
      log.error("Failed to take secret '{}' from Redis: {}", id, e.getMessage(), e);
      throw new StorageException("Failed to take secret: " + id, e);
    }

    if (json == null) {
      return Optional.empty();
    }

    Secret secret = deserialize(id, json);
    if (secret.isExpiredAt(clock.instant())) {
      log.debug("Secret '{}' was still in Redis past its expiry; treating as absent", id);
      return Optional.empty();
    }
    return Optional.of(secret);
  }

  @Override
  public void ping() {
    String reply;
    try {
      reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
    } catch (DataAccessException e) {
      throw new StorageException("Redis ping failed", e);
    }
    if (!"PONG".equalsIgnoreCase(reply)) {
      throw new StorageException("Unexpected Redis ping reply: " + reply);
    }
  }

  @Override
  public String description() {
    return "redis";
  }

  String keyFor(String id) {
    return keyPrefix + id;
  }

  private boolean useWatch() {
    return configuredStrategy == TakeStrategy.WATCH || getDelUnavailable;
  }

  // --- GETDEL ---

  private String takeWithGetDel(String key) {
    try {
      return redisTemplate.opsForValue().getAndDelete(key);
    } catch (DataAccessException e) {
      if (!isUnknownCommand(e)) {
        throw e;
      }
      if (configuredStrategy == TakeStrategy.GETDEL) {
        log.error("Redis server does not support GETDEL and the WATCH fallback is disabled (take-strategy=GETDEL).");
        throw new InvariantViolationException(
                "Redis server does not support GETDEL; refusing to fall back to a non-atomic read", e);
      }
      log.warn("Redis server does not support GETDEL; switching to WATCH/MULTI/EXEC conditional delete.");
      getDelUnavailable = true;
      return takeWithWatch(key);
    }
  }

  private static boolean isUnknownCommand(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      String message = t.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains("unknown command")) {
        return true;
      }
    }
    return false;
  }

  // --- WATCH / MULTI / EXEC ---

  private String takeWithWatch(String key) {
    for (int attempt = 1; attempt <= maxWatchRetries; attempt++) {
      WatchOutcome outcome = redisTemplate.execute(new ConditionalDelete(key));
      if (outcome == null) {
        throw new StorageException("Redis returned no result for conditional delete of key: " + key);
      }
      if (!outcome.conflict()) {
        return outcome.value();
      }
      log.debug("Conditional delete of key '{}' aborted by a concurrent change (attempt {}/{})",
              key, attempt, maxWatchRetries);
    }
    throw new StorageException("Conditional delete of key '" + key + "' aborted after " + maxWatchRetries + " attempts");
  }

  /**
   * One optimistic round: watch the key, read it, and delete it in a transaction that Redis discards if the key
   * changed after the WATCH.
   */
  private record ConditionalDelete(String key) implements SessionCallback<WatchOutcome> {

    @Override
    @SuppressWarnings("unchecked")
    public <K, V> WatchOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
      RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;

      ops.watch(key);
      String value = ops.opsForValue().get(key);
      if (value == null) {
        ops.unwatch();
        return WatchOutcome.ABSENT;
      }

      ops.multi();
      ops.delete(key);
      List<Object> results = ops.exec();

      // A discarded transaction yields no results.
      if (results == null || results.isEmpty()) {
        return WatchOutcome.CONFLICT;
      }
      return new WatchOutcome(false, value);
    }
  }

  private record WatchOutcome(boolean conflict, String value) {
    static final WatchOutcome ABSENT = new WatchOutcome(false, null);
    static final WatchOutcome CONFLICT = new WatchOutcome(true, null);
  }

  // --- Serialization ---

  private String serialize(Secret secret) {
    try {
      return objectMapper.writeValueAsString(StoredSecretRecord.from(secret));
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize secret '{}' for Redis: {}", secret.id(), e.getMessage(), e);
      throw new StorageException("Failed to serialize secret: " + secret.id(), e);
    }
  }

  private Secret deserialize(String id, String json) {
    try {
      return objectMapper.readValue(json, StoredSecretRecord.class).toSecret(id);
    } catch (JsonProcessingException | IllegalStateException e) {
      // The key is already gone at this point; the record cannot be recovered.
      log.error("Failed to parse stored record for secret '{}': {}", id, e.getMessage(), e);
      throw new StorageException("Failed to parse stored record for secret: " + id, e);
    }
  }
}
