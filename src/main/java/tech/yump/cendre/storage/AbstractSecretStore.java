package tech.yump.cendre.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.cendre.secrets.Secret;
import tech.yump.cendre.secrets.SecretValidator;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Shared create/take plumbing. Subclasses only implement the backend-specific write and the atomic
 * fetch-and-delete.
 */
@Slf4j
public abstract class AbstractSecretStore implements SecretStore {

  protected final SecretValidator validator;
  protected final Clock clock;

  protected AbstractSecretStore(SecretValidator validator, Clock clock) {
    this.validator = validator;
    this.clock = clock;
  }

  @Override
  public final Secret put(String ciphertext, String iv, long ttlSecs) {
    validator.validatePayload(ciphertext, iv);
    validator.validateTtl(ttlSecs);

    Secret secret = new Secret(
            validator.generateId(),
            ciphertext,
            iv,
            Instant.now(clock).truncatedTo(ChronoUnit.MILLIS),
            ttlSecs
    );
    write(secret);
    log.debug("Stored secret '{}' in {} (expires at {})", secret.id(), description(), secret.expiresAt());
    return secret;
  }

  @Override
  public final Optional<Secret> take(String id) {
    if (!StringUtils.hasText(id)) {
      return Optional.empty();
    }
    Optional<Secret> taken = fetchAndDelete(id);
    log.debug("Take of secret '{}' from {}: {}", id, description(), taken.isPresent() ? "found" : "absent");
    return taken;
  }

  /**
   * Persists a new secret. Must never overwrite an existing record.
   *
   * @throws StorageException            on backend failure.
   * @throws InvariantViolationException if a record with the same id already exists.
   */
  protected abstract void write(Secret secret);

  /**
   * Atomically removes and returns the record for {@code id}, treating expired records as absent.
   */
  protected abstract Optional<Secret> fetchAndDelete(String id);
}
