package tech.yump.cendre.storage;

import tech.yump.cendre.secrets.InvalidSecretException;
import tech.yump.cendre.secrets.Secret;

import java.util.Optional;

/**
 * Interface defining the contract for secret storage backends.
 * Implementations hold opaque, client-encrypted payloads and hand each one out at most once.
 * <p>
 * Exactly one implementation is active per process, chosen at startup through
 * {@code cendre.storage.backend}.
 */
public interface SecretStore extends AutoCloseable {

  /**
   * Validates the input, assigns a fresh id and persists an immutable secret that expires after {@code ttlSecs}.
   *
   * @param ciphertext opaque encrypted payload, stored verbatim. Must not be blank.
   * @param iv         opaque initialisation vector, stored verbatim. Must not be blank.
   * @param ttlSecs    lifetime in seconds, within the configured bounds.
   * @return the stored secret, carrying its id and expiry.
   * @throws InvalidSecretException       if the input is out of bounds. Nothing is written.
   * @throws StorageException             if the backend fails. The write outcome is unknown.
   * @throws InvariantViolationException  if the generated id is already taken.
   */
  Secret put(String ciphertext, String iv, long ttlSecs);

  /**
   * Atomically fetches and removes the secret with the given id.
   * <p>
   * Among any number of concurrent callers for the same id (across processes, where the backend is shared),
   * exactly one receives the secret. Expired secrets are never returned.
   *
   * @param id the secret id.
   * @return the secret, or {@code Optional.empty()} if it never existed, was already taken, or expired.
   * @throws StorageException            if the backend cannot complete the atomic operation.
   * @throws InvariantViolationException if the backend cannot guarantee atomicity.
   */
  Optional<Secret> take(String id);

  /**
   * Lightweight health check for the underlying backend.
   *
   * @throws StorageException if the backend is unreachable.
   */
  void ping();

  /**
   * Human-readable name of this backend, for logging and diagnostics.
   */
  String description();

  /**
   * Called once by the container before the store serves requests.
   */
  default void start() {
  }

  /**
   * Releases resources owned by the store. Must be idempotent.
   */
  @Override
  default void close() {
  }
}
