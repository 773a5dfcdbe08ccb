package tech.yump.cendre.storage;

/**
 * Thrown when a {@link SecretStore} backend is unreachable, times out, or cannot complete an operation.
 * Distinct from a missing secret, which is reported as an empty result.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
