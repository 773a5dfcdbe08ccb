package tech.yump.cendre.storage;

/**
 * Thrown when a store cannot uphold one of its guarantees: an id collision on write, or a backend that offers
 * no atomic fetch-and-delete. The operation is refused rather than degraded.
 */
public class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
