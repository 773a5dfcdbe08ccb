package tech.yump.cendre.secrets;

/**
 * Thrown when a create request is malformed or out of bounds (bad TTL, blank or oversized payload).
 * Nothing has been written when this is thrown.
 */
public class InvalidSecretException extends IllegalArgumentException {

  public InvalidSecretException(String message) {
    super(message);
  }
}
