package tech.yump.cendre.secrets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.cendre.config.CendreProperties;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Input bounds for new secrets and generation of secret identifiers.
 */
@Slf4j
@Component
public class SecretValidator {

  /** 128 random bits; encodes to 22 base64url characters. */
  public static final int ID_LENGTH_BYTES = 16;

  private static final Base64.Encoder ID_ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final CendreProperties.SecretsProperties limits;
  private final SecureRandom secureRandom = new SecureRandom();

  public SecretValidator(CendreProperties properties) {
    this.limits = properties.secrets();
    log.debug("SecretValidator initialized. TTL bounds: [{}, {}] seconds", limits.minTtlSecs(), limits.maxTtlSecs());
  }

  /**
   * @throws InvalidSecretException if {@code ttlSecs} is outside the configured bounds.
   */
  public void validateTtl(long ttlSecs) {
    if (ttlSecs < limits.minTtlSecs() || ttlSecs > limits.maxTtlSecs()) {
      throw new InvalidSecretException(
              "ttl_secs must be between " + limits.minTtlSecs() + " and " + limits.maxTtlSecs() + " seconds");
    }
  }

  /**
   * Checks presence and size of the opaque payload fields. Their content is never inspected.
   *
   * @throws InvalidSecretException if a field is blank or too long.
   */
  public void validatePayload(String ciphertext, String iv) {
    if (!StringUtils.hasText(ciphertext) || !StringUtils.hasText(iv)) {
      throw new InvalidSecretException("ciphertext and iv must be non-empty strings");
    }
    if (ciphertext.length() > limits.maxCiphertextLength()) {
      throw new InvalidSecretException("ciphertext must not exceed " + limits.maxCiphertextLength() + " characters");
    }
    if (iv.length() > limits.maxIvLength()) {
      throw new InvalidSecretException("iv must not exceed " + limits.maxIvLength() + " characters");
    }
  }

  /**
   * Generates a fresh, URL-safe secret id from a cryptographically secure source.
   */
  public String generateId() {
    byte[] bytes = new byte[ID_LENGTH_BYTES];
    secureRandom.nextBytes(bytes);
    return ID_ENCODER.encodeToString(bytes);
  }
}
