package tech.yump.cendre.secrets;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored, client-encrypted secret. The service never interprets {@code ciphertext} or {@code iv};
 * both are kept exactly as the client sent them.
 * <p>
 * Instances are immutable. A secret exists until it is taken once or until {@link #expiresAt()} passes.
 *
 * @param id         unguessable identifier assigned at creation
 * @param ciphertext opaque encrypted payload
 * @param iv         opaque initialisation vector
 * @param createdAt  creation instant
 * @param ttlSecs    lifetime in seconds, counted from {@code createdAt}
 */
public record Secret(
        String id,
        String ciphertext,
        String iv,
        Instant createdAt,
        long ttlSecs
) {

    public Secret {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(iv, "iv");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public Instant expiresAt() {
        return createdAt.plusSeconds(ttlSecs);
    }

    /**
     * A secret is expired from its expiry instant onwards (inclusive).
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt());
    }

    @Override
    public String toString() {
        // Payload fields must never end up in logs.
        return "Secret[" +
                "id='" + id + '\'' +
                ", ciphertext=******" +
                ", iv=******" +
                ", createdAt=" + createdAt +
                ", ttlSecs=" + ttlSecs +
                ']';
    }
}
