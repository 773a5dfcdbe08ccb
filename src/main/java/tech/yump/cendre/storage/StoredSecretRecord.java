package tech.yump.cendre.storage;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.yump.cendre.secrets.Secret;

import java.time.Instant;

/**
 * Persisted form of a secret in a key/value backend. The id lives in the key, and expiry is the backend's own
 * key TTL, so neither is part of the value.
 *
 * <pre>
 * {
 *   "ciphertext": "BASE64URL_CIPHERTEXT",
 *   "iv": "BASE64URL_IV",
 *   "created_at": "2026-10-19T08:15:30.123Z",
 *   "ttl_secs": 300
 * }
 * </pre>
 */
public record StoredSecretRecord(
        @JsonProperty("ciphertext")
        String ciphertext,

        @JsonProperty("iv")
        String iv,

        @JsonProperty("created_at")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant createdAt,

        @JsonProperty("ttl_secs")
        long ttlSecs
) {

    public static StoredSecretRecord from(Secret secret) {
        return new StoredSecretRecord(secret.ciphertext(), secret.iv(), secret.createdAt(), secret.ttlSecs());
    }

    public Secret toSecret(String id) {
        if (ciphertext == null || iv == null || createdAt == null) {
            throw new IllegalStateException("Stored record for secret '" + id + "' is missing mandatory fields.");
        }
        return new Secret(id, ciphertext, iv, createdAt, ttlSecs);
    }
}
