package tech.yump.cendre.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "A client-encrypted secret to store for a single read")
public record CreateSecretRequest(
        @Schema(description = "Encrypted payload, base64url encoded by the client. Stored verbatim.",
                example = "AQ==", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "ciphertext must be a non-empty string")
        String ciphertext,

        @Schema(description = "Initialisation vector, base64url encoded by the client. Stored verbatim.",
                example = "AAAAAAAAAAAAAAAA", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "iv must be a non-empty string")
        String iv,

        @Schema(description = "Lifetime of the secret in seconds.", example = "300",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("ttl_secs")
        @NotNull(message = "ttl_secs is required")
        Long ttlSecs
) {

    @Override
    public String toString() {
        return "CreateSecretRequest[ciphertext=******, iv=******, ttlSecs=" + ttlSecs + ']';
    }
}
