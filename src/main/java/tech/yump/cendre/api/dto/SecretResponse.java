package tech.yump.cendre.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "The stored encrypted payload, returned exactly once")
public record SecretResponse(
        @Schema(description = "Encrypted payload as originally submitted.", example = "AQ==")
        String ciphertext,

        @Schema(description = "Initialisation vector as originally submitted.", example = "AAAAAAAAAAAAAAAA")
        String iv
) {

    @Override
    public String toString() {
        return "SecretResponse[ciphertext=******, iv=******]";
    }
}
