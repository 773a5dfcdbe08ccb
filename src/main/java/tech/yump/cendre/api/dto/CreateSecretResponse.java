package tech.yump.cendre.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Identifier and expiry of a newly stored secret")
public record CreateSecretResponse(
        @Schema(description = "Unguessable secret id, URL-safe.", example = "3q2-7wX9b1Qe0aZk4m8N2w",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String id,

        @Schema(description = "RFC 3339 instant after which the secret can no longer be read.",
                example = "2026-10-19T08:20:30.123Z", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("expires_at")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant expiresAt
) {}
