package tech.yump.cendre.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.cendre.api.dto.CreateSecretRequest;
import tech.yump.cendre.api.dto.CreateSecretResponse;
import tech.yump.cendre.api.dto.SecretResponse;
import tech.yump.cendre.audit.AuditHelper;
import tech.yump.cendre.secrets.Secret;
import tech.yump.cendre.secrets.SecretValidator;
import tech.yump.cendre.storage.SecretStore;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Secrets", description = "Store a client-encrypted secret and read it back exactly once")
public class SecretController {

    static final String SECRET_PATH = "/api/secret/";

    private final SecretStore secretStore;
    private final SecretValidator secretValidator;
    private final AuditHelper auditHelper;

    @PostMapping(path = "/secrets", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Create secret",
            description = "Stores an opaque, client-encrypted payload. It can be read once, until its TTL elapses."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Secret stored.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = CreateSecretResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing field, blank payload, TTL out of bounds or malformed JSON.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many requests from this client.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Secret storage failure.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CreateSecretResponse> createSecret(
            @RequestBody(description = "The encrypted payload and its lifetime.", required = true)
            @Valid @org.springframework.web.bind.annotation.RequestBody CreateSecretRequest request
    ) {
        secretValidator.validateTtl(request.ttlSecs());
        Secret secret = secretStore.put(request.ciphertext(), request.iv(), request.ttlSecs());
        log.info("Created secret '{}' with ttl {}s", secret.id(), secret.ttlSecs());

        auditHelper.logHttpEvent(
                AuditHelper.TYPE_SECRET_OPERATION, "create", "success", HttpStatus.CREATED.value(),
                null, Map.of("secret_id", secret.id(), "ttl_secs", secret.ttlSecs())
        );
        return ResponseEntity.created(URI.create(SECRET_PATH + secret.id()))
                .cacheControl(CacheControl.noStore())
                .body(new CreateSecretResponse(secret.id(), secret.expiresAt()));
    }

    @GetMapping(path = "/secret/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Read secret",
            description = "Returns the encrypted payload and destroys it. Every later read, like a read of an expired "
                    + "or unknown id, answers 404."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "First and only read of the secret.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretResponse.class))),
            @ApiResponse(responseCode = "404", description = "Unknown, already read, or expired. The three cases are indistinguishable.",
                    content = @Content),
            @ApiResponse(responseCode = "429", description = "Too many requests from this client.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Secret storage failure.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SecretResponse> readSecret(
            @Parameter(description = "Secret id returned at creation.", required = true, example = "3q2-7wX9b1Qe0aZk4m8N2w")
            @PathVariable String id
    ) {
        Optional<Secret> taken = secretStore.take(id);

        if (taken.isEmpty()) {
            log.info("Secret '{}' not found", id);
            auditHelper.logHttpEvent(
                    AuditHelper.TYPE_SECRET_OPERATION, "read", "not_found", HttpStatus.NOT_FOUND.value(),
                    null, Map.of("secret_id", id)
            );
            return ResponseEntity.notFound().build();
        }

        Secret secret = taken.get();
        log.info("Read secret '{}'", secret.id());
        auditHelper.logHttpEvent(
                AuditHelper.TYPE_SECRET_OPERATION, "read", "success", HttpStatus.OK.value(),
                null, Map.of("secret_id", secret.id())
        );
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(new SecretResponse(secret.ciphertext(), secret.iv()));
    }
}
