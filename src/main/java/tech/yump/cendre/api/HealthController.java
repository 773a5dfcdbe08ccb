package tech.yump.cendre.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.cendre.storage.SecretStore;
import tech.yump.cendre.storage.StorageException;

@RestController
@Slf4j
@Tag(name = "System", description = "Service status endpoints")
public class HealthController {

  private final SecretStore secretStore;

  public HealthController(SecretStore secretStore) {
    this.secretStore = secretStore;
  }

  @GetMapping(path = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
          summary = "Health check",
          description = "Answers 'ok' when the secret storage backend is reachable."
  )
  @ApiResponse(responseCode = "200", description = "Backend reachable.",
          content = @Content(mediaType = MediaType.TEXT_PLAIN_VALUE, schema = @Schema(type = "string", example = "ok")))
  @ApiResponse(responseCode = "503", description = "Backend unreachable.",
          content = @Content(mediaType = MediaType.TEXT_PLAIN_VALUE, schema = @Schema(type = "string", example = "unavailable")))
  public ResponseEntity<String> health() {
    try {
      secretStore.ping();
      return ResponseEntity.ok("ok");
    } catch (StorageException e) {
      log.warn("Health check failed for {} store: {}", secretStore.description(), e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("unavailable");
    }
  }
}
