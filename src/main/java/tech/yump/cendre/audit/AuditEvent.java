package tech.yump.cendre.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry, serialized as JSON.
 * Never carries secret payloads: only ids, TTLs and request metadata belong in {@code data}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "secret_operation", "rate_limit"
        String action,          // e.g. "create", "read"
        String outcome,         // "success", "not_found", "failure", "denied"
        ClientInfo clientInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,
        Map<String, Object> data
) {

    /**
     * Who sent the request. The service is anonymous, so only the network origin is known.
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ClientInfo(
            String sourceAddress
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive headers only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
