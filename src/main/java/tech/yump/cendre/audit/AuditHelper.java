package tech.yump.cendre.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.cendre.api.filter.RequestIdFilter;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String TYPE_SECRET_OPERATION = "secret_operation";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit event for the outcome of the current HTTP request.
     * Request and client context are gathered from the bound request, if any.
     *
     * @param type         The type of event (e.g., "secret_operation").
     * @param action       The specific action performed (e.g., "create", "read").
     * @param outcome      The result ("success", "not_found", "failure", "denied").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures). Must not contain secret material.
     * @param data         Optional context data (e.g., secret id). Must not contain secret material.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        logHttpEvent(getCurrentHttpRequest(), type, action, outcome, statusCode, errorMessage, data);
    }

    /**
     * Same as {@link #logHttpEvent(String, String, String, int, String, Map)} for callers that hold the request
     * but run outside the dispatcher (servlet filters).
     */
    public void logHttpEvent(
            @Nullable HttpServletRequest request,
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .clientInfo(buildClientInfo(request))
                    .requestInfo(buildRequestInfo(request))
                    .responseInfo(AuditEvent.ResponseInfo.builder()
                            .statusCode(statusCode)
                            .errorMessage(errorMessage)
                            .build())
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private AuditEvent.ClientInfo buildClientInfo(@Nullable HttpServletRequest request) {
        return AuditEvent.ClientInfo.builder()
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown")
                .build();
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(RequestIdFilter.REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
