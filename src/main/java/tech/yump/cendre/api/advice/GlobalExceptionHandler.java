package tech.yump.cendre.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.cendre.audit.AuditHelper;
import tech.yump.cendre.secrets.InvalidSecretException;
import tech.yump.cendre.storage.InvariantViolationException;
import tech.yump.cendre.storage.StorageException;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps failures to RFC 7807 problem responses. Bodies never echo request payloads or backend internals.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Pattern SECRET_PATH_PATTERN = Pattern.compile(".*/api/secret/([^/]+)");

    private final AuditHelper auditHelper;

    // --- Client errors ---

    @ExceptionHandler(InvalidSecretException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSecret(InvalidSecretException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Invalid Secret");
        log.warn("Rejected secret request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        // Only field names and constraint messages; rejected values may be secret material.
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .toList();
        String message = errors.isEmpty() ? "Request validation failed." : String.join("; ", errors);

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        problemDetail.setProperty("errors", errors);
        log.warn("Bad request: validation failed ({}). Request: {}", message, request.getDescription(false));

        audit(servletRequestOf(request), HttpStatus.valueOf(status.value()), message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        // The parser message can quote the body, so it stays out of the logs.
        log.warn("Bad request: Malformed JSON received. Request: {}", request.getDescription(false));

        audit(servletRequestOf(request), HttpStatus.valueOf(status.value()), message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Server errors ---

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(StorageException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "Secret storage is currently unavailable.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Storage Error");
        log.error("Storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        audit(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ProblemDetail> handleInvariantViolation(InvariantViolationException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "The secret store refused an operation it could not perform safely.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Invariant Violation");
        log.error("Invariant violation: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        audit(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        audit(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Audit helpers ---

    private void audit(@Nullable HttpServletRequest request, HttpStatus status, String message) {
        if (request == null) {
            log.error("Could not obtain HttpServletRequest for audit logging of a {} response.", status.value());
            return;
        }
        auditHelper.logHttpEvent(
                request,
                AuditHelper.TYPE_SECRET_OPERATION,
                determineAction(request),
                "failure",
                status.value(),
                message,
                extractContextData(request)
        );
    }

    @Nullable
    private static HttpServletRequest servletRequestOf(WebRequest request) {
        if (request instanceof ServletWebRequest servletWebRequest) {
            return servletWebRequest.getRequest();
        }
        return null;
    }

    private static String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/api/secrets")) {
            return "create";
        }
        if (path.startsWith("/api/secret/")) {
            return "read";
        }
        return "unknown";
    }

    private static Map<String, Object> extractContextData(HttpServletRequest request) {
        Matcher matcher = SECRET_PATH_PATTERN.matcher(request.getRequestURI());
        if (matcher.matches()) {
            return Map.of("secret_id", matcher.group(1));
        }
        return Map.of();
    }
}
