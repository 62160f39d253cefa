package com.smartcampus.accessservice.infrastructure.web;

import com.smartcampus.accessservice.config.AccessServiceProperties;
import com.smartcampus.observability.RequestContextHolder;
import com.smartcampus.security.AccessDeniedException;
import com.smartcampus.security.MalformedPrincipalException;
import com.smartcampus.security.policy.PolicyConfigurationException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://smartcampus.dev/errors/access-denied",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Access denied",
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>A denied request and a request for a resource that does not exist produce the same 403 body,
 * so the response never reveals whether a resource exists in another school. The denial reason is
 * added as {@code reason} only when {@link AccessServiceProperties#exposeDenyReasons()} is set; it
 * is always logged.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://smartcampus.dev/errors/";

    private final boolean exposeDenyReasons;

    public GlobalExceptionHandler(AccessServiceProperties properties) {
        this.exposeDenyReasons = properties.exposeDenyReasons();
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.info("Access denied: {}", ex.getMessage());
        ProblemDetail problem =
                problem(HttpStatus.FORBIDDEN, "Forbidden", "access-denied",
                        AccessDeniedException.PUBLIC_MESSAGE);
        if (exposeDenyReasons) {
            problem.setProperty("reason", ex.decision().reason());
        }
        return problem;
    }

    @ExceptionHandler(MalformedPrincipalException.class)
    public ProblemDetail handleMalformedPrincipal(MalformedPrincipalException ex) {
        log.warn("Rejected principal: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthenticated",
                String.join("; ", ex.errors()));
    }

    @ExceptionHandler(PolicyConfigurationException.class)
    public ProblemDetail handlePolicyConfiguration(PolicyConfigurationException ex) {
        log.error("Policy table rejected: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Policy", "invalid-policy",
                ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request",
                "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    /** Adds the timestamp and, inside a request, the correlation ID. */
    private static void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = RequestContextHolder.currentCorrelationId();
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
    }
}
