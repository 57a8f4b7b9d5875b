package com.atrium.portfolio.infrastructure.web;

import com.atrium.observability.CorrelationContextHolder;
import com.atrium.observability.SensitiveDataRedactor;
import com.atrium.security.AccessException;
import com.atrium.security.Failure;
import java.net.URI;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://atrium.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "You do not have permission to perform this action",
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Access failures get a fixed detail per kind, so responses never reveal why a request was
 * denied or whether a foreign resource exists. Conflicts keep their message. Spring MVC's own
 * client errors (unsupported media type, missing parameter, wrong method) keep the status and
 * body Spring assigns them. Request-derived text is scrubbed before it is logged.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://atrium.dev/errors/";

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @ExceptionHandler(AccessException.class)
    public ResponseEntity<ProblemDetail> handleAccess(AccessException ex) {
        Failure failure = ex.failure();
        ProblemDetail problem = switch (failure) {
            case INVALID_CREDENTIALS -> problem(
                    HttpStatus.UNAUTHORIZED, "Unauthorized", "invalid-credentials", "Invalid email or password");
            case INVALID_TOKEN, UNAUTHENTICATED -> problem(
                    HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthenticated", "Authentication required");
            case FORBIDDEN -> problem(
                    HttpStatus.FORBIDDEN, "Forbidden", "forbidden",
                    "You do not have permission to perform this action");
            case NOT_FOUND -> problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "Resource not found");
            case CONFLICT -> problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
        };
        log.debug("Request failed with {}: {}", failure, ex.getMessage());

        var response = ResponseEntity.status(problem.getStatus());
        if (problem.getStatus() == HttpStatus.UNAUTHORIZED.value()) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Error", "validation",
                detail.isEmpty() ? "Validation failed" : detail);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ProblemDetail handleParameterValidation(HandlerMethodValidationException ex) {
        String detail = ex.getAllErrors().stream()
                .map(MessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Parameter validation failed: {}", detail);
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Error", "validation",
                detail.isEmpty() ? "Validation failed" : detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", redactor.scrub(ex.getMessage()));
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", redactor.scrub(ex.getMessage()));
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeException.class,
            ServletRequestBindingException.class,
            MissingServletRequestPartException.class,
            ErrorResponseException.class})
    public ResponseEntity<ProblemDetail> handleFrameworkError(ErrorResponse ex) {
        log.debug("Request rejected by the framework: {}", ex.getStatusCode());
        ProblemDetail problem = ex.getBody();
        enrichWithCorrelation(problem);
        return ResponseEntity.status(ex.getStatusCode()).headers(ex.getHeaders()).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return handleFrameworkError(errorResponse);
        }
        log.error("Internal server error", ex);
        return ResponseEntity.internalServerError().body(problem(
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred"));
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    /** Adds the timestamp and, inside a request, the correlation ID. */
    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
