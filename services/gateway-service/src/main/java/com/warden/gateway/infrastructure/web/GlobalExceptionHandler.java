package com.warden.gateway.infrastructure.web;

import com.warden.security.CredentialStoreException;
import com.warden.security.DuplicateEmailException;
import com.warden.security.InsufficientPrivilegeException;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.TokenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions from the controllers to RFC 7807 {@link ProblemDetail} responses carrying a
 * timestamp and the correlation ID.
 *
 * <p>Credential failures share one generic detail, so a response never says which check
 * failed. Storage failures are 503, never 401.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DuplicateEmailException.class)
    public ProblemDetail handleDuplicateEmail(DuplicateEmailException ex) {
        log.info("Registration rejected: email already registered");
        return Problems.of(HttpStatus.CONFLICT, "duplicate-email", "Email is already registered");
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleInvalidCredentials(InvalidCredentialsException ex) {
        log.debug("Invalid credentials");
        return unauthorized(InvalidCredentialsException.MESSAGE);
    }

    @ExceptionHandler(TokenException.class)
    public ResponseEntity<ProblemDetail> handleToken(TokenException ex) {
        log.debug("Token rejected: {}", ex.failure());
        return unauthorized(TokenException.MESSAGE);
    }

    @ExceptionHandler(InsufficientPrivilegeException.class)
    public ProblemDetail handleInsufficientPrivilege(InsufficientPrivilegeException ex) {
        log.debug("Privilege {} below required {}", ex.actual(), ex.required());
        return Problems.of(HttpStatus.FORBIDDEN, "insufficient-privilege", "Insufficient privileges");
    }

    @ExceptionHandler(CredentialStoreException.class)
    public ProblemDetail handleCredentialStore(CredentialStoreException ex) {
        log.error("Credential store failure", ex);
        return Problems.of(
                HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Service temporarily unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return Problems.of(HttpStatus.BAD_REQUEST, "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        ProblemDetail problem = Problems.of(HttpStatus.BAD_REQUEST, "validation", detail);
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return Problems.of(HttpStatus.BAD_REQUEST, "bad-request", "Request body is missing or malformed");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            log.debug("Request failed with {}", errorResponse.getStatusCode());
            return Problems.enrich(errorResponse.getBody());
        }
        log.error("Internal server error", ex);
        ProblemDetail problem = Problems.of(
                HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        return problem;
    }

    private static ResponseEntity<ProblemDetail> unauthorized(String detail) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, AuthorizationFilter.BEARER_CHALLENGE)
                .body(Problems.of(HttpStatus.UNAUTHORIZED, "invalid-credentials", detail));
    }
}
