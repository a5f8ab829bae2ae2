package com.warden.gateway.infrastructure.web;

import com.warden.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds the RFC 7807 bodies shared by {@link AuthorizationFilter} and {@link
 * GlobalExceptionHandler}.
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/invalid-credentials",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Invalid credentials",
 *   "timestamp": "2026-01-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
final class Problems {

    static final String TYPE_BASE = "https://warden.dev/errors/";

    private Problems() {
        // utility class
    }

    static ProblemDetail of(HttpStatus status, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(TYPE_BASE + type));
        return enrich(problem);
    }

    /** Adds the timestamp and, when known, the correlation ID. */
    static ProblemDetail enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
