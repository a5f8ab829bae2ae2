package com.warden.gateway.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.observability.CorrelationContextHolder;
import com.warden.observability.SpanHelper;
import com.warden.security.AccessRequest;
import com.warden.security.AuthorizationDecision;
import com.warden.security.CredentialStoreException;
import com.warden.security.Identity;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.RequestMediator;
import io.opentelemetry.api.trace.Span;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Runs every request through the {@link RequestMediator} and either forwards it or writes the
 * rejection.
 *
 * <ul>
 *   <li>ALLOW: the resolved {@link Identity}, if any, is stored under {@link
 *       #IDENTITY_ATTRIBUTE} and the chain continues.
 *   <li>RATE_EXCEEDED: 429 with {@code Retry-After} in whole seconds.
 *   <li>INVALID_CREDENTIALS: 401 with {@code WWW-Authenticate: Bearer}.
 *   <li>INSUFFICIENT_PRIVILEGE: 403.
 * </ul>
 *
 * <p>The bearer credential comes from {@code Authorization: Bearer ...} and may be an access
 * token or an API key. The route password comes from the {@code password} query parameter or
 * the {@value #ROUTE_PASSWORD_HEADER} header. A storage failure during the credential check is
 * answered with 503 and never with 401.
 *
 * <p>Mediation runs inside a {@value #SPAN_NAME} span tagged with the path and outcome. Actuator
 * endpoints bypass the mediator.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthorizationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationFilter.class);

    /** Request attribute holding the authenticated {@link Identity} on token routes. */
    public static final String IDENTITY_ATTRIBUTE = "warden.identity";

    public static final String ROUTE_PASSWORD_HEADER = "X-Route-Password";
    public static final String ROUTE_PASSWORD_PARAMETER = "password";

    static final String BEARER_CHALLENGE = "Bearer realm=\"warden\"";

    static final String SPAN_NAME = "warden.authorize";

    private static final String BEARER_PREFIX = "Bearer ";

    private final RequestMediator mediator;
    private final SpanHelper spans;
    private final ObjectMapper objectMapper;

    public AuthorizationFilter(RequestMediator mediator, SpanHelper spans, ObjectMapper objectMapper) {
        this.mediator = mediator;
        this.spans = spans;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = lookupPath(request);
        return path.equals("/actuator") || path.startsWith("/actuator/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        var accessRequest = new AccessRequest(
                lookupPath(request),
                request.getRemoteAddr(),
                bearerCredential(request),
                routePassword(request));

        AuthorizationDecision decision;
        try {
            decision = spans.inSpan(SPAN_NAME, Map.of("http.route", accessRequest.path()), () -> {
                AuthorizationDecision outcome = mediator.mediate(accessRequest);
                Span.current().setAttribute("warden.outcome", outcome.outcome().name());
                return outcome;
            });
        } catch (CredentialStoreException e) {
            log.error("Credential store unavailable while authorizing {}", accessRequest.path(), e);
            writeProblem(response, Problems.of(
                    HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Authorization is temporarily unavailable"));
            return;
        }

        switch (decision.outcome()) {
            case ALLOW -> {
                decision.resolvedIdentity().ifPresent(identity -> {
                    request.setAttribute(IDENTITY_ATTRIBUTE, identity);
                    CorrelationContextHolder.attachUser(identity.userId());
                });
                filterChain.doFilter(request, response);
            }
            case RATE_EXCEEDED -> {
                response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds(decision.retryAfter())));
                writeProblem(response, Problems.of(
                        HttpStatus.TOO_MANY_REQUESTS, "rate-exceeded", "Rate limit exceeded"));
            }
            case INVALID_CREDENTIALS -> {
                response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
                writeProblem(response, Problems.of(
                        HttpStatus.UNAUTHORIZED, "invalid-credentials", InvalidCredentialsException.MESSAGE));
            }
            case INSUFFICIENT_PRIVILEGE -> writeProblem(response, Problems.of(
                    HttpStatus.FORBIDDEN, "insufficient-privilege", "Insufficient privileges"));
        }
    }

    static String bearerCredential(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.length() <= BEARER_PREFIX.length()
                || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String credential = header.substring(BEARER_PREFIX.length()).strip();
        return credential.isEmpty() ? null : credential;
    }

    static long retryAfterSeconds(Duration retryAfter) {
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    private static String routePassword(HttpServletRequest request) {
        String password = request.getParameter(ROUTE_PASSWORD_PARAMETER);
        return password != null ? password : request.getHeader(ROUTE_PASSWORD_HEADER);
    }

    /**
     * The path the dispatcher matches handlers against: context path removed, {@code ;} parameters
     * stripped, percent-escapes decoded, duplicate slashes and dot segments collapsed, and a
     * trailing slash dropped. Route policies are looked up by this path, never by the raw URI.
     */
    static String lookupPath(HttpServletRequest request) {
        String path = StringUtils.cleanPath(UrlPathHelper.defaultInstance.getPathWithinApplication(request));
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private void writeProblem(HttpServletResponse response, ProblemDetail problem) throws IOException {
        response.setStatus(problem.getStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
