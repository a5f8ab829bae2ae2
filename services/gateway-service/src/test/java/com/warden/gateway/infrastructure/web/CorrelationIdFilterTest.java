package com.warden.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("replaces an oversized correlation ID")
    void replacesOversizedCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "x".repeat(500));
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).hasSizeLessThan(500);
    }

    @Test
    @DisplayName("exposes correlation ID and client address during the chain, clears afterwards")
    void setsContextDuringChain() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain capturingChain = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");
        request.setRemoteAddr("203.0.113.9");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(captured.get()).isEqualTo(new CorrelationContext("during-chain-123", "203.0.113.9", null));
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
