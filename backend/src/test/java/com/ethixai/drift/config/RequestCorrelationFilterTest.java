package com.ethixai.drift.config;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    @Test
    void callerIdsAreEchoedAndVisibleInMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/drift/status/fraud-v7");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-1");
        request.addHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER, "trace-9");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY));
            }
        });

        assertThat(seen).hasValue("trace-9");
        assertThat(response.getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
        assertThat(MDC.get(RequestCorrelationFilter.REQUEST_ID_KEY)).isNull();
    }

    @Test
    void missingCorrelationFallsBackToRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/drift/status/fraud-v7");
        request.addHeader(RequestCorrelationFilter.REQUEST_ID_HEADER, "req-2");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(RequestCorrelationFilter.CORRELATION_ID_HEADER)).isEqualTo("req-2");
    }

    @Test
    void unsafeIdsAreReplaced() {
        assertThat(RequestCorrelationFilter.acceptOrDefault("abc\nFAKE LOG LINE", "fallback")).isEqualTo("fallback");
        assertThat(RequestCorrelationFilter.acceptOrDefault("x".repeat(101), "fallback")).isEqualTo("fallback");
        assertThat(RequestCorrelationFilter.acceptOrGenerate(null)).hasSize(36);
    }
}
