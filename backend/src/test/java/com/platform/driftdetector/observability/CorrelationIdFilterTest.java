package com.platform.driftdetector.observability;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final LoggingConfig.CorrelationIdFilter filter = new LoggingConfig.CorrelationIdFilter();

    @Test
    @DisplayName("a usable caller id is kept in the MDC for the request and echoed")
    void keepsCallerId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/drift/reports");
        request.addHeader(LoggingConfig.CORRELATION_ID_HEADER, "ci-build-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(LoggingConfig.MDC_CORRELATION_ID));
            }
        });

        assertThat(seen.get()).isEqualTo("ci-build-42");
        assertThat(response.getHeader(LoggingConfig.CORRELATION_ID_HEADER)).isEqualTo("ci-build-42");
        assertThat(MDC.get(LoggingConfig.MDC_CORRELATION_ID)).isNull();
    }

    @Test
    @DisplayName("a missing or unusable id is replaced by a generated one")
    void replacesUnusableId() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/drift/runs");
        request.addHeader(LoggingConfig.CORRELATION_ID_HEADER, "bad id\nwith newline");

        String generated = LoggingConfig.CorrelationIdFilter.correlationIdOf(request);

        assertThat(generated).isNotEqualTo("bad id\nwith newline").hasSize(36);
        assertThat(LoggingConfig.CorrelationIdFilter.correlationIdOf(new MockHttpServletRequest())).hasSize(36);
    }
}
