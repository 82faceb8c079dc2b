package com.platform.driftdetector.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request correlation for the drift API.
 *
 * <p>Every API request gets a correlation id in the MDC (taken from {@code X-Correlation-ID}
 * when the caller sends a usable one) and echoed in the response. Drift runs add their
 * {@code runId} on top, so one request can be followed through all pipeline logs.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_RUN_ID = "runId";
    
    @Bean
    public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilter() {
        FilterRegistrationBean<CorrelationIdFilter> registration = new FilterRegistrationBean<>(new CorrelationIdFilter());
        registration.addUrlPatterns("/api/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        // short, token-like ids only
        private static final Pattern USABLE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            String correlationId = correlationIdOf(request);
            MDC.put(MDC_CORRELATION_ID, correlationId);
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
            try {
                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
        
        static String correlationIdOf(HttpServletRequest request) {
            String supplied = request.getHeader(CORRELATION_ID_HEADER);
            if (supplied != null && USABLE_ID.matcher(supplied).matches()) {
                return supplied;
            }
            if (supplied != null) {
                log.debug("Ignoring unusable {} header", CORRELATION_ID_HEADER);
            }
            return UUID.randomUUID().toString();
        }
    }
}
