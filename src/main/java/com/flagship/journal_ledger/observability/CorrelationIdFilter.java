package com.flagship.journal_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Opens a {@link CorrelationContext} scope per API request and echoes its ID
 * in the {@code X-Correlation-ID} response header.
 *
 * Clients that send the header get their own ID back; actuator traffic is not tagged.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final int MAX_CLIENT_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try (CorrelationContext.Scope scope = CorrelationContext.open(clientCorrelationId(request))) {
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, scope.getId());
            filterChain.doFilter(request, response);
        }
    }

    /**
     * Oversized client IDs are replaced rather than copied into every log line.
     */
    static String clientCorrelationId(HttpServletRequest request) {
        String header = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (header == null || header.length() > MAX_CLIENT_ID_LENGTH) {
            return null;
        }
        return header.trim();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
