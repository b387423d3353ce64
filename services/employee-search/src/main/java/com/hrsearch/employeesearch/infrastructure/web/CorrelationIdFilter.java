package com.hrsearch.employeesearch.infrastructure.web;

import com.hrsearch.observability.CorrelationContext;
import com.hrsearch.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID flows:
 *
 * <ol>
 *   <li>HTTP request header → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → SLF4J MDC → log output
 *   <li>This filter → HTTP response header (for client-side correlation)
 * </ol>
 *
 * <p>If the client sends {@code X-Correlation-ID}, it is propagated; otherwise a new UUID is
 * generated. Each request also gets its own request ID. Runs at {@link Ordered#HIGHEST_PRECEDENCE}
 * so correlation is available to all subsequent filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        var context =
                new CorrelationContext(correlationId, null, null, UUID.randomUUID().toString());
        CorrelationContextHolder.set(context);

        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
