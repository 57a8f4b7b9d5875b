package com.atrium.portfolio.infrastructure.web;

import com.atrium.observability.CorrelationContext;
import com.atrium.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A well-formed {@code X-Correlation-ID} from the client is kept; anything else (absent,
 * too long, unexpected characters) is replaced by a fresh UUID. The ID is placed in
 * {@link CorrelationContextHolder}, and from there in the MDC and in audit entries, and is
 * echoed on the response.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !ACCEPTED_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(CorrelationContext.forRequest(correlationId));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
