package com.smartcampus.accessservice.infrastructure.web;

import com.smartcampus.observability.RequestContext;
import com.smartcampus.observability.RequestContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID flows:
 *
 * <ol>
 *   <li>HTTP request header → this filter → {@link RequestContextHolder}
 *   <li>RequestContextHolder → SLF4J MDC → log output
 *   <li>RequestContextHolder → audit entries written for the request
 *   <li>This filter → HTTP response header
 * </ol>
 *
 * <p>The context also records the client address and {@code User-Agent}, which audit entries
 * carry. It starts anonymous; {@link PrincipalArgumentResolver} binds the caller once the
 * principal is built. Runs at {@link Ordered#HIGHEST_PRECEDENCE}.
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

        RequestContextHolder.set(RequestContext.anonymous(correlationId)
                .withClient(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT)));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            RequestContextHolder.clear();
        }
    }
}
