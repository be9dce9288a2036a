package com.grcplatform.api.web;

import com.grcplatform.api.config.GrcAuthProperties;
import com.grcplatform.observability.CorrelationContext;
import com.grcplatform.observability.CorrelationContextHolder;
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
 * Propagates or generates the correlation id of every request and binds the request origin
 * (client address, user agent) to {@link CorrelationContextHolder}, which feeds the MDC and the
 * audit trail.
 *
 * <p>The id is echoed in the {@code X-Correlation-ID} response header. An incoming id that is
 * not a short token of letters, digits, dots, underscores or hyphens is replaced. The
 * {@code X-Forwarded-For} header is only honoured when the peer is a configured trusted proxy.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private static final Pattern VALID_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final GrcAuthProperties properties;

    public CorrelationIdFilter(GrcAuthProperties properties) {
        this.properties = properties;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !VALID_CORRELATION_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(CorrelationContext.forRequest(
                correlationId, UUID.randomUUID().toString(), clientIp(request), request.getHeader("User-Agent")));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    /**
     * The nearest untrusted hop: walks {@code X-Forwarded-For} right to left while the hops are
     * trusted proxies, starting from the socket peer.
     */
    String clientIp(HttpServletRequest request) {
        String peer = request.getRemoteAddr();
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded == null || forwarded.isBlank() || !properties.isTrustedProxy(peer)) {
            return peer;
        }
        String[] hops = forwarded.split(",");
        String client = peer;
        for (int i = hops.length - 1; i >= 0 && properties.isTrustedProxy(client); i--) {
            String hop = hops[i].strip();
            if (!hop.isEmpty()) {
                client = hop;
            }
        }
        return client;
    }
}
