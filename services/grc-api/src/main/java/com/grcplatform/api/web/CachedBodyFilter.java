package com.grcplatform.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grcplatform.api.config.GrcAuthProperties;
import com.grcplatform.security.AuthorizationException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Caches JSON request bodies so the cross-tenant guard can inspect them before the controller
 * binds them.
 *
 * <p>Runs after {@link AuthenticationFilter}, so only authenticated requests to protected paths
 * are buffered, and never more than {@code grc.auth.max-request-body} bytes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class CachedBodyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CachedBodyFilter.class);

    private final GrcAuthProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxBytes;

    public CachedBodyFilter(GrcAuthProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxBytes = (int) Math.min(Integer.MAX_VALUE - 1, properties.maxRequestBody().toBytes());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())
                || properties.isPublicPath(request.getRequestURI().substring(request.getContextPath().length()))) {
            return true;
        }
        String contentType = request.getContentType();
        if (contentType == null) {
            return true;
        }
        try {
            return !MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return true;
        }
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        CachedBodyRequest cached;
        try {
            cached = CachedBodyRequest.read(request, maxBytes);
        } catch (AuthorizationException e) {
            log.info("Rejected {} {}: body over {} bytes", request.getMethod(), request.getRequestURI(), maxBytes);
            response.setStatus(e.httpStatus());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(e, clock.instant()));
            return;
        }
        filterChain.doFilter(cached, response);
    }
}
