package com.grcplatform.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grcplatform.api.config.GrcAuthProperties;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.context.SecurityContextHolder;
import com.grcplatform.security.pipeline.AuthenticationPipeline;
import com.grcplatform.security.pipeline.AuthenticationRequest;
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
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the authentication pipeline for every protected request.
 *
 * <p>On success the {@link SecurityContext} is published both as the request attribute
 * {@link #SECURITY_CONTEXT_ATTRIBUTE} and through {@link SecurityContextHolder}; the holder is
 * cleared when the request completes. On failure the request ends here with the error body.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    public static final String TENANT_ID_HEADER = "X-Tenant-ID";
    public static final String SECURITY_CONTEXT_ATTRIBUTE = SecurityContext.class.getName();

    private final AuthenticationPipeline pipeline;
    private final GrcAuthProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuthenticationFilter(
            AuthenticationPipeline pipeline, GrcAuthProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return HttpMethod.OPTIONS.matches(request.getMethod())
                || properties.isPublicPath(request.getRequestURI().substring(request.getContextPath().length()));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        SecurityContext context;
        try {
            context = pipeline.authenticate(new AuthenticationRequest(
                    request.getHeader(HttpHeaders.AUTHORIZATION), request.getHeader(TENANT_ID_HEADER)));
        } catch (AuthorizationException e) {
            log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.errorCode());
            writeError(response, e);
            return;
        }

        request.setAttribute(SECURITY_CONTEXT_ATTRIBUTE, context);
        SecurityContextHolder.set(context);
        try {
            filterChain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clear();
        }
    }

    private void writeError(HttpServletResponse response, AuthorizationException e) throws IOException {
        response.setStatus(e.httpStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(e, clock.instant()));
    }
}
