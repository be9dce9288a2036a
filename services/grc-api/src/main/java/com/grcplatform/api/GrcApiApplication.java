package com.grcplatform.api;

import com.grcplatform.api.config.GrcAuthProperties;
import com.grcplatform.api.config.GrcServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * GRC API service.
 *
 * <p>Every request under {@code /api/**} passes through the authorization core before reaching a
 * controller:
 *
 * <ol>
 *   <li>{@code CorrelationIdFilter} binds the correlation id to the thread and the MDC
 *   <li>{@code AuthenticationFilter} verifies the bearer token and resolves principal and tenant
 *   <li>{@code AuthorizationInterceptor} applies the guard annotations declared on the handler
 * </ol>
 */
@SpringBootApplication
@EnableConfigurationProperties({GrcServiceProperties.class, GrcAuthProperties.class})
public class GrcApiApplication {

    private static final Logger log = LoggerFactory.getLogger(GrcApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GrcApiApplication.class, args);
        log.info("GRC API started");
    }
}
