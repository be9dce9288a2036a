package com.grcplatform.api.api;

import com.grcplatform.api.config.GrcServiceProperties;
import java.time.Clock;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public service info endpoint; served without authentication.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final GrcServiceProperties properties;
    private final Clock clock;

    public ServiceInfoController(GrcServiceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description(),
                "status", "running",
                "timestamp", clock.instant().toString());
    }
}
