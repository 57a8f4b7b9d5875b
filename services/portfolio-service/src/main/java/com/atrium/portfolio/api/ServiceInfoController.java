package com.atrium.portfolio.api;

import com.atrium.portfolio.config.AtriumProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight, unauthenticated service info endpoint. Build metadata lives under
 * {@code /actuator/info}.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final AtriumProperties properties;

    public ServiceInfoController(AtriumProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
