package com.flareweather.insight.health;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for the formatting service. The pipeline holds no external connections, so being
 * able to answer is the whole check.
 */
@RestController
public class HealthzController {

    private final String serviceName;

    public HealthzController(@Value("${spring.application.name:insight-svc}") String serviceName) {
        this.serviceName = serviceName;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of("status", "UP", "service", serviceName);
    }
}
