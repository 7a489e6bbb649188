package com.appforge.orchestrator.api;

import com.appforge.orchestrator.config.AppForgeProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe. No side effects; answers as long as the process serves HTTP.
 */
@RestController
public class HealthController {

    private final AppForgeProperties.Service service;

    public HealthController(AppForgeProperties properties) {
        this.service = properties.service();
    }

    @GetMapping("/")
    public Map<String, String> health() {
        return Map.of(
                "status",  "ok",
                "service", service.name(),
                "version", service.version());
    }
}
