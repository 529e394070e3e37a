package com.skillmap.catalog.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoints for load balancers and quick manual checks.
 * Deeper checks (database, disk) live under /actuator/health.
 */
@RestController
public class HealthController {

    @GetMapping("/")
    public String root() {
        return "Hello from Topic & Skill Service!";
    }

    @GetMapping("/healthz")
    public Map<String, String> healthz() {
        return Map.of("status", "ok");
    }
}
