package com.fitnexus.backend.health;

import java.time.Clock;
import java.time.Instant;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight liveness probe for load balancers; the full report stays on /actuator/health.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @Operation(summary = "Service health")
    @GetMapping("/health")
    public HealthResponse health() {
        HealthComponent health = healthEndpoint.health();
        return new HealthResponse(health.getStatus().getCode(), Instant.now(clock).toString());
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
