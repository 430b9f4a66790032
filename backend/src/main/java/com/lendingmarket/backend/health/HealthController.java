package com.lendingmarket.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /health}, {@code /healthz}) and readiness ({@code /readyz}) probes.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping({"/health", "/healthz"})
    public HealthResponse health() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    /**
     * Reports the database indicator when present, otherwise the aggregate status.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent healthComponent = healthEndpoint.health();
        String status = healthComponent.getStatus().getCode();
        if (healthComponent instanceof CompositeHealth composite) {
            HealthComponent db = composite.getComponents().get("db");
            if (db instanceof Health dbHealth) {
                status = dbHealth.getStatus().getCode();
            }
        }
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
