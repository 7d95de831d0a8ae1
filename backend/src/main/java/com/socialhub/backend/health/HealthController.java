package com.socialhub.backend.health;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness on {@code /health}, readiness (database reachable) on {@code /health/ready}.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse(Status.UP.getCode(), clock.instant().toString());
    }

    @GetMapping("/health/ready")
    public HealthResponse ready() {
        try {
            HealthComponent component = healthEndpoint.health();
            String status = component.getStatus().getCode();
            if (component instanceof CompositeHealth composite
                    && composite.getComponents().get("db") instanceof Health db) {
                status = db.getStatus().getCode();
            }
            return new HealthResponse(status, clock.instant().toString());
        } catch (RuntimeException ex) {
            log.warn("Readiness probe failed: {}", ex.getMessage());
            return new HealthResponse(Status.DOWN.getCode(), clock.instant().toString());
        }
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
