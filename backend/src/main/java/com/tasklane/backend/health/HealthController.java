package com.tasklane.backend.health;

import java.time.Clock;
import java.time.Instant;

import io.swagger.v3.oas.annotations.Operation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness probe. Always answers 200; the body reports whether the
 * database health indicator is up.
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
    @Operation(summary = "Service and database status")
    public HealthResponse health() {
        return new HealthResponse("healthy", databaseStatus(), Instant.now(clock).toString());
    }

    private String databaseStatus() {
        try {
            HealthComponent component = healthEndpoint.health();
            Status status = component.getStatus();
            if (component instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus();
                }
            }
            return Status.UP.equals(status) ? "connected" : "disconnected";
        } catch (RuntimeException ex) {
            log.warn("Health check failed: {}", ex.getMessage());
            return "disconnected";
        }
    }

    public record HealthResponse(
            String status,
            String database,
            String timestamp
    ) {
    }
}
