package com.adlanda.dailytoon.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the image synthesis upstream.
 *
 * Reports the outcome of the last synthesis:
 * - UP until a synthesis exhausts its retries, and again after the next success
 * - DOWN with the last upstream status after retries were exhausted
 *
 * A rejected prompt (4xx) says nothing about upstream availability and does
 * not change the state.
 */
@Component
public class SynthesisHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null, 0)
    );

    /**
     * Records a successful synthesis.
     */
    public void markHealthy(int attempts) {
        state.set(new HealthState(true, null, null, Instant.now(), attempts));
    }

    /**
     * Records a synthesis that failed after all retries.
     */
    public void markUnhealthy(int lastStatus, String error) {
        state.set(new HealthState(false, lastStatus, error, Instant.now(), 0));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastSuccess", current.timestamp() != null ? current.timestamp().toString() : "never");
            if (current.timestamp() != null) {
                builder.withDetail("attempts", current.attempts());
            }
            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastStatus", current.lastStatus())
                .withDetail("lastAttempt", current.timestamp().toString())
                .build();
    }

    private record HealthState(
            boolean healthy,
            Integer lastStatus,
            String error,
            Instant timestamp,
            int attempts
    ) {}
}
