package com.adlanda.recommender.health;

import com.adlanda.recommender.model.SyncResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the embedding sync.
 *
 * Reports the last sync run:
 * - UP with created/deleted/error counts when the run could start
 * - DOWN with the reason when the run could not start (catalog or index unreachable)
 * - UNKNOWN before the first run
 */
@Component
public class SyncHealthIndicator implements HealthIndicator {

    private final Clock clock;

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(null, null, null, "Sync not yet run", null)
    );

    public SyncHealthIndicator() {
        this(Clock.systemUTC());
    }

    SyncHealthIndicator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a completed run. Per-item errors do not make the run unhealthy.
     */
    public void markHealthy(SyncResult result) {
        state.set(new HealthState(true, result, null, null, clock.instant()));
    }

    /**
     * Records a run that could not start.
     */
    public void markUnhealthy(String error) {
        state.set(new HealthState(false, null, error, null, clock.instant()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy() == null) {
            return Health.unknown()
                    .withDetail("status", current.note())
                    .build();
        }

        if (current.healthy()) {
            SyncResult result = current.result();
            return Health.up()
                    .withDetail("lastRun", current.timestamp().toString())
                    .withDetail("created", result.created())
                    .withDetail("updated", result.updated())
                    .withDetail("deleted", result.deleted())
                    .withDetail("skipped", result.skipped())
                    .withDetail("errors", result.errors().size())
                    .withDetail("durationMs", result.durationMs())
                    .build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp().toString())
                .build();
    }

    private record HealthState(
            Boolean healthy,
            SyncResult result,
            String error,
            String note,
            Instant timestamp
    ) {}
}
