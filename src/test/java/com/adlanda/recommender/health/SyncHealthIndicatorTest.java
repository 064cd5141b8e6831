package com.adlanda.recommender.health;

import com.adlanda.recommender.MutableClock;
import com.adlanda.recommender.model.SyncError;
import com.adlanda.recommender.model.SyncResult;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncHealthIndicatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final SyncHealthIndicator indicator = new SyncHealthIndicator(clock);

    @Test
    void health_beforeFirstRun_isUnknown() {
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }

    @Test
    void health_runWithItemErrors_isStillUp() {
        indicator.markHealthy(new SyncResult(4, 1, 2, 1, 1, List.of(new SyncError("x", "boom")), 120));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("lastRun", "2024-03-01T10:00:00Z")
                .containsEntry("created", 4)
                .containsEntry("deleted", 2)
                .containsEntry("errors", 1)
                .containsEntry("durationMs", 120L);
    }

    @Test
    void health_runCouldNotStart_isDown() {
        indicator.markHealthy(new SyncResult(0, 0, 0, 0, 0, List.of(), 5));
        indicator.markUnhealthy("catalog unreachable");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "catalog unreachable");
    }

    @Test
    void health_recoversAfterSuccessfulRun() {
        indicator.markUnhealthy("catalog unreachable");
        indicator.markHealthy(new SyncResult(1, 0, 0, 0, 1, List.of(), 5));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }
}
