package com.adlanda.knowledgesync.health;

import com.adlanda.knowledgesync.model.CycleStats;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SyncHealthIndicatorTest {

    private final SyncHealthIndicator indicator = new SyncHealthIndicator();

    @Test
    void health_beforeFirstCycle_isUp() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("lastCycle", "never");
    }

    @Test
    void recordCycle_partialFailure_staysUp() {
        indicator.recordCycle(new CycleStats(3, 1, 1, 10, 12, 0, false, true, Duration.ofMillis(250)));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("processed", 3)
                .containsEntry("errors", 1)
                .containsEntry("degradedState", true)
                .containsEntry("durationMs", 250L)
                .doesNotContainKey("error");
    }

    @Test
    void recordCycle_everyAttemptFailed_isDown() {
        indicator.recordCycle(new CycleStats(0, 0, 4, 0, 0, 0, false, false, Duration.ZERO));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "All 4 attempted items failed");
    }

    @Test
    void recordCycle_nothingToDo_isUp() {
        indicator.recordCycle(new CycleStats(0, 0, 0, 7, 0, 0, false, false, Duration.ZERO));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void markUnhealthy_reportsError() {
        indicator.markUnhealthy("Source unavailable: /docs");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "Source unavailable: /docs");
    }
}
