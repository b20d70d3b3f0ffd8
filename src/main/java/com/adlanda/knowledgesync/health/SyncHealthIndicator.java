package com.adlanda.knowledgesync.health;

import com.adlanda.knowledgesync.model.CycleStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for document synchronization.
 *
 * Reports the outcome of the last sync cycle, including:
 * - Processed, deleted and failed item counts
 * - Whether the checkpoint had to go to the fallback file
 * - Timestamp of last cycle
 * - Error details if the cycle aborted
 */
@Component("sync")
public class SyncHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null)
    );

    /**
     * Records a cycle that ran to completion (possibly with item errors).
     */
    public void recordCycle(CycleStats stats) {
        state.set(new HealthState(
                !stats.isTotalFailure(),
                stats,
                stats.isTotalFailure() ? "All " + stats.attempted() + " attempted items failed" : null,
                Instant.now()
        ));
    }

    /**
     * Records a cycle that aborted before its items were accounted for.
     */
    public void markUnhealthy(String error) {
        state.set(new HealthState(
                false,
                null,
                error,
                Instant.now()
        ));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        Health.Builder builder = current.healthy() ? Health.up() : Health.down();
        builder.withDetail("lastCycle", current.timestamp() != null ? current.timestamp().toString() : "never");

        if (current.stats() != null) {
            CycleStats stats = current.stats();
            builder.withDetail("processed", stats.processed())
                   .withDetail("deleted", stats.deleted())
                   .withDetail("errors", stats.errors())
                   .withDetail("unchanged", stats.unchanged())
                   .withDetail("listingErrors", stats.listingErrors())
                   .withDetail("degradedState", stats.degradedState())
                   .withDetail("durationMs", stats.duration().toMillis());
        }
        if (current.error() != null) {
            builder.withDetail("error", current.error());
        }

        return builder.build();
    }

    /**
     * Internal state holder for thread-safe health updates.
     */
    private record HealthState(
            boolean healthy,
            CycleStats stats,
            String error,
            Instant timestamp
    ) {}
}
