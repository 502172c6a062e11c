package io.invoiceops.core;

import java.time.Instant;

/**
 * Snapshot of one scheduler registration.
 */
public record ScheduleEntry(
        String jobId,
        String cronExpression,
        String timezone,
        Instant nextFireTime,
        boolean paused,
        boolean running
) {
}
