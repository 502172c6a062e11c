package io.invoiceops.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Firing policy of the cron scheduler.
 *
 * @param workerThreads    size of the pool that executes job bodies
 * @param misfireGraceTime how late a firing may still run; later firings are dropped
 * @param coalesce         collapse several missed firings into one catch-up firing
 * @param shutdownTimeout  how long {@code shutdown(true)} waits for in-flight runs
 */
public record SchedulerSettings(
        int workerThreads,
        Duration misfireGraceTime,
        boolean coalesce,
        Duration shutdownTimeout
) {
    public SchedulerSettings {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        Objects.requireNonNull(misfireGraceTime, "misfireGraceTime must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        if (misfireGraceTime.isNegative()) {
            throw new IllegalArgumentException("misfireGraceTime must not be negative");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(8, Duration.ofMinutes(5), true, Duration.ofSeconds(30));
    }
}
