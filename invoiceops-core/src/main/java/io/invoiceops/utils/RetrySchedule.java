package io.invoiceops.utils;

import java.time.Duration;
import java.util.List;

/**
 * Fixed-step webhook retry schedule with a ceiling step.
 */
public final class RetrySchedule {
    private RetrySchedule() {
    }

    public static final List<Integer> RETRY_SCHEDULE_MINUTES = List.of(1, 5, 30, 120);

    public static final int MAX_ATTEMPTS = 4;

    /**
     * Delay before the next attempt of a delivery whose attempt count, including the attempt that just
     * failed, is {@code attemptCount}. The schedule is indexed by that count, so the first retry waits
     * 5 minutes; the last step repeats once the schedule is exhausted.
     */
    public static Duration delayAfter(int attemptCount) {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must not be negative");
        }
        int index = Math.min(attemptCount, RETRY_SCHEDULE_MINUTES.size() - 1);
        return Duration.ofMinutes(RETRY_SCHEDULE_MINUTES.get(index));
    }
}
