package io.invoiceops.utils;

import org.quartz.CronExpression;

import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * A parsed 5-field cron schedule.
 * <p>
 * When both day-of-month and day-of-week are restricted a firing must satisfy both, so the schedule holds
 * one Quartz expression per day field and steps between their fire times until they agree. Quartz
 * {@link CronExpression} is not thread-safe, so evaluation is serialized.
 */
public final class CronSchedule {

    private static final int MAX_SEARCH_STEPS = 10_000;

    private final String expression;
    private final CronExpression primary;
    private final CronExpression dayOfWeek;

    CronSchedule(String expression, CronExpression primary, CronExpression dayOfWeek) {
        this.expression = expression;
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        this.dayOfWeek = dayOfWeek;
    }

    /**
     * Next firing strictly after {@code after}, or {@code null} when there is none.
     */
    public synchronized Instant nextAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        Date cursor = Date.from(after);
        for (int i = 0; i < MAX_SEARCH_STEPS; i++) {
            Date next = primary.getNextValidTimeAfter(cursor);
            if (next == null || dayOfWeek == null) {
                return next == null ? null : next.toInstant();
            }
            Date other = dayOfWeek.getNextValidTimeAfter(cursor);
            if (other == null) {
                return null;
            }
            if (next.equals(other)) {
                return next.toInstant();
            }
            // no common firing lies before the later of the two; resume just before it
            Date later = next.after(other) ? next : other;
            cursor = new Date(later.getTime() - 1000L);
        }
        return null;
    }

    public boolean restrictsBothDays() {
        return dayOfWeek != null;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
