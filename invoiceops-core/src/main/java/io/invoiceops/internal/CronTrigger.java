package io.invoiceops.internal;

import io.invoiceops.utils.CronExpressions;
import io.invoiceops.utils.CronSchedule;

import java.time.Instant;

/**
 * A parsed cron schedule bound to the expression and zone it was registered with.
 */
final class CronTrigger {

    private final String expression;
    private final String timezone;
    private final CronSchedule schedule;

    private CronTrigger(String expression, String timezone, CronSchedule schedule) {
        this.expression = expression;
        this.timezone = timezone;
        this.schedule = schedule;
    }

    static CronTrigger parse(String expression, String timezone) {
        return new CronTrigger(expression, timezone, CronExpressions.parse(expression, timezone));
    }

    Instant nextAfter(Instant after) {
        return schedule.nextAfter(after);
    }

    String expression() {
        return expression;
    }

    String timezone() {
        return timezone;
    }
}
