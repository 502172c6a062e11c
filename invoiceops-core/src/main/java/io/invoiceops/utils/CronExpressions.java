package io.invoiceops.utils;

import io.invoiceops.exception.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TimeZone;
import java.util.TreeSet;

/**
 * Translates standard 5-field cron ({@code minute hour day-of-month month day-of-week}) into Quartz
 * {@link CronExpression}s wrapped in a {@link CronSchedule}.
 * <p>
 * Differences handled here:
 * <ul>
 *   <li>Quartz has a leading seconds field; it is always {@code 0}.</li>
 *   <li>Quartz numbers days of week 1-7 from Sunday; cron uses 0-7 with 0 and 7 both Sunday.</li>
 *   <li>Quartz needs {@code ?} in exactly one of the two day fields. When both are restricted the schedule
 *       fires only on days matching both fields, evaluated as two Quartz expressions.</li>
 * </ul>
 */
public final class CronExpressions {
    private CronExpressions() {
    }

    /**
     * Parse {@code expression} in {@code timezone}.
     *
     * @throws InvalidScheduleException when the expression or the zone is invalid, or the schedule never fires
     */
    public static CronSchedule parse(String expression, String timezone) {
        ZoneId zone = zone(expression, timezone);
        String[] parts = fields(expression);
        CronSchedule schedule;
        if (restrictsBothDays(parts)) {
            String dayOfWeek = toQuartzDayOfWeek(parts[4], expression);
            schedule = new CronSchedule(expression,
                    compile(quartz(parts, parts[2], "?"), expression, zone),
                    compile(quartz(parts, "?", dayOfWeek), expression, zone));
        } else {
            schedule = new CronSchedule(expression, compile(toQuartz(expression), expression, zone), null);
        }
        if (schedule.nextAfter(Instant.now()) == null) {
            throw new InvalidScheduleException("Cron expression never fires: " + expression, expression);
        }
        return schedule;
    }

    private static CronExpression compile(String quartz, String expression, ZoneId zone) {
        CronExpression cron;
        try {
            cron = new CronExpression(quartz);
        } catch (ParseException e) {
            throw new InvalidScheduleException("Invalid cron expression: " + expression + " (" + e.getMessage() + ")",
                    expression, e);
        }
        cron.setTimeZone(TimeZone.getTimeZone(zone));
        return cron;
    }

    /**
     * Validate without keeping the result.
     */
    public static void validate(String expression, String timezone) {
        parse(expression, timezone);
    }

    /**
     * Next firing strictly after {@code after}, or {@code null} when there is none.
     */
    public static Instant nextFireTime(String expression, String timezone, Instant after) {
        return parse(expression, timezone).nextAfter(after);
    }

    static ZoneId zone(String expression, String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidScheduleException("timezone must not be blank", expression);
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, expression, e);
        }
    }

    /**
     * Convert a 5-field cron expression that restricts at most one day field into Quartz syntax.
     */
    public static String toQuartz(String expression) {
        String[] parts = fields(expression);
        if (restrictsBothDays(parts)) {
            throw new InvalidScheduleException(
                    "Expression restricting both day fields has no single Quartz form: " + expression, expression);
        }
        String dom = parts[2];
        String dow = parts[4];
        if (isAny(dow)) {
            return quartz(parts, "?".equals(dom) ? "*" : dom, "?");
        }
        return quartz(parts, "?", toQuartzDayOfWeek(dow, expression));
    }

    private static String[] fields(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression must not be empty", expression);
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidScheduleException(
                    "Cron expression must have 5 fields (minute hour day-of-month month day-of-week), got "
                            + parts.length + ": " + expression, expression);
        }
        return parts;
    }

    private static boolean restrictsBothDays(String[] parts) {
        return !isAny(parts[2]) && !isAny(parts[4]);
    }

    private static boolean isAny(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String quartz(String[] parts, String dom, String dow) {
        return String.join(" ", "0", parts[0], parts[1], dom, parts[3].toUpperCase(Locale.ROOT), dow);
    }

    private static String toQuartzDayOfWeek(String field, String expression) {
        List<String> out = new ArrayList<>();
        for (String token : field.split(",")) {
            if (token.isEmpty()) {
                throw new InvalidScheduleException("Empty day-of-week list entry: " + expression, expression);
            }
            if (!token.chars().allMatch(c -> Character.isDigit(c) || c == '-' || c == '/' || c == '*')) {
                // names (MON-FRI), L and # forms are understood by Quartz as-is
                out.add(token.toUpperCase(Locale.ROOT));
                continue;
            }
            out.add(expandNumericDayOfWeek(token, expression));
        }
        return String.join(",", out);
    }

    private static String expandNumericDayOfWeek(String token, String expression) {
        String range = token;
        int step = 1;
        int slash = token.indexOf('/');
        if (slash >= 0) {
            range = token.substring(0, slash);
            step = parseDay(token.substring(slash + 1), expression);
            if (step <= 0) {
                throw new InvalidScheduleException("Day-of-week step must be positive: " + expression, expression);
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = 0;
            to = 6;
        } else if (range.contains("-")) {
            String[] bounds = range.split("-", -1);
            if (bounds.length != 2) {
                throw new InvalidScheduleException("Invalid day-of-week range: " + expression, expression);
            }
            from = parseDay(bounds[0], expression);
            to = parseDay(bounds[1], expression);
        } else {
            from = parseDay(range, expression);
            to = slash >= 0 ? 7 : from;
        }
        if (from > 7 || to > 7 || from > to) {
            throw new InvalidScheduleException("Day-of-week out of range (0-7): " + expression, expression);
        }

        TreeSet<Integer> days = new TreeSet<>();
        for (int d = from; d <= to; d += step) {
            days.add((d % 7) + 1);
        }
        List<String> values = new ArrayList<>(days.size());
        for (Integer d : days) {
            values.add(String.valueOf(d));
        }
        return String.join(",", values);
    }

    private static int parseDay(String value, String expression) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("Invalid day-of-week value '" + value + "': " + expression, expression, e);
        }
    }
}
