package io.invoiceops.exception;

/**
 * A cron expression or timezone was rejected at registration time.
 * Nothing is registered or stored when this is thrown.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    private final String cronExpression;

    public InvalidScheduleException(String message, String cronExpression) {
        super(message);
        this.cronExpression = cronExpression;
    }

    public InvalidScheduleException(String message, String cronExpression, Throwable cause) {
        super(message, cause);
        this.cronExpression = cronExpression;
    }

    public String cronExpression() {
        return cronExpression;
    }
}
