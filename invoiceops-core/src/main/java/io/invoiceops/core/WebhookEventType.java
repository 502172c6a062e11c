package io.invoiceops.core;

import java.util.ArrayList;
import java.util.List;

public enum WebhookEventType {

    VALIDATION_COMPLETED("validation.completed"),
    VALIDATION_VALID("validation.valid"),
    VALIDATION_INVALID("validation.invalid"),
    VALIDATION_WARNING("validation.warning"),
    TEST("test");

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static WebhookEventType fromValue(String value) {
        for (WebhookEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown webhook event type: " + value);
    }

    /**
     * Event types raised by one validation result, least specific first.
     */
    public static List<WebhookEventType> forOutcome(boolean valid, int warningCount) {
        List<WebhookEventType> events = new ArrayList<>(2);
        events.add(VALIDATION_COMPLETED);
        if (!valid) {
            events.add(VALIDATION_INVALID);
        } else if (warningCount > 0) {
            events.add(VALIDATION_WARNING);
        } else {
            events.add(VALIDATION_VALID);
        }
        return events;
    }
}
