package io.invoiceops.utils;

import java.util.UUID;

public final class Ids {
    private Ids() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Webhook event id, {@code evt_} followed by 32 hex characters.
     */
    public static String eventId() {
        return "evt_" + hex();
    }

    public static String testEventId() {
        return "evt_test_" + hex();
    }

    private static String hex() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
