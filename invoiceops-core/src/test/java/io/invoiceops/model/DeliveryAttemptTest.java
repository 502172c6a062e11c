package io.invoiceops.model;

import io.invoiceops.core.DeliveryStatus;
import io.invoiceops.utils.RetrySchedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryAttemptTest {

    private static final Instant T0 = Instant.parse("2026-03-02T06:00:00Z");

    @Test
    void failuresShouldRetryUntilMaxAttempts() {
        DeliveryAttempt d = DeliveryAttempt.pending("d-1", "s-1", "validation.valid", "evt_1", "{}", 4, T0);

        for (int i = 0; i < 3; i++) {
            boolean terminal = d.markFailure(T0, 500, null, 10L, "HTTP 500", RetrySchedule.delayAfter(i + 1));
            assertFalse(terminal);
            assertEquals(DeliveryStatus.RETRYING, d.getStatus());
            assertEquals(i + 1, d.getAttemptCount());
            assertEquals(T0.plus(RetrySchedule.delayAfter(i + 1)), d.getNextRetryAt());
        }

        assertTrue(d.markFailure(T0, 500, null, 10L, "HTTP 500", Duration.ofMinutes(120)));
        assertEquals(DeliveryStatus.FAILED, d.getStatus());
        assertEquals(4, d.getAttemptCount());
        assertNull(d.getNextRetryAt());
        assertEquals(T0, d.getCompletedAt());
    }

    @Test
    void terminalDeliveryShouldRejectTransitions() {
        DeliveryAttempt d = DeliveryAttempt.pending("d-1", "s-1", "test", "evt_1", "{}", 4, T0);
        d.markSuccess(T0, 200, "ok", 5);

        assertThrows(IllegalStateException.class,
                () -> d.markFailure(T0, 500, null, null, "late", Duration.ofMinutes(1)));
        assertThrows(IllegalStateException.class, () -> d.markAbandoned(T0, "inactive"));
        assertEquals(DeliveryStatus.SUCCESS, d.getStatus());
    }

    @Test
    void abandonShouldNotCountAsAttempt() {
        DeliveryAttempt d = DeliveryAttempt.pending("d-1", "s-1", "test", "evt_1", "{}", 4, T0);

        d.markAbandoned(T0, "Subscription is inactive");

        assertTrue(d.isTerminal());
        assertEquals(0, d.getAttemptCount());
        assertEquals("Subscription is inactive", d.getErrorMessage());
    }

    @Test
    void maxAttemptsMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> DeliveryAttempt.pending("d-1", "s-1", "test", "evt_1", "{}", 0, T0));
    }
}
