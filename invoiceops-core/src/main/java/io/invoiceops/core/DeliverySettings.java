package io.invoiceops.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Webhook request settings.
 *
 * @param requestTimeout      bound on one HTTP attempt
 * @param maxResponseBodySize response bodies are truncated to this many characters
 * @param userAgent           value of the {@code User-Agent} header
 * @param claimLease          how far the sweep pushes {@code nextRetryAt} while it owns a delivery
 */
public record DeliverySettings(
        Duration requestTimeout,
        int maxResponseBodySize,
        String userAgent,
        Duration claimLease
) {
    public DeliverySettings {
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        Objects.requireNonNull(claimLease, "claimLease must not be null");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be a positive duration");
        }
        if (maxResponseBodySize <= 0) {
            throw new IllegalArgumentException("maxResponseBodySize must be positive");
        }
    }

    public static DeliverySettings defaults() {
        return new DeliverySettings(Duration.ofSeconds(30), 5000, "InvoiceOps-Webhook/1.0", Duration.ofMinutes(5));
    }
}
