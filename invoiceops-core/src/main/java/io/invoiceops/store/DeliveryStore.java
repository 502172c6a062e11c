package io.invoiceops.store;

import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of webhook subscriptions and their deliveries.
 */
public interface DeliveryStore {

    Optional<WebhookSubscription> findSubscription(String subscriptionId);

    Optional<WebhookSubscription> findSubscription(String subscriptionId, String ownerId);

    List<WebhookSubscription> findSubscriptions(String ownerId);

    List<WebhookSubscription> findActiveSubscriptions(String ownerId);

    WebhookSubscription saveSubscription(WebhookSubscription subscription);

    /**
     * Delete the subscription with its deliveries.
     */
    boolean deleteSubscription(String subscriptionId);

    void insertDelivery(DeliveryAttempt delivery);

    /**
     * Write back a delivery after an attempt. The write is rejected when the stored record is
     * already terminal.
     *
     * @return whether the record was written
     */
    boolean saveDelivery(DeliveryAttempt delivery);

    Optional<DeliveryAttempt> findDelivery(String deliveryId);

    /**
     * Newest first.
     */
    List<DeliveryAttempt> findDeliveries(String subscriptionId, int limit);

    /**
     * Atomically claim at most {@code limit} {@code RETRYING} deliveries with {@code nextRetryAt <= now},
     * oldest first. Each claimed record has its {@code nextRetryAt} pushed to {@code now + lease} so
     * a concurrent sweep does not pick it up again.
     *
     * @return the claimed deliveries as they were before the lease was applied
     */
    List<DeliveryAttempt> claimDueRetries(Instant now, int limit, Duration lease);

    void recordDeliveryEnqueued(String subscriptionId, Instant at);

    void recordDeliverySuccess(String subscriptionId, Instant at);

    /**
     * @param terminal whether the delivery ran out of attempts; only then the failed counter moves
     */
    void recordDeliveryFailure(String subscriptionId, Instant at, boolean terminal);
}
