package io.invoiceops.testing;

import io.invoiceops.core.DeliveryStatus;
import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;
import io.invoiceops.store.DeliveryStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Map-backed store. Deliveries are stored as copies so a rejected write-back is observable.
 */
public class InMemoryDeliveryStore implements DeliveryStore {

    private final Map<String, WebhookSubscription> subscriptions = new LinkedHashMap<>();
    private final Map<String, DeliveryAttempt> deliveries = new LinkedHashMap<>();

    @Override
    public synchronized Optional<WebhookSubscription> findSubscription(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    @Override
    public synchronized Optional<WebhookSubscription> findSubscription(String subscriptionId, String ownerId) {
        return findSubscription(subscriptionId).filter(s -> Objects.equals(s.getOwnerId(), ownerId));
    }

    @Override
    public synchronized List<WebhookSubscription> findSubscriptions(String ownerId) {
        return subscriptions.values().stream().filter(s -> Objects.equals(s.getOwnerId(), ownerId)).toList();
    }

    @Override
    public synchronized List<WebhookSubscription> findActiveSubscriptions(String ownerId) {
        return findSubscriptions(ownerId).stream().filter(WebhookSubscription::isActive).toList();
    }

    @Override
    public synchronized WebhookSubscription saveSubscription(WebhookSubscription subscription) {
        subscriptions.put(subscription.getId(), subscription);
        return subscription;
    }

    @Override
    public synchronized boolean deleteSubscription(String subscriptionId) {
        deliveries.values().removeIf(d -> subscriptionId.equals(d.getSubscriptionId()));
        return subscriptions.remove(subscriptionId) != null;
    }

    @Override
    public synchronized void insertDelivery(DeliveryAttempt delivery) {
        deliveries.put(delivery.getId(), copy(delivery));
    }

    @Override
    public synchronized boolean saveDelivery(DeliveryAttempt delivery) {
        DeliveryAttempt stored = deliveries.get(delivery.getId());
        if (stored == null || stored.isTerminal()) {
            return false;
        }
        deliveries.put(delivery.getId(), copy(delivery));
        return true;
    }

    @Override
    public synchronized Optional<DeliveryAttempt> findDelivery(String deliveryId) {
        return Optional.ofNullable(deliveries.get(deliveryId)).map(InMemoryDeliveryStore::copy);
    }

    @Override
    public synchronized List<DeliveryAttempt> findDeliveries(String subscriptionId, int limit) {
        List<DeliveryAttempt> result = new ArrayList<>();
        deliveries.values().stream()
                .filter(d -> subscriptionId.equals(d.getSubscriptionId()))
                .sorted(Comparator.comparing(DeliveryAttempt::getCreatedAt).reversed())
                .limit(limit)
                .forEach(d -> result.add(copy(d)));
        return result;
    }

    @Override
    public synchronized List<DeliveryAttempt> claimDueRetries(Instant now, int limit, Duration lease) {
        List<DeliveryAttempt> due = deliveries.values().stream()
                .filter(d -> d.getStatus() == DeliveryStatus.RETRYING)
                .filter(d -> d.getNextRetryAt() != null && !d.getNextRetryAt().isAfter(now))
                .sorted(Comparator.comparing(DeliveryAttempt::getNextRetryAt))
                .limit(limit)
                .toList();
        List<DeliveryAttempt> claimed = new ArrayList<>(due.size());
        for (DeliveryAttempt d : due) {
            claimed.add(copy(d));
            d.setNextRetryAt(now.plus(lease));
        }
        return claimed;
    }

    @Override
    public synchronized void recordDeliveryEnqueued(String subscriptionId, Instant at) {
        WebhookSubscription s = subscriptions.get(subscriptionId);
        if (s != null) {
            s.setTotalDeliveries(s.getTotalDeliveries() + 1);
            s.setLastTriggeredAt(at);
        }
    }

    @Override
    public synchronized void recordDeliverySuccess(String subscriptionId, Instant at) {
        WebhookSubscription s = subscriptions.get(subscriptionId);
        if (s != null) {
            s.setSuccessfulDeliveries(s.getSuccessfulDeliveries() + 1);
            s.setLastSuccessAt(at);
        }
    }

    @Override
    public synchronized void recordDeliveryFailure(String subscriptionId, Instant at, boolean terminal) {
        WebhookSubscription s = subscriptions.get(subscriptionId);
        if (s != null) {
            if (terminal) {
                s.setFailedDeliveries(s.getFailedDeliveries() + 1);
            }
            s.setLastFailureAt(at);
        }
    }

    static DeliveryAttempt copy(DeliveryAttempt d) {
        DeliveryAttempt c = new DeliveryAttempt();
        c.setId(d.getId());
        c.setSubscriptionId(d.getSubscriptionId());
        c.setEventType(d.getEventType());
        c.setEventId(d.getEventId());
        c.setPayload(d.getPayload());
        c.setStatus(d.getStatus());
        c.setAttemptCount(d.getAttemptCount());
        c.setMaxAttempts(d.getMaxAttempts());
        c.setNextRetryAt(d.getNextRetryAt());
        c.setResponseStatusCode(d.getResponseStatusCode());
        c.setResponseBody(d.getResponseBody());
        c.setResponseTimeMs(d.getResponseTimeMs());
        c.setErrorMessage(d.getErrorMessage());
        c.setCreatedAt(d.getCreatedAt());
        c.setLastAttemptAt(d.getLastAttemptAt());
        c.setCompletedAt(d.getCompletedAt());
        return c;
    }
}
