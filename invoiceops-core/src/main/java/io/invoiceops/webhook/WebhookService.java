package io.invoiceops.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoiceops.ValidationEventSink;
import io.invoiceops.core.DeliveryStatus;
import io.invoiceops.core.ValidationEvent;
import io.invoiceops.core.WebhookEventType;
import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;
import io.invoiceops.store.DeliveryStore;
import io.invoiceops.utils.Ids;
import io.invoiceops.utils.RetrySchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Webhook subscriptions and event fan-out.
 *
 * <p>Published events become {@code PENDING} deliveries that are attempted on the delivery executor;
 * failed attempts are picked up again by the retry sweep.
 */
public class WebhookService implements ValidationEventSink {
    private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

    private final DeliveryStore deliveryStore;
    private final DeliveryEngine deliveryEngine;
    private final Executor deliveryExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookService(
            DeliveryStore deliveryStore,
            DeliveryEngine deliveryEngine,
            Executor deliveryExecutor,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore must not be null");
        this.deliveryEngine = Objects.requireNonNull(deliveryEngine, "deliveryEngine must not be null");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onValidated(String ownerId, ValidationEvent event) {
        publish(ownerId, event);
    }

    /**
     * Create one delivery per active subscription of {@code ownerId} that subscribes to an event type
     * raised by {@code event}. The most specific matching type is sent.
     *
     * @return ids of the created deliveries
     */
    public List<String> publish(String ownerId, ValidationEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        List<WebhookSubscription> subscriptions = deliveryStore.findActiveSubscriptions(ownerId);
        if (subscriptions.isEmpty()) {
            return List.of();
        }

        List<WebhookEventType> raised = WebhookEventType.forOutcome(event.valid(), event.warningCount());
        List<String> deliveryIds = new ArrayList<>();
        for (WebhookSubscription subscription : subscriptions) {
            WebhookEventType type = mostSpecificMatch(raised, subscription);
            if (type == null) {
                continue;
            }
            ValidationEventPayload payload = ValidationEventPayload.of(type, event, clock.instant());
            DeliveryAttempt delivery = enqueue(subscription, type.value(), payload, RetrySchedule.MAX_ATTEMPTS);
            deliveryIds.add(delivery.getId());
            dispatch(delivery);
        }

        log.info("Triggered webhooks owner={} validationId={} deliveries={}",
                ownerId, event.validationId(), deliveryIds.size());
        return deliveryIds;
    }

    /**
     * Send a synthetic {@code test} event with a single attempt and no retries.
     *
     * @throws IllegalArgumentException when the subscription does not exist for the owner
     */
    public DeliveryAttempt sendTestEvent(String subscriptionId, String ownerId) {
        WebhookSubscription subscription = requireSubscription(subscriptionId, ownerId);
        ValidationEventPayload payload = ValidationEventPayload.test(clock.instant());
        DeliveryAttempt delivery = enqueue(subscription, WebhookEventType.TEST.value(), payload, 1);
        return deliveryEngine.attempt(delivery);
    }

    /**
     * Manual retry. An open delivery is attempted now. A failed delivery is re-sent as a new delivery
     * with the same event id, so the receiver can deduplicate. A successful delivery is returned as is.
     */
    public DeliveryAttempt retryDelivery(String deliveryId, String ownerId) {
        DeliveryAttempt delivery = deliveryStore.findDelivery(deliveryId)
                .orElseThrow(() -> new IllegalArgumentException("Delivery not found: " + deliveryId));
        WebhookSubscription subscription = requireSubscription(delivery.getSubscriptionId(), ownerId);

        if (delivery.getStatus() == DeliveryStatus.SUCCESS) {
            return delivery;
        }
        if (!delivery.isTerminal()) {
            log.info("Manual retry of open delivery id={}", deliveryId);
            return deliveryEngine.attempt(delivery);
        }

        Instant now = clock.instant();
        DeliveryAttempt resend = DeliveryAttempt.pending(
                Ids.newId(),
                subscription.getId(),
                delivery.getEventType(),
                delivery.getEventId(),
                delivery.getPayload(),
                delivery.getMaxAttempts(),
                now
        );
        deliveryStore.insertDelivery(resend);
        deliveryStore.recordDeliveryEnqueued(subscription.getId(), now);
        log.info("Manual retry of failed delivery id={} newDeliveryId={} eventId={}",
                deliveryId, resend.getId(), resend.getEventId());
        return deliveryEngine.attempt(resend);
    }

    public WebhookSubscription createSubscription(String ownerId, String url, Collection<WebhookEventType> events,
                                                  String description) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        validateUrl(url);
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }

        Instant now = clock.instant();
        WebhookSubscription subscription = new WebhookSubscription();
        subscription.setId(Ids.newId());
        subscription.setOwnerId(ownerId);
        subscription.setUrl(url);
        subscription.setEvents(events.stream().map(WebhookEventType::value).distinct().toList());
        subscription.setSecret(WebhookSigner.generateSecret());
        subscription.setActive(true);
        subscription.setDescription(description);
        subscription.setCreatedAt(now);
        subscription.setUpdatedAt(now);
        deliveryStore.saveSubscription(subscription);
        log.info("Created webhook subscription id={} owner={} events={}", subscription.getId(), ownerId,
                subscription.getEvents());
        return subscription;
    }

    public WebhookSubscription setActive(String subscriptionId, String ownerId, boolean active) {
        WebhookSubscription subscription = requireSubscription(subscriptionId, ownerId);
        subscription.setActive(active);
        subscription.setUpdatedAt(clock.instant());
        return deliveryStore.saveSubscription(subscription);
    }

    /**
     * Replace the signing secret. Deliveries already in flight are signed with the new secret on their next attempt.
     */
    public WebhookSubscription rotateSecret(String subscriptionId, String ownerId) {
        WebhookSubscription subscription = requireSubscription(subscriptionId, ownerId);
        subscription.setSecret(WebhookSigner.generateSecret());
        subscription.setUpdatedAt(clock.instant());
        log.info("Rotated webhook secret id={}", subscriptionId);
        return deliveryStore.saveSubscription(subscription);
    }

    public boolean deleteSubscription(String subscriptionId, String ownerId) {
        if (deliveryStore.findSubscription(subscriptionId, ownerId).isEmpty()) {
            return false;
        }
        return deliveryStore.deleteSubscription(subscriptionId);
    }

    public List<WebhookSubscription> subscriptions(String ownerId) {
        return deliveryStore.findSubscriptions(ownerId);
    }

    /**
     * Newest first.
     */
    public List<DeliveryAttempt> deliveries(String subscriptionId, String ownerId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        requireSubscription(subscriptionId, ownerId);
        return deliveryStore.findDeliveries(subscriptionId, limit);
    }

    private DeliveryAttempt enqueue(WebhookSubscription subscription, String eventType, ValidationEventPayload payload,
                                    int maxAttempts) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Webhook payload cannot be serialized", e);
        }
        Instant now = clock.instant();
        DeliveryAttempt delivery = DeliveryAttempt.pending(
                Ids.newId(), subscription.getId(), eventType, payload.eventId(), body, maxAttempts, now);
        deliveryStore.insertDelivery(delivery);
        deliveryStore.recordDeliveryEnqueued(subscription.getId(), now);
        return delivery;
    }

    private void dispatch(DeliveryAttempt delivery) {
        try {
            deliveryExecutor.execute(() -> {
                try {
                    deliveryEngine.attempt(delivery);
                } catch (RuntimeException e) {
                    log.error("Webhook delivery attempt failed id={} msg={}", delivery.getId(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected delivery id={}; it stays pending", delivery.getId());
        }
    }

    private WebhookSubscription requireSubscription(String subscriptionId, String ownerId) {
        return deliveryStore.findSubscription(subscriptionId, ownerId)
                .orElseThrow(() -> new IllegalArgumentException("Webhook subscription not found: " + subscriptionId));
    }

    private static WebhookEventType mostSpecificMatch(List<WebhookEventType> raised, WebhookSubscription subscription) {
        WebhookEventType match = null;
        for (WebhookEventType type : raised) {
            if (subscription.subscribesTo(type)) {
                match = type;
            }
        }
        return match;
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid webhook URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Webhook URL must use http or https: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Webhook URL must name a host: " + url);
        }
        if (uri.getPort() > 65535) {
            throw new IllegalArgumentException("Webhook URL port out of range: " + url);
        }
    }
}
