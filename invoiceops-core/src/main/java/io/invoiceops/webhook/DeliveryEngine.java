package io.invoiceops.webhook;

import io.invoiceops.core.DeliverySettings;
import io.invoiceops.exception.DeliveryException;
import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;
import io.invoiceops.store.DeliveryStore;
import io.invoiceops.utils.RetrySchedule;
import io.invoiceops.utils.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sends webhook deliveries and drives their retry state machine.
 *
 * <p>{@link #attempt(DeliveryAttempt)} never throws for delivery failures: non-2xx responses,
 * timeouts and connection errors are recorded on the delivery and scheduled for retry per
 * {@link RetrySchedule}.
 */
public class DeliveryEngine {
    private static final Logger log = LoggerFactory.getLogger(DeliveryEngine.class);

    public static final String INACTIVE_SUBSCRIPTION = "Subscription is inactive";

    private static final int MAX_ERROR_LENGTH = 1000;

    private final DeliveryStore deliveryStore;
    private final HttpClient httpClient;
    private final DeliverySettings settings;
    private final Clock clock;

    public DeliveryEngine(DeliveryStore deliveryStore, HttpClient httpClient, DeliverySettings settings, Clock clock) {
        this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Make one delivery attempt. Terminal deliveries are returned unchanged.
     */
    public DeliveryAttempt attempt(DeliveryAttempt delivery) {
        Objects.requireNonNull(delivery, "delivery must not be null");
        if (delivery.isTerminal()) {
            log.debug("Delivery already terminal, skipping id={} status={}", delivery.getId(), delivery.getStatus());
            return delivery;
        }

        WebhookSubscription subscription = deliveryStore.findSubscription(delivery.getSubscriptionId()).orElse(null);
        if (subscription == null || !subscription.isActive()) {
            log.warn("Subscription inactive for delivery id={} subscriptionId={}",
                    delivery.getId(), delivery.getSubscriptionId());
            delivery.markAbandoned(clock.instant(), INACTIVE_SUBSCRIPTION);
            persist(delivery);
            return delivery;
        }

        long startNanos = System.nanoTime();
        try {
            HttpResponse<String> response = send(subscription, delivery);
            long latencyMs = elapsedMillis(startNanos);
            int statusCode = response.statusCode();
            String body = Texts.truncate(response.body(), settings.maxResponseBodySize());

            if (statusCode < 200 || statusCode > 299) {
                throw new DeliveryException("HTTP " + statusCode, statusCode, body);
            }

            Instant at = clock.instant();
            delivery.markSuccess(at, statusCode, body, latencyMs);
            persist(delivery);
            deliveryStore.recordDeliverySuccess(subscription.getId(), at);
            log.info("Webhook delivered id={} subscriptionId={} status={} timeMs={}",
                    delivery.getId(), subscription.getId(), statusCode, latencyMs);
        } catch (DeliveryException e) {
            onFailure(delivery, subscription, e, elapsedMillis(startNanos));
        }
        return delivery;
    }

    /**
     * Re-attempt {@code RETRYING} deliveries whose retry time has passed.
     *
     * @return number of deliveries attempted
     */
    public int sweepDueRetries(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        List<DeliveryAttempt> due = deliveryStore.claimDueRetries(clock.instant(), limit, settings.claimLease());
        for (DeliveryAttempt delivery : due) {
            try {
                attempt(delivery);
            } catch (RuntimeException e) {
                // store failure; the lease expires and a later sweep picks the delivery up again
                log.error("Retry attempt failed id={} msg={}", delivery.getId(), e.getMessage(), e);
            }
        }
        if (!due.isEmpty()) {
            log.info("Processed webhook retries count={}", due.size());
        }
        return due.size();
    }

    private HttpResponse<String> send(WebhookSubscription subscription, DeliveryAttempt delivery) {
        String payload = delivery.getPayload();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(subscription.getUrl()))
                    .header("Content-Type", "application/json")
                    .header("X-Webhook-ID", subscription.getId())
                    .header("X-Webhook-Event", delivery.getEventType())
                    .header("X-Webhook-Delivery", delivery.getId())
                    .header(WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(payload, subscription.getSecret()))
                    .header("User-Agent", settings.userAgent())
                    .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                    .timeout(settings.requestTimeout())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new DeliveryException("Invalid webhook URL: " + subscription.getUrl(), e);
        }

        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new DeliveryException("Request timed out after " + settings.requestTimeout().toSeconds() + "s", e);
        } catch (IOException e) {
            throw new DeliveryException("Connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while sending request", e);
        } catch (RuntimeException e) {
            // the client rejects some requests (e.g. an out-of-range port) only when sending
            throw new DeliveryException("Unexpected error: " + e.getMessage(), e);
        }
    }

    private void onFailure(DeliveryAttempt delivery, WebhookSubscription subscription, DeliveryException e, long latencyMs) {
        int attemptCount = delivery.getAttemptCount() + 1;
        Instant at = clock.instant();
        boolean terminal = delivery.markFailure(
                at,
                e.statusCode(),
                e.responseBody(),
                e.statusCode() != null ? latencyMs : null,
                Texts.truncate(e.getMessage(), MAX_ERROR_LENGTH),
                RetrySchedule.delayAfter(attemptCount)
        );
        persist(delivery);
        deliveryStore.recordDeliveryFailure(subscription.getId(), at, terminal);

        if (terminal) {
            log.warn("Webhook delivery failed permanently id={} subscriptionId={} attempts={} error={}",
                    delivery.getId(), subscription.getId(), delivery.getAttemptCount(), delivery.getErrorMessage());
        } else {
            log.warn("Webhook delivery failed, retry scheduled id={} subscriptionId={} attempt={} nextRetryAt={} error={}",
                    delivery.getId(), subscription.getId(), delivery.getAttemptCount(), delivery.getNextRetryAt(),
                    delivery.getErrorMessage());
        }
    }

    private void persist(DeliveryAttempt delivery) {
        if (!deliveryStore.saveDelivery(delivery)) {
            log.warn("Delivery was finalized concurrently; attempt result not stored id={}", delivery.getId());
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
