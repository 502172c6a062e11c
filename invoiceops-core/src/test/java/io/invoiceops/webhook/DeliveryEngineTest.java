package io.invoiceops.webhook;

import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.invoiceops.core.DeliverySettings;
import io.invoiceops.core.DeliveryStatus;
import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;
import io.invoiceops.testing.InMemoryDeliveryStore;
import io.invoiceops.testing.MutableClock;
import io.invoiceops.utils.Ids;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryEngineTest {

    @RegisterExtension
    private static final WireMockExtension WIREMOCK = WireMockExtension.newInstance()
            .options(WireMockConfiguration.wireMockConfig().dynamicPort())
            .build();

    private static final Instant T0 = Instant.parse("2026-03-02T06:00:00Z");
    private static final String PAYLOAD = "{\"event_type\":\"validation.valid\",\"event_id\":\"evt_1\"}";

    private final MutableClock clock = new MutableClock(T0);

    private InMemoryDeliveryStore store;
    private DeliveryEngine engine;
    private WebhookSubscription subscription;

    @BeforeEach
    void setUp() {
        store = new InMemoryDeliveryStore();
        engine = new DeliveryEngine(store, HttpClient.newHttpClient(),
                new DeliverySettings(Duration.ofSeconds(1), 20, "InvoiceOps-Webhook/1.0", Duration.ofMinutes(5)),
                clock);
        subscription = subscription(WIREMOCK.baseUrl() + "/hooks");
    }

    @Test
    void successfulDeliveryShouldSendSignedRequest() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(200).withBody("ok")));
        DeliveryAttempt delivery = enqueue(4);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(DeliveryStatus.SUCCESS, result.getStatus());
        assertEquals(Integer.valueOf(200), result.getResponseStatusCode());
        assertEquals("ok", result.getResponseBody());
        assertNotNull(result.getResponseTimeMs());
        assertEquals(0, result.getAttemptCount());
        assertEquals(T0, result.getCompletedAt());
        assertNull(result.getNextRetryAt());
        assertEquals(DeliveryStatus.SUCCESS, store.findDelivery(delivery.getId()).orElseThrow().getStatus());

        WIREMOCK.verify(postRequestedFor(urlPathEqualTo("/hooks"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("X-Webhook-ID", equalTo(subscription.getId()))
                .withHeader("X-Webhook-Event", equalTo("validation.valid"))
                .withHeader("X-Webhook-Delivery", equalTo(delivery.getId()))
                .withHeader("X-Signature-256", equalTo(WebhookSigner.sign(PAYLOAD, subscription.getSecret())))
                .withHeader("User-Agent", equalTo("InvoiceOps-Webhook/1.0"))
                .withRequestBody(equalTo(PAYLOAD)));

        assertEquals(1, subscription.getSuccessfulDeliveries());
        assertEquals(0, subscription.getFailedDeliveries());
        assertEquals(T0, subscription.getLastSuccessAt());
    }

    @Test
    void serverErrorsThenSuccessShouldFollowRetrySchedule() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(500).withBody("down")));
        DeliveryAttempt delivery = enqueue(4);

        engine.attempt(delivery);
        DeliveryAttempt stored = stored(delivery);
        assertEquals(DeliveryStatus.RETRYING, stored.getStatus());
        assertEquals(1, stored.getAttemptCount());
        assertEquals(Integer.valueOf(500), stored.getResponseStatusCode());
        assertEquals("HTTP 500", stored.getErrorMessage());
        assertEquals(T0.plus(Duration.ofMinutes(5)), stored.getNextRetryAt());

        // not due yet
        clock.set(T0.plus(Duration.ofMinutes(4)));
        assertEquals(0, engine.sweepDueRetries(10));

        clock.set(T0.plus(Duration.ofMinutes(5)));
        assertEquals(1, engine.sweepDueRetries(10));
        stored = stored(delivery);
        assertEquals(2, stored.getAttemptCount());
        assertEquals(T0.plus(Duration.ofMinutes(35)), stored.getNextRetryAt());

        clock.set(T0.plus(Duration.ofMinutes(35)));
        assertEquals(1, engine.sweepDueRetries(10));
        stored = stored(delivery);
        assertEquals(3, stored.getAttemptCount());
        assertEquals(DeliveryStatus.RETRYING, stored.getStatus());
        assertEquals(T0.plus(Duration.ofMinutes(155)), stored.getNextRetryAt());

        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(204)));
        clock.set(T0.plus(Duration.ofMinutes(155)));
        assertEquals(1, engine.sweepDueRetries(10));

        stored = stored(delivery);
        assertEquals(DeliveryStatus.SUCCESS, stored.getStatus());
        assertEquals(3, stored.getAttemptCount());
        assertEquals(Integer.valueOf(204), stored.getResponseStatusCode());
        assertNull(stored.getErrorMessage());
        assertNull(stored.getNextRetryAt());

        WIREMOCK.verify(4, postRequestedFor(urlPathEqualTo("/hooks")));
        assertEquals(1, subscription.getTotalDeliveries());
        assertEquals(1, subscription.getSuccessfulDeliveries());
        assertEquals(0, subscription.getFailedDeliveries());
        assertEquals(T0.plus(Duration.ofMinutes(35)), subscription.getLastFailureAt());
    }

    @Test
    void fourthFailureShouldBeTerminal() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(503)));
        DeliveryAttempt delivery = enqueue(4);

        engine.attempt(delivery);
        for (int i = 0; i < 3; i++) {
            clock.set(stored(delivery).getNextRetryAt());
            assertEquals(1, engine.sweepDueRetries(10));
        }

        DeliveryAttempt stored = stored(delivery);
        assertEquals(DeliveryStatus.FAILED, stored.getStatus());
        assertEquals(4, stored.getAttemptCount());
        assertNull(stored.getNextRetryAt());
        assertEquals(clock.instant(), stored.getCompletedAt());
        assertEquals(T0.plus(Duration.ofMinutes(155)), clock.instant());

        clock.advance(Duration.ofHours(5));
        assertEquals(0, engine.sweepDueRetries(10));
        WIREMOCK.verify(4, postRequestedFor(anyUrl()));
        assertEquals(0, subscription.getSuccessfulDeliveries());
        assertEquals(1, subscription.getFailedDeliveries());
    }

    @Test
    void timeoutShouldBeRecordedAsRetryableFailure() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(200).withFixedDelay(3000)));
        DeliveryAttempt delivery = enqueue(4);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(DeliveryStatus.RETRYING, result.getStatus());
        assertEquals("Request timed out after 1s", result.getErrorMessage());
        assertNull(result.getResponseStatusCode());
        assertNull(result.getResponseTimeMs());
    }

    @Test
    void connectionErrorShouldBeRecordedAsRetryableFailure() {
        subscription.setUrl("http://127.0.0.1:1/hooks");
        DeliveryAttempt delivery = enqueue(4);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(DeliveryStatus.RETRYING, result.getStatus());
        assertThat(result.getErrorMessage()).startsWith("Connection error");
        assertEquals(1, result.getAttemptCount());
    }

    @Test
    void clientRejectionAtSendTimeShouldBeRecordedAsRetryableFailure() {
        subscription.setUrl("http://localhost:99999/hooks");
        DeliveryAttempt delivery = enqueue(4);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(DeliveryStatus.RETRYING, result.getStatus());
        assertEquals(1, result.getAttemptCount());
        assertThat(result.getErrorMessage()).startsWith("Unexpected error");
        assertEquals(T0.plus(Duration.ofMinutes(5)), result.getNextRetryAt());
        assertEquals(DeliveryStatus.RETRYING, stored(delivery).getStatus());
    }

    @Test
    void singleAttemptDeliveryShouldFailImmediately() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(404)));
        DeliveryAttempt delivery = enqueue(1);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(DeliveryStatus.FAILED, result.getStatus());
        assertEquals(1, result.getAttemptCount());
        assertNull(result.getNextRetryAt());
        assertEquals(1, subscription.getFailedDeliveries());
    }

    @Test
    void responseBodyShouldBeTruncated() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(400).withBody("x".repeat(100))));
        DeliveryAttempt delivery = enqueue(4);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(20, result.getResponseBody().length());
        assertEquals("HTTP 400", result.getErrorMessage());
    }

    @Test
    void inactiveSubscriptionShouldAbandonDeliveryWithoutSending() {
        DeliveryAttempt delivery = enqueue(4);
        subscription.setActive(false);

        DeliveryAttempt result = engine.attempt(delivery);

        assertEquals(DeliveryStatus.FAILED, result.getStatus());
        assertEquals(DeliveryEngine.INACTIVE_SUBSCRIPTION, result.getErrorMessage());
        assertEquals(0, result.getAttemptCount());
        WIREMOCK.verify(0, postRequestedFor(anyUrl()));
        assertEquals(0, subscription.getFailedDeliveries());
    }

    @Test
    void terminalDeliveryShouldBeReturnedUnchanged() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(200)));
        DeliveryAttempt delivery = engine.attempt(enqueue(4));

        DeliveryAttempt again = engine.attempt(delivery);

        assertSame(delivery, again);
        WIREMOCK.verify(1, postRequestedFor(anyUrl()));
        assertEquals(1, subscription.getSuccessfulDeliveries());
    }

    @Test
    void sweepShouldRespectLimitAndClaimLease() {
        WIREMOCK.stubFor(post(anyUrl()).willReturn(aResponse().withStatus(500)));
        List<DeliveryAttempt> deliveries = List.of(enqueue(4), enqueue(4), enqueue(4));
        deliveries.forEach(engine::attempt);

        clock.advance(Duration.ofMinutes(5));
        assertEquals(2, engine.sweepDueRetries(2));
        assertEquals(1, engine.sweepDueRetries(2));
        assertEquals(0, engine.sweepDueRetries(2));
        assertTrue(deliveries.stream().allMatch(d -> stored(d).getAttemptCount() == 2));
    }

    private WebhookSubscription subscription(String url) {
        WebhookSubscription s = new WebhookSubscription();
        s.setId("sub-1");
        s.setOwnerId("owner-1");
        s.setUrl(url);
        s.setEvents(List.of("validation.valid"));
        s.setSecret(WebhookSigner.generateSecret());
        s.setActive(true);
        s.setCreatedAt(T0);
        return store.saveSubscription(s);
    }

    private DeliveryAttempt enqueue(int maxAttempts) {
        DeliveryAttempt delivery = DeliveryAttempt.pending(
                Ids.newId(), subscription.getId(), "validation.valid", "evt_1", PAYLOAD,
                maxAttempts, clock.instant());
        store.insertDelivery(delivery);
        store.recordDeliveryEnqueued(subscription.getId(), clock.instant());
        return delivery;
    }

    private DeliveryAttempt stored(DeliveryAttempt delivery) {
        return store.findDelivery(delivery.getId()).orElseThrow();
    }
}
