package io.invoiceops.internal.mongo;

import com.mongodb.client.MongoClients;
import io.invoiceops.config.InvoiceOpsMongoIndexConfig;
import io.invoiceops.core.DeliveryStatus;
import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoDeliveryStoreTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoDeliveryStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "invoiceops_test");
        dropAll();
        new InvoiceOpsMongoIndexConfig(mongoTemplate).ensureIndexes();
        store = new MongoDeliveryStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void subscriptionsShouldBeScopedByOwnerAndActiveFlag() {
        store.saveSubscription(newSubscription("sub-1", "owner-a", true, T0));
        store.saveSubscription(newSubscription("sub-2", "owner-a", false, T0.plusSeconds(5)));
        store.saveSubscription(newSubscription("sub-3", "owner-b", true, T0));

        assertEquals(List.of("sub-2", "sub-1"),
                store.findSubscriptions("owner-a").stream().map(WebhookSubscription::getId).toList());
        assertEquals(List.of("sub-1"),
                store.findActiveSubscriptions("owner-a").stream().map(WebhookSubscription::getId).toList());
        assertTrue(store.findSubscription("sub-3", "owner-a").isEmpty());

        WebhookSubscription loaded = store.findSubscription("sub-1").orElseThrow();
        assertEquals(List.of("validation.completed", "validation.invalid"), loaded.getEvents());
        assertEquals("https://hooks.example.com/in", loaded.getUrl());
    }

    @Test
    void counterUpdatesShouldSurviveConfigurationSave() {
        WebhookSubscription sub = newSubscription("sub-1", "owner-a", true, T0);
        store.saveSubscription(sub);

        store.recordDeliveryEnqueued("sub-1", T0.plusSeconds(1));
        store.recordDeliveryEnqueued("sub-1", T0.plusSeconds(2));
        store.recordDeliverySuccess("sub-1", T0.plusSeconds(3));
        store.recordDeliveryFailure("sub-1", T0.plusSeconds(4), false);
        store.recordDeliveryFailure("sub-1", T0.plusSeconds(5), true);

        sub.setActive(false);
        sub.setDescription(null);
        store.saveSubscription(sub);

        WebhookSubscription loaded = store.findSubscription("sub-1").orElseThrow();
        assertFalse(loaded.isActive());
        assertNull(loaded.getDescription());
        assertEquals(2, loaded.getTotalDeliveries());
        assertEquals(1, loaded.getSuccessfulDeliveries());
        assertEquals(1, loaded.getFailedDeliveries());
        assertEquals(T0.plusSeconds(2), loaded.getLastTriggeredAt());
        assertEquals(T0.plusSeconds(3), loaded.getLastSuccessAt());
        assertEquals(T0.plusSeconds(5), loaded.getLastFailureAt());
    }

    @Test
    void saveDeliveryShouldRefuseToOverwriteTerminalRecord() {
        DeliveryAttempt delivery = newDelivery("del-1", T0);
        store.insertDelivery(delivery);

        delivery.markFailure(T0.plusSeconds(1), 500, "oops", 12L, "HTTP 500", Duration.ofMinutes(1));
        assertTrue(store.saveDelivery(delivery));

        DeliveryAttempt racing = store.findDelivery("del-1").orElseThrow();
        racing.markSuccess(T0.plusSeconds(61), 204, "", 8L);
        assertTrue(store.saveDelivery(racing));

        // stale copy loses
        delivery.markFailure(T0.plusSeconds(62), 502, "bad gateway", 9L, "HTTP 502", Duration.ofMinutes(5));
        assertFalse(store.saveDelivery(delivery));

        DeliveryAttempt loaded = store.findDelivery("del-1").orElseThrow();
        assertEquals(DeliveryStatus.SUCCESS, loaded.getStatus());
        assertEquals(1, loaded.getAttemptCount());
        assertEquals(Integer.valueOf(204), loaded.getResponseStatusCode());
        assertNull(loaded.getNextRetryAt());
    }

    @Test
    void claimDueRetriesShouldLeaseAndPreventDoubleClaim() {
        DeliveryAttempt early = newDelivery("del-early", T0);
        early.markFailure(T0, 500, null, 5L, "HTTP 500", Duration.ofMinutes(1));
        DeliveryAttempt later = newDelivery("del-later", T0);
        later.markFailure(T0, 500, null, 5L, "HTTP 500", Duration.ofMinutes(5));
        DeliveryAttempt notDue = newDelivery("del-future", T0);
        notDue.markFailure(T0, 500, null, 5L, "HTTP 500", Duration.ofMinutes(30));
        DeliveryAttempt pending = newDelivery("del-pending", T0);
        store.insertDelivery(later);
        store.insertDelivery(early);
        store.insertDelivery(notDue);
        store.insertDelivery(pending);

        Instant now = T0.plus(Duration.ofMinutes(10));
        List<DeliveryAttempt> claimed = store.claimDueRetries(now, 10, Duration.ofMinutes(2));

        assertEquals(List.of("del-early", "del-later"), claimed.stream().map(DeliveryAttempt::getId).toList());
        assertEquals(T0.plus(Duration.ofMinutes(1)), claimed.get(0).getNextRetryAt());
        assertEquals(now.plus(Duration.ofMinutes(2)),
                store.findDelivery("del-early").orElseThrow().getNextRetryAt());

        assertTrue(store.claimDueRetries(now.plusSeconds(30), 10, Duration.ofMinutes(2)).isEmpty());
        assertEquals(2, store.claimDueRetries(now.plus(Duration.ofMinutes(3)), 10, Duration.ofMinutes(2)).size());
    }

    @Test
    void claimDueRetriesShouldHonourLimit() {
        for (int i = 0; i < 3; i++) {
            DeliveryAttempt d = newDelivery("del-" + i, T0);
            d.markFailure(T0.plusSeconds(i), 500, null, 5L, "HTTP 500", Duration.ofMinutes(1));
            store.insertDelivery(d);
        }

        List<DeliveryAttempt> claimed = store.claimDueRetries(T0.plus(Duration.ofHours(1)), 2, Duration.ofMinutes(2));

        assertEquals(List.of("del-0", "del-1"), claimed.stream().map(DeliveryAttempt::getId).toList());
        assertTrue(store.claimDueRetries(T0.plus(Duration.ofHours(1)), 0, Duration.ofMinutes(2)).isEmpty());
    }

    @Test
    void deleteSubscriptionShouldCascadeToDeliveries() {
        store.saveSubscription(newSubscription("sub-1", "owner-a", true, T0));
        store.insertDelivery(newDelivery("del-1", T0));
        store.insertDelivery(newDelivery("del-2", T0.plusSeconds(1)));

        assertEquals(List.of("del-2", "del-1"),
                store.findDeliveries("sub-1", 10).stream().map(DeliveryAttempt::getId).toList());

        assertTrue(store.deleteSubscription("sub-1"));

        assertTrue(store.findSubscription("sub-1").isEmpty());
        assertTrue(store.findDeliveries("sub-1", 10).isEmpty());
        assertFalse(store.deleteSubscription("sub-1"));
    }

    private void dropAll() {
        mongoTemplate.dropCollection(MongoDeliveryStore.SUBSCRIPTIONS);
        mongoTemplate.dropCollection(MongoDeliveryStore.DELIVERIES);
    }

    private static WebhookSubscription newSubscription(String id, String ownerId, boolean active, Instant createdAt) {
        WebhookSubscription sub = new WebhookSubscription();
        sub.setId(id);
        sub.setOwnerId(ownerId);
        sub.setUrl("https://hooks.example.com/in");
        sub.setEvents(List.of("validation.completed", "validation.invalid"));
        sub.setSecret("whsec_" + "ab".repeat(32));
        sub.setActive(active);
        sub.setDescription("erp inbox");
        sub.setCreatedAt(createdAt);
        sub.setUpdatedAt(createdAt);
        return sub;
    }

    private static DeliveryAttempt newDelivery(String id, Instant createdAt) {
        return DeliveryAttempt.pending(id, "sub-1", "validation.completed", "evt-" + id, "{\"ok\":true}", 4, createdAt);
    }
}
