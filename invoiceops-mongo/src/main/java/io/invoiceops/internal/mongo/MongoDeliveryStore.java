package io.invoiceops.internal.mongo;

import io.invoiceops.core.DeliveryStatus;
import io.invoiceops.model.DeliveryAttempt;
import io.invoiceops.model.WebhookSubscription;
import io.invoiceops.store.DeliveryStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for webhook subscriptions and deliveries.
 *
 * <p>Delivery writes are guarded: a delivery that is already {@code SUCCESS} or {@code FAILED} in the
 * collection is never overwritten. Retry claims are performed one document at a time via
 * {@code findAndModify}, so two sweepers never claim the same delivery.
 */
public class MongoDeliveryStore implements DeliveryStore {

    public static final String SUBSCRIPTIONS = "webhook_subscriptions";
    public static final String DELIVERIES = "webhook_deliveries";

    private static final List<String> TERMINAL_STATUSES =
            List.of(DeliveryStatus.SUCCESS.name(), DeliveryStatus.FAILED.name());

    private final MongoTemplate mongoTemplate;

    public MongoDeliveryStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<WebhookSubscription> findSubscription(String subscriptionId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(subscriptionId, WebhookSubscription.class, SUBSCRIPTIONS));
    }

    @Override
    public Optional<WebhookSubscription> findSubscription(String subscriptionId, String ownerId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");
        Query q = new Query(Criteria.where("_id").is(subscriptionId).and("ownerId").is(ownerId));
        return Optional.ofNullable(mongoTemplate.findOne(q, WebhookSubscription.class, SUBSCRIPTIONS));
    }

    @Override
    public List<WebhookSubscription> findSubscriptions(String ownerId) {
        Query q = new Query(Criteria.where("ownerId").is(ownerId))
                .with(Sort.by(Sort.Order.desc("createdAt")));
        return mongoTemplate.find(q, WebhookSubscription.class, SUBSCRIPTIONS);
    }

    @Override
    public List<WebhookSubscription> findActiveSubscriptions(String ownerId) {
        Query q = new Query(Criteria.where("ownerId").is(ownerId).and("active").is(true));
        return mongoTemplate.find(q, WebhookSubscription.class, SUBSCRIPTIONS);
    }

    /**
     * Upsert the configuration fields. Delivery counters and timestamps are written on insert only.
     */
    @Override
    public WebhookSubscription saveSubscription(WebhookSubscription subscription) {
        Objects.requireNonNull(subscription, "subscription must not be null");
        Objects.requireNonNull(subscription.getId(), "subscription id must not be null");

        Update u = new Update()
                .set("ownerId", subscription.getOwnerId())
                .set("url", subscription.getUrl())
                .set("events", subscription.getEvents())
                .set("secret", subscription.getSecret())
                .set("active", subscription.isActive())
                .set("updatedAt", subscription.getUpdatedAt())
                .setOnInsert("totalDeliveries", subscription.getTotalDeliveries())
                .setOnInsert("successfulDeliveries", subscription.getSuccessfulDeliveries())
                .setOnInsert("failedDeliveries", subscription.getFailedDeliveries())
                .setOnInsert("createdAt", subscription.getCreatedAt());
        if (subscription.getDescription() != null) {
            u.set("description", subscription.getDescription());
        } else {
            u.unset("description");
        }

        mongoTemplate.upsert(new Query(Criteria.where("_id").is(subscription.getId())), u,
                WebhookSubscription.class, SUBSCRIPTIONS);
        return subscription;
    }

    /**
     * Delete the subscription and its deliveries.
     */
    @Override
    public boolean deleteSubscription(String subscriptionId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");
        mongoTemplate.remove(new Query(Criteria.where("subscriptionId").is(subscriptionId)),
                DeliveryAttempt.class, DELIVERIES);
        return mongoTemplate.remove(new Query(Criteria.where("_id").is(subscriptionId)),
                WebhookSubscription.class, SUBSCRIPTIONS).getDeletedCount() > 0;
    }

    @Override
    public void insertDelivery(DeliveryAttempt delivery) {
        mongoTemplate.insert(delivery, DELIVERIES);
    }

    @Override
    public boolean saveDelivery(DeliveryAttempt delivery) {
        Objects.requireNonNull(delivery, "delivery must not be null");
        Query q = new Query(Criteria.where("_id").is(delivery.getId()).and("status").nin(TERMINAL_STATUSES));
        return mongoTemplate.findAndReplace(q, delivery, DELIVERIES) != null;
    }

    @Override
    public Optional<DeliveryAttempt> findDelivery(String deliveryId) {
        Objects.requireNonNull(deliveryId, "deliveryId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(deliveryId, DeliveryAttempt.class, DELIVERIES));
    }

    @Override
    public List<DeliveryAttempt> findDeliveries(String subscriptionId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("subscriptionId").is(subscriptionId))
                .with(Sort.by(Sort.Order.desc("createdAt")))
                .limit(limit);
        return mongoTemplate.find(q, DeliveryAttempt.class, DELIVERIES);
    }

    /**
     * Claim at most {@code limit} due retries by pushing their {@code nextRetryAt} forward by {@code lease}.
     * Returned documents carry the state from before the claim.
     */
    @Override
    public List<DeliveryAttempt> claimDueRetries(Instant now, int limit, Duration lease) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lease, "lease must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be a positive duration");
        }

        Query due = new Query(
                Criteria.where("status").is(DeliveryStatus.RETRYING.name())
                        .and("nextRetryAt").lte(now)
        );
        due.with(Sort.by(Sort.Order.asc("nextRetryAt")));

        Update claim = new Update().set("nextRetryAt", now.plus(lease));
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(false);

        List<DeliveryAttempt> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            DeliveryAttempt d = mongoTemplate.findAndModify(due, claim, options, DeliveryAttempt.class, DELIVERIES);
            if (d == null) {
                break;
            }
            claimed.add(d);
        }
        return claimed;
    }

    @Override
    public void recordDeliveryEnqueued(String subscriptionId, Instant at) {
        Update u = new Update()
                .inc("totalDeliveries", 1)
                .set("lastTriggeredAt", at);
        updateSubscription(subscriptionId, u);
    }

    @Override
    public void recordDeliverySuccess(String subscriptionId, Instant at) {
        Update u = new Update()
                .inc("successfulDeliveries", 1)
                .set("lastSuccessAt", at);
        updateSubscription(subscriptionId, u);
    }

    @Override
    public void recordDeliveryFailure(String subscriptionId, Instant at, boolean terminal) {
        Update u = new Update().set("lastFailureAt", at);
        if (terminal) {
            u.inc("failedDeliveries", 1);
        }
        updateSubscription(subscriptionId, u);
    }

    private void updateSubscription(String subscriptionId, Update u) {
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(subscriptionId)), u,
                WebhookSubscription.class, SUBSCRIPTIONS);
    }
}
