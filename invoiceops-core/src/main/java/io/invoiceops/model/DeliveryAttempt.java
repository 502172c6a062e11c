package io.invoiceops.model;

import io.invoiceops.core.DeliveryStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One webhook event delivery and its attempt history.
 *
 * <p>State machine: {@code PENDING -> SUCCESS | RETRYING -> ... -> SUCCESS | FAILED}.
 * {@code nextRetryAt} is set iff the status is {@code RETRYING}; {@code attemptCount} never exceeds
 * {@code maxAttempts}; terminal deliveries reject further transitions.
 */
public class DeliveryAttempt {

    public static final int DEFAULT_MAX_ATTEMPTS = 4;

    private String id;
    private String subscriptionId;
    private String eventType;
    private String eventId;
    private String payload;

    private DeliveryStatus status;
    private int attemptCount;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Instant nextRetryAt;

    private Integer responseStatusCode;
    private String responseBody;
    private Long responseTimeMs;
    private String errorMessage;

    private Instant createdAt;
    private Instant lastAttemptAt;
    private Instant completedAt;

    public DeliveryAttempt() {
    }

    public static DeliveryAttempt pending(String id, String subscriptionId, String eventType, String eventId,
                                          String payload, int maxAttempts, Instant createdAt) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        DeliveryAttempt d = new DeliveryAttempt();
        d.id = id;
        d.subscriptionId = subscriptionId;
        d.eventType = eventType;
        d.eventId = eventId;
        d.payload = payload;
        d.status = DeliveryStatus.PENDING;
        d.maxAttempts = maxAttempts;
        d.createdAt = createdAt;
        return d;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public void markSuccess(Instant at, int statusCode, String body, long latencyMs) {
        requireOpen();
        this.status = DeliveryStatus.SUCCESS;
        this.responseStatusCode = statusCode;
        this.responseBody = body;
        this.responseTimeMs = latencyMs;
        this.errorMessage = null;
        this.lastAttemptAt = at;
        this.completedAt = at;
        this.nextRetryAt = null;
    }

    /**
     * Record a failed attempt.
     *
     * @param retryDelay delay until the next attempt; ignored when this failure exhausts the attempts
     * @return whether the delivery is now terminally failed
     */
    public boolean markFailure(Instant at, Integer statusCode, String body, Long latencyMs, String error,
                               Duration retryDelay) {
        requireOpen();
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        this.attemptCount++;
        this.responseStatusCode = statusCode;
        this.responseBody = body;
        this.responseTimeMs = latencyMs;
        this.errorMessage = error;
        this.lastAttemptAt = at;
        if (attemptCount >= maxAttempts) {
            this.status = DeliveryStatus.FAILED;
            this.completedAt = at;
            this.nextRetryAt = null;
            return true;
        }
        this.status = DeliveryStatus.RETRYING;
        this.nextRetryAt = at.plus(retryDelay);
        return false;
    }

    /**
     * Fail without sending, e.g. when the subscription was deactivated. Attempt count is unchanged.
     */
    public void markAbandoned(Instant at, String reason) {
        requireOpen();
        this.status = DeliveryStatus.FAILED;
        this.errorMessage = reason;
        this.completedAt = at;
        this.nextRetryAt = null;
    }

    private void requireOpen() {
        if (isTerminal()) {
            throw new IllegalStateException("Delivery " + id + " is already " + status);
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    public void setStatus(DeliveryStatus status) {
        this.status = status;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public void setAttemptCount(int attemptCount) {
        this.attemptCount = attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    public void setNextRetryAt(Instant nextRetryAt) {
        this.nextRetryAt = nextRetryAt;
    }

    public Integer getResponseStatusCode() {
        return responseStatusCode;
    }

    public void setResponseStatusCode(Integer responseStatusCode) {
        this.responseStatusCode = responseStatusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public void setResponseBody(String responseBody) {
        this.responseBody = responseBody;
    }

    public Long getResponseTimeMs() {
        return responseTimeMs;
    }

    public void setResponseTimeMs(Long responseTimeMs) {
        this.responseTimeMs = responseTimeMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public void setLastAttemptAt(Instant lastAttemptAt) {
        this.lastAttemptAt = lastAttemptAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
