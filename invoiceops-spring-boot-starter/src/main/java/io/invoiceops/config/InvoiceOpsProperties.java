package io.invoiceops.config;

import io.invoiceops.core.DeliverySettings;
import io.invoiceops.core.SchedulerSettings;
import io.invoiceops.internal.s3.S3ClientSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for scheduled validations and webhook delivery.
 */
@ConfigurationProperties(prefix = "invoiceops")
public class InvoiceOpsProperties {
    /**
     * Secret the credential encryption key is derived from. Required.
     */
    private String credentialSecret;
    private boolean ensureIndexesOnStartup = false;

    private final Scheduler scheduler = new Scheduler();
    private final Webhook webhook = new Webhook();
    private final S3 s3 = new S3();

    public String getCredentialSecret() {
        return credentialSecret;
    }

    public void setCredentialSecret(String credentialSecret) {
        this.credentialSecret = credentialSecret;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public S3 getS3() {
        return s3;
    }

    public static class Scheduler {
        private int workerThreads = 8;
        private Duration misfireGraceTime = Duration.ofMinutes(5);
        private boolean coalesce = true;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(workerThreads, misfireGraceTime, coalesce, shutdownTimeout);
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public Duration getMisfireGraceTime() {
            return misfireGraceTime;
        }

        public void setMisfireGraceTime(Duration misfireGraceTime) {
            this.misfireGraceTime = misfireGraceTime;
        }

        public boolean isCoalesce() {
            return coalesce;
        }

        public void setCoalesce(boolean coalesce) {
            this.coalesce = coalesce;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Webhook {
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int maxResponseBodySize = 5000;
        private String userAgent = "InvoiceOps-Webhook/1.0";
        private int deliveryThreads = 4;
        private Duration retrySweepInterval = Duration.ofSeconds(30);
        private int retryBatchSize = 50;
        private Duration claimLease = Duration.ofMinutes(5);

        public DeliverySettings toSettings() {
            return new DeliverySettings(requestTimeout, maxResponseBodySize, userAgent, claimLease);
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getMaxResponseBodySize() {
            return maxResponseBodySize;
        }

        public void setMaxResponseBodySize(int maxResponseBodySize) {
            this.maxResponseBodySize = maxResponseBodySize;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getDeliveryThreads() {
            return deliveryThreads;
        }

        public void setDeliveryThreads(int deliveryThreads) {
            this.deliveryThreads = deliveryThreads;
        }

        public Duration getRetrySweepInterval() {
            return retrySweepInterval;
        }

        public void setRetrySweepInterval(Duration retrySweepInterval) {
            this.retrySweepInterval = retrySweepInterval;
        }

        public int getRetryBatchSize() {
            return retryBatchSize;
        }

        public void setRetryBatchSize(int retryBatchSize) {
            this.retryBatchSize = retryBatchSize;
        }

        public Duration getClaimLease() {
            return claimLease;
        }

        public void setClaimLease(Duration claimLease) {
            this.claimLease = claimLease;
        }
    }

    public static class S3 {
        private Duration apiCallTimeout = Duration.ofSeconds(60);
        private Duration apiCallAttemptTimeout = Duration.ofSeconds(20);

        public S3ClientSettings toSettings() {
            return new S3ClientSettings(apiCallTimeout, apiCallAttemptTimeout);
        }

        public Duration getApiCallTimeout() {
            return apiCallTimeout;
        }

        public void setApiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
        }

        public Duration getApiCallAttemptTimeout() {
            return apiCallAttemptTimeout;
        }

        public void setApiCallAttemptTimeout(Duration apiCallAttemptTimeout) {
            this.apiCallAttemptTimeout = apiCallAttemptTimeout;
        }
    }
}
