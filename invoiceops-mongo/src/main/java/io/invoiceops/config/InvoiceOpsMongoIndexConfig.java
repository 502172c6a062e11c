package io.invoiceops.config;

import io.invoiceops.internal.mongo.MongoDeliveryStore;
import io.invoiceops.internal.mongo.MongoValidationJobStore;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.Objects;

/**
 * MongoDB index definitions for the validation job and webhook collections.
 *
 * <p>Indexes are <b>not</b> created at application startup. Call {@link #ensureIndexes()} explicitly,
 * or create them from a migration script:
 * <pre>
 * db.scheduled_validation_jobs.createIndex({ ownerId: 1, createdAt: -1 }, { name: "idx_owner_created" });
 * db.scheduled_validation_jobs.createIndex({ enabled: 1 }, { name: "idx_enabled" });
 * db.scheduled_validation_runs.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_started" });
 * db.scheduled_validation_files.createIndex({ runId: 1, fileKey: 1 }, { name: "idx_run_file" });
 * db.webhook_subscriptions.createIndex({ ownerId: 1, active: 1 }, { name: "idx_owner_active" });
 * db.webhook_deliveries.createIndex({ subscriptionId: 1, createdAt: -1 }, { name: "idx_subscription_created" });
 * db.webhook_deliveries.createIndex(
 *   { nextRetryAt: 1 },
 *   { name: "idx_due_retry", partialFilterExpression: { status: "RETRYING" } }
 * );
 * </pre>
 */
public class InvoiceOpsMongoIndexConfig {

    public static final String IDX_OWNER_CREATED = "idx_owner_created";
    public static final String IDX_ENABLED = "idx_enabled";
    public static final String IDX_JOB_STARTED = "idx_job_started";
    public static final String IDX_RUN_FILE = "idx_run_file";
    public static final String IDX_OWNER_ACTIVE = "idx_owner_active";
    public static final String IDX_SUBSCRIPTION_CREATED = "idx_subscription_created";
    public static final String IDX_DUE_RETRY = "idx_due_retry";

    private final MongoTemplate mongoTemplate;

    public InvoiceOpsMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create every index listed above. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(MongoValidationJobStore.JOBS).ensureIndex(ownerCreatedIndex());
        mongoTemplate.indexOps(MongoValidationJobStore.JOBS).ensureIndex(enabledIndex());
        mongoTemplate.indexOps(MongoValidationJobStore.RUNS).ensureIndex(jobStartedIndex());
        mongoTemplate.indexOps(MongoValidationJobStore.FILES).ensureIndex(runFileIndex());
        mongoTemplate.indexOps(MongoDeliveryStore.SUBSCRIPTIONS).ensureIndex(ownerActiveIndex());
        mongoTemplate.indexOps(MongoDeliveryStore.DELIVERIES).ensureIndex(subscriptionCreatedIndex());
        mongoTemplate.indexOps(MongoDeliveryStore.DELIVERIES).ensureIndex(dueRetryIndex());
    }

    /**
     * Job listing per owner, newest first.
     */
    public static Index ownerCreatedIndex() {
        return new Index()
                .on("ownerId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_OWNER_CREATED);
    }

    /**
     * Startup registration of enabled jobs.
     */
    public static Index enabledIndex() {
        return new Index().on("enabled", Sort.Direction.ASC).named(IDX_ENABLED);
    }

    public static Index jobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_STARTED);
    }

    public static Index runFileIndex() {
        return new Index()
                .on("runId", Sort.Direction.ASC)
                .on("fileKey", Sort.Direction.ASC)
                .named(IDX_RUN_FILE);
    }

    public static Index ownerActiveIndex() {
        return new Index()
                .on("ownerId", Sort.Direction.ASC)
                .on("active", Sort.Direction.ASC)
                .named(IDX_OWNER_ACTIVE);
    }

    public static Index subscriptionCreatedIndex() {
        return new Index()
                .on("subscriptionId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_SUBSCRIPTION_CREATED);
    }

    /**
     * Retry sweep. Only {@code RETRYING} deliveries carry a {@code nextRetryAt}, so the index stays small.
     */
    public static Index dueRetryIndex() {
        return new Index()
                .on("nextRetryAt", Sort.Direction.ASC)
                .partial(PartialIndexFilter.of(new Document("status", "RETRYING")))
                .named(IDX_DUE_RETRY);
    }
}
