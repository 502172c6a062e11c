package io.invoiceops.internal.mongo;

import io.invoiceops.core.JobStatus;
import io.invoiceops.core.LastRunStatus;
import io.invoiceops.model.JobRun;
import io.invoiceops.model.ProcessedFile;
import io.invoiceops.model.ScheduledValidationJob;
import io.invoiceops.store.ValidationJobStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for scheduled jobs, their runs and processed files.
 *
 * <p>Job totals and last-run fields are only changed through {@code $inc}/{@code $set} updates from
 * {@link #recordRunSuccess} and {@link #recordRunFailure}; {@link #saveJob} writes them on insert only,
 * so a concurrent configuration update never rolls counters back.
 */
public class MongoValidationJobStore implements ValidationJobStore {

    public static final String JOBS = "scheduled_validation_jobs";
    public static final String RUNS = "scheduled_validation_runs";
    public static final String FILES = "scheduled_validation_files";

    private final MongoTemplate mongoTemplate;

    public MongoValidationJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<ScheduledValidationJob> findJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, ScheduledValidationJob.class, JOBS));
    }

    @Override
    public Optional<ScheduledValidationJob> findJob(String jobId, String ownerId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId).and("ownerId").is(ownerId));
        return Optional.ofNullable(mongoTemplate.findOne(q, ScheduledValidationJob.class, JOBS));
    }

    @Override
    public List<ScheduledValidationJob> findJobsByOwner(String ownerId) {
        Query q = new Query(Criteria.where("ownerId").is(ownerId))
                .with(Sort.by(Sort.Order.desc("createdAt")));
        return mongoTemplate.find(q, ScheduledValidationJob.class, JOBS);
    }

    @Override
    public List<ScheduledValidationJob> findEnabledJobs() {
        return mongoTemplate.find(new Query(Criteria.where("enabled").is(true)), ScheduledValidationJob.class, JOBS);
    }

    @Override
    public ScheduledValidationJob saveJob(ScheduledValidationJob job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.getId(), "job id must not be null");

        Update u = new Update()
                .set("ownerId", job.getOwnerId())
                .set("name", job.getName())
                .set("provider", job.getProvider())
                .set("encryptedCredentials", job.getEncryptedCredentials())
                .set("bucketName", job.getBucketName())
                .set("filePattern", job.getFilePattern())
                .set("cronExpression", job.getCronExpression())
                .set("timezone", job.getTimezone())
                .set("enabled", job.isEnabled())
                .set("status", job.getStatus())
                .set("deleteAfterValidation", job.isDeleteAfterValidation())
                .set("updatedAt", job.getUpdatedAt())
                .setOnInsert("totalRuns", job.getTotalRuns())
                .setOnInsert("totalFilesValidated", job.getTotalFilesValidated())
                .setOnInsert("totalFilesValid", job.getTotalFilesValid())
                .setOnInsert("totalFilesInvalid", job.getTotalFilesInvalid())
                .setOnInsert("createdAt", job.getCreatedAt());
        setOrUnset(u, "prefix", job.getPrefix());
        setOrUnset(u, "moveToFolder", job.getMoveToFolder());
        setOrUnset(u, "webhookUrl", job.getWebhookUrl());

        mongoTemplate.upsert(new Query(Criteria.where("_id").is(job.getId())), u, ScheduledValidationJob.class, JOBS);
        return job;
    }

    /**
     * Delete the job with its runs and their files.
     */
    @Override
    public boolean deleteJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");

        Query runsOfJob = new Query(Criteria.where("jobId").is(jobId));
        runsOfJob.fields().include("_id");
        List<String> runIds = new ArrayList<>();
        for (JobRun run : mongoTemplate.find(runsOfJob, JobRun.class, RUNS)) {
            runIds.add(run.getId());
        }

        if (!runIds.isEmpty()) {
            mongoTemplate.remove(new Query(Criteria.where("runId").in(runIds)), ProcessedFile.class, FILES);
        }
        mongoTemplate.remove(new Query(Criteria.where("jobId").is(jobId)), JobRun.class, RUNS);
        return mongoTemplate.remove(new Query(Criteria.where("_id").is(jobId)), ScheduledValidationJob.class, JOBS)
                .getDeletedCount() > 0;
    }

    @Override
    public void insertRun(JobRun run) {
        mongoTemplate.insert(run, RUNS);
    }

    @Override
    public void saveRun(JobRun run) {
        mongoTemplate.save(run, RUNS);
    }

    @Override
    public List<JobRun> findRuns(String jobId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(limit);
        return mongoTemplate.find(q, JobRun.class, RUNS);
    }

    @Override
    public void insertFile(ProcessedFile file) {
        mongoTemplate.insert(file, FILES);
    }

    @Override
    public void saveFile(ProcessedFile file) {
        mongoTemplate.save(file, FILES);
    }

    @Override
    public List<ProcessedFile> findFiles(String runId) {
        Query q = new Query(Criteria.where("runId").is(runId))
                .with(Sort.by(Sort.Order.asc("fileKey")));
        return mongoTemplate.find(q, ProcessedFile.class, FILES);
    }

    @Override
    public void recordRunSuccess(String jobId, JobRun run, Instant at) {
        Update u = new Update()
                .inc("totalRuns", 1)
                .inc("totalFilesValidated", run.getFilesValidated())
                .inc("totalFilesValid", run.getFilesValid())
                .inc("totalFilesInvalid", run.getFilesInvalid())
                .set("status", JobStatus.ACTIVE)
                .set("lastRunStatus", LastRunStatus.SUCCESS)
                .set("lastRunAt", run.getStartedAt());
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(jobId)), u, ScheduledValidationJob.class, JOBS);
    }

    @Override
    public void recordRunFailure(String jobId, Instant at) {
        Update u = new Update()
                .set("status", JobStatus.ERROR)
                .set("lastRunStatus", LastRunStatus.ERROR)
                .set("lastRunAt", at);
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(jobId)), u, ScheduledValidationJob.class, JOBS);
    }

    private static void setOrUnset(Update u, String key, Object value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }
}
