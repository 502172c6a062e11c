package io.invoiceops.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoiceops.CredentialVault;
import io.invoiceops.CronScheduler;
import io.invoiceops.ObjectStorageClient;
import io.invoiceops.core.ConnectionTestResult;
import io.invoiceops.core.ErrorKind;
import io.invoiceops.core.JobCreation;
import io.invoiceops.core.JobDefinition;
import io.invoiceops.core.JobStatus;
import io.invoiceops.core.JobUpdate;
import io.invoiceops.core.JobUpdate.Field;
import io.invoiceops.core.ObjectStorageClients;
import io.invoiceops.core.StorageCredentials;
import io.invoiceops.core.StorageProvider;
import io.invoiceops.exception.InvalidScheduleException;
import io.invoiceops.exception.StorageException;
import io.invoiceops.model.JobRun;
import io.invoiceops.model.ProcessedFile;
import io.invoiceops.model.ScheduledValidationJob;
import io.invoiceops.store.ValidationJobStore;
import io.invoiceops.utils.CronExpressions;
import io.invoiceops.utils.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle of scheduled validation jobs: pre-flight, persistence, timer registration and manual triggers.
 */
public class ScheduledValidationService {
    private static final Logger log = LoggerFactory.getLogger(ScheduledValidationService.class);

    private final ValidationJobStore jobStore;
    private final CronScheduler scheduler;
    private final JobRunner jobRunner;
    private final ObjectStorageClients storageClients;
    private final CredentialVault credentialVault;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ScheduledValidationService(
            ValidationJobStore jobStore,
            CronScheduler scheduler,
            JobRunner jobRunner,
            ObjectStorageClients storageClients,
            CredentialVault credentialVault,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.jobRunner = Objects.requireNonNull(jobRunner, "jobRunner must not be null");
        this.storageClients = Objects.requireNonNull(storageClients, "storageClients must not be null");
        this.credentialVault = Objects.requireNonNull(credentialVault, "credentialVault must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Check that {@code bucket} is reachable. Expected failures come back as a result, never thrown.
     */
    public ConnectionTestResult testConnection(StorageProvider provider, StorageCredentials credentials, String bucket) {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        try (ObjectStorageClient client = storageClients.open(provider, credentials)) {
            return client.testConnection(bucket);
        } catch (StorageException e) {
            return ConnectionTestResult.failure(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Connection test failed provider={} bucket={} msg={}", provider, bucket, e.getMessage(), e);
            return ConnectionTestResult.failure(ErrorKind.UNKNOWN, "Connection failed: " + e.getMessage());
        }
    }

    /**
     * Validate the schedule, run the connection pre-flight, then persist and register the job.
     * Nothing is stored when the pre-flight fails.
     *
     * @throws InvalidScheduleException when the cron expression or timezone is invalid
     */
    public JobCreation createJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        CronExpressions.validate(definition.cronExpression(), definition.timezone());

        ConnectionTestResult connection = testConnection(
                definition.provider(), definition.credentials(), definition.bucketName());
        if (!connection.ok()) {
            log.info("Scheduled job rejected by connection pre-flight owner={} bucket={} reason={}",
                    definition.ownerId(), definition.bucketName(), connection.message());
            return JobCreation.rejected(connection);
        }

        Instant now = clock.instant();
        ScheduledValidationJob job = new ScheduledValidationJob();
        job.setId(Ids.newId());
        job.setOwnerId(definition.ownerId());
        job.setName(definition.name());
        job.setProvider(definition.provider());
        job.setEncryptedCredentials(encryptCredentials(definition.credentials()));
        job.setBucketName(definition.bucketName());
        job.setPrefix(definition.prefix());
        job.setFilePattern(definition.filePattern());
        job.setCronExpression(definition.cronExpression());
        job.setTimezone(definition.timezone());
        job.setEnabled(true);
        job.setStatus(JobStatus.ACTIVE);
        job.setDeleteAfterValidation(definition.deleteAfterValidation());
        job.setMoveToFolder(blankToNull(definition.moveToFolder()));
        job.setWebhookUrl(blankToNull(definition.webhookUrl()));
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        jobStore.saveJob(job);
        register(job);
        log.info("Created scheduled job id={} owner={} cron='{}' timezone={}",
                job.getId(), job.getOwnerId(), job.getCronExpression(), job.getTimezone());
        return new JobCreation(connection, job);
    }

    /**
     * Apply the fields set on {@code update}. Schedule changes are validated before anything is written.
     * Changing the schedule or the enabled flag re-registers the timer ({@code ACTIVE}) or removes it
     * ({@code PAUSED}).
     *
     * @throws IllegalArgumentException when the job does not exist for the owner
     * @throws InvalidScheduleException when the new schedule is invalid
     */
    public ScheduledValidationJob updateJob(String jobId, String ownerId, JobUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        ScheduledValidationJob job = requireJob(jobId, ownerId);
        if (update.isEmpty()) {
            return job;
        }

        String cron = update.has(Field.CRON_EXPRESSION) ? update.cronExpression() : job.getCronExpression();
        String timezone = update.has(Field.TIMEZONE) ? update.timezone() : job.getTimezone();
        if (update.has(Field.CRON_EXPRESSION) || update.has(Field.TIMEZONE)) {
            CronExpressions.validate(cron, timezone);
        }

        for (Field field : update.fields()) {
            switch (field) {
                case NAME -> job.setName(update.name());
                case PREFIX -> job.setPrefix(update.prefix());
                case FILE_PATTERN -> job.setFilePattern(update.filePattern());
                case CRON_EXPRESSION -> job.setCronExpression(cron);
                case TIMEZONE -> job.setTimezone(timezone);
                case ENABLED -> job.setEnabled(update.enabled());
                case DELETE_AFTER_VALIDATION -> job.setDeleteAfterValidation(update.deleteAfterValidation());
                case MOVE_TO_FOLDER -> job.setMoveToFolder(blankToNull(update.moveToFolder()));
                case WEBHOOK_URL -> job.setWebhookUrl(blankToNull(update.webhookUrl()));
                case CREDENTIALS -> job.setEncryptedCredentials(encryptCredentials(update.credentials()));
            }
        }

        if (update.affectsSchedule()) {
            job.setStatus(job.isEnabled() ? JobStatus.ACTIVE : JobStatus.PAUSED);
        }
        job.setUpdatedAt(clock.instant());
        jobStore.saveJob(job);

        if (update.affectsSchedule()) {
            if (job.isEnabled()) {
                register(job);
            } else {
                scheduler.removeJob(job.getId());
            }
        }
        log.info("Updated scheduled job id={} fields={}", job.getId(), update.fields());
        return job;
    }

    /**
     * Remove the timer and delete the job with its runs and files. An in-flight run is not interrupted.
     */
    public boolean deleteJob(String jobId, String ownerId) {
        ScheduledValidationJob job = jobStore.findJob(jobId, ownerId).orElse(null);
        if (job == null) {
            return false;
        }
        scheduler.removeJob(jobId);
        boolean deleted = jobStore.deleteJob(jobId);
        log.info("Deleted scheduled job id={} owner={}", jobId, ownerId);
        return deleted;
    }

    public Optional<ScheduledValidationJob> getJob(String jobId, String ownerId) {
        return jobStore.findJob(jobId, ownerId);
    }

    public List<ScheduledValidationJob> listJobs(String ownerId) {
        return jobStore.findJobsByOwner(ownerId);
    }

    /**
     * Newest first.
     */
    public List<JobRun> getRuns(String jobId, String ownerId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        requireJob(jobId, ownerId);
        return jobStore.findRuns(jobId, limit);
    }

    public List<ProcessedFile> getRunFiles(String runId) {
        return jobStore.findFiles(runId);
    }

    public Instant nextRunAt(String jobId) {
        return scheduler.nextFireTime(jobId);
    }

    /**
     * Run the job now on the scheduler's worker pool. The future completes with the run, or fails with
     * {@link io.invoiceops.exception.JobAlreadyRunningException} when a run is in progress.
     *
     * @throws IllegalArgumentException when the job does not exist for the owner
     * @throws IllegalStateException    when the job is disabled
     */
    public CompletableFuture<JobRun> triggerRun(String jobId, String ownerId) {
        ScheduledValidationJob job = requireJob(jobId, ownerId);
        if (!job.isEnabled()) {
            throw new IllegalStateException("Job is disabled: " + jobId);
        }
        log.info("Manual run requested id={} owner={}", jobId, ownerId);
        return scheduler.submitExclusive(jobId, () -> jobRunner.run(jobId));
    }

    /**
     * Register timers for every enabled job. Called once at startup, since the scheduler keeps no state.
     *
     * @return number of registered jobs
     */
    public int registerEnabledJobs() {
        int registered = 0;
        for (ScheduledValidationJob job : jobStore.findEnabledJobs()) {
            try {
                register(job);
                registered++;
            } catch (InvalidScheduleException e) {
                log.error("Skipping job with invalid stored schedule id={} cron='{}' timezone={} msg={}",
                        job.getId(), job.getCronExpression(), job.getTimezone(), e.getMessage());
            }
        }
        log.info("Registered enabled scheduled jobs count={}", registered);
        return registered;
    }

    private void register(ScheduledValidationJob job) {
        String jobId = job.getId();
        scheduler.addJob(jobId, job.getCronExpression(), job.getTimezone(), () -> jobRunner.run(jobId));
    }

    private ScheduledValidationJob requireJob(String jobId, String ownerId) {
        return jobStore.findJob(jobId, ownerId)
                .orElseThrow(() -> new IllegalArgumentException("Scheduled job not found: " + jobId));
    }

    private String encryptCredentials(StorageCredentials credentials) {
        try {
            return credentialVault.encrypt(objectMapper.writeValueAsString(credentials));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Credentials cannot be serialized", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
