package io.invoiceops.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoiceops.CredentialVault;
import io.invoiceops.ObjectStorageClient;
import io.invoiceops.ValidationCapability;
import io.invoiceops.ValidationEventSink;
import io.invoiceops.ValidationHistory;
import io.invoiceops.core.ObjectStorageClients;
import io.invoiceops.core.PostAction;
import io.invoiceops.core.StorageCredentials;
import io.invoiceops.core.StorageObject;
import io.invoiceops.core.ValidationCapabilityRegistry;
import io.invoiceops.core.ValidationEvent;
import io.invoiceops.core.ValidationOutcome;
import io.invoiceops.exception.CredentialException;
import io.invoiceops.exception.FileProcessingException;
import io.invoiceops.exception.FileProcessingException.Stage;
import io.invoiceops.model.JobRun;
import io.invoiceops.model.ProcessedFile;
import io.invoiceops.model.ScheduledValidationJob;
import io.invoiceops.store.ValidationJobStore;
import io.invoiceops.utils.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Executes one firing of a scheduled validation job: list, download, validate, record, post-action.
 *
 * <p>Failures before per-file processing (credentials, provider, listing) fail the whole run and
 * put the job into {@code ERROR}. Failures of a single file are recorded on that file and the
 * remaining files are still processed.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final ValidationJobStore jobStore;
    private final CredentialVault credentialVault;
    private final ObjectStorageClients storageClients;
    private final ValidationCapabilityRegistry capabilities;
    private final ValidationHistory validationHistory;
    private final ValidationEventSink eventSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JobRunner(
            ValidationJobStore jobStore,
            CredentialVault credentialVault,
            ObjectStorageClients storageClients,
            ValidationCapabilityRegistry capabilities,
            ValidationHistory validationHistory,
            ValidationEventSink eventSink,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.credentialVault = Objects.requireNonNull(credentialVault, "credentialVault must not be null");
        this.storageClients = Objects.requireNonNull(storageClients, "storageClients must not be null");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
        this.validationHistory = Objects.requireNonNull(validationHistory, "validationHistory must not be null");
        this.eventSink = eventSink != null ? eventSink : ValidationEventSink.NOOP;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return the finished run, or {@code null} when the job does not exist or is disabled
     */
    public JobRun run(String jobId) {
        ScheduledValidationJob job = jobStore.findJob(jobId).orElse(null);
        if (job == null) {
            log.warn("Scheduled job not found id={}", jobId);
            return null;
        }
        if (!job.isEnabled()) {
            log.info("Scheduled job is disabled, skipping id={}", jobId);
            return null;
        }

        JobRun run = JobRun.running(Ids.newId(), jobId, clock.instant());
        jobStore.insertRun(run);
        log.info("Scheduled job run started jobId={} runId={}", jobId, run.getId());

        try (ObjectStorageClient client = openClient(job)) {
            List<StorageObject> files = client.listFiles(job.getBucketName(), job.getPrefix(), job.getFilePattern());
            run.setFilesFound(files.size());
            jobStore.saveRun(run);
            log.info("Scheduled job listed files jobId={} runId={} found={}", jobId, run.getId(), files.size());

            for (StorageObject file : files) {
                processFile(job, run, client, file);
            }
        } catch (RuntimeException e) {
            log.error("Scheduled job run failed jobId={} runId={} msg={}", jobId, run.getId(), e.getMessage(), e);
            run.fail(clock.instant(), errorText(e));
            jobStore.saveRun(run);
            jobStore.recordRunFailure(jobId, run.getCompletedAt());
            return run;
        }

        run.complete(clock.instant());
        jobStore.saveRun(run);
        jobStore.recordRunSuccess(jobId, run, run.getCompletedAt());
        log.info("Scheduled job run completed jobId={} runId={} found={} validated={} valid={} invalid={} failed={}",
                jobId, run.getId(), run.getFilesFound(), run.getFilesValidated(), run.getFilesValid(),
                run.getFilesInvalid(), run.getFilesFailed());
        return run;
    }

    private ObjectStorageClient openClient(ScheduledValidationJob job) {
        String json = credentialVault.decrypt(job.getEncryptedCredentials());
        StorageCredentials credentials;
        try {
            credentials = objectMapper.readValue(json, StorageCredentials.class);
        } catch (JsonProcessingException e) {
            // the message of a Jackson error can quote the plaintext
            throw new CredentialException("Stored credentials are malformed");
        }
        return storageClients.open(job.getProvider(), credentials);
    }

    private void processFile(ScheduledValidationJob job, JobRun run, ObjectStorageClient client, StorageObject object) {
        // inserted before download so an interrupted run still shows which file it was on
        ProcessedFile file = ProcessedFile.discovered(Ids.newId(), run.getId(), object);
        try {
            jobStore.insertFile(file);
        } catch (RuntimeException e) {
            // an untracked file is not downloaded, so no post action runs on it
            log.error("Failed to track file, skipping jobId={} key={} msg={}", job.getId(), object.key(), e.getMessage(), e);
            run.recordFailed();
            return;
        }

        try {
            byte[] content = download(job, client, object);
            ValidationOutcome outcome = validate(job, object, content);
            String validationId = record(job, object, outcome);
            file.recordOutcome(outcome, validationId, clock.instant());
            publish(job, run, object, outcome, validationId);

            applyPostAction(job, client, object);
            run.recordValidated(outcome.valid());
            log.debug("Validated file jobId={} key={} valid={} errors={} warnings={}",
                    job.getId(), object.key(), outcome.valid(), outcome.errorCount(), outcome.warningCount());
        } catch (FileProcessingException e) {
            log.error("Failed to process file jobId={} key={} stage={} msg={}",
                    job.getId(), e.fileKey(), e.stage(), e.getMessage(), e);
            file.recordError(e.getMessage(), clock.instant());
            run.recordFailed();
        }

        saveProgress(job, run, file);
    }

    private void saveProgress(ScheduledValidationJob job, JobRun run, ProcessedFile file) {
        try {
            jobStore.saveFile(file);
            jobStore.saveRun(run);
        } catch (RuntimeException e) {
            // the run counters already hold the outcome and are stored when the run finishes
            log.error("Failed to store file result jobId={} runId={} file={} msg={}",
                    job.getId(), run.getId(), file.getFileName(), e.getMessage(), e);
        }
    }

    private byte[] download(ScheduledValidationJob job, ObjectStorageClient client, StorageObject object) {
        try {
            return client.downloadFile(job.getBucketName(), object.key());
        } catch (RuntimeException e) {
            throw new FileProcessingException(Stage.DOWNLOAD, object.key(), errorText(e), e);
        }
    }

    private ValidationOutcome validate(ScheduledValidationJob job, StorageObject object, byte[] content) {
        ValidationCapability capability = capabilities.forFileName(object.name())
                .orElseThrow(() -> new FileProcessingException(Stage.VALIDATE, object.key(),
                        "No validator for file: " + object.name(), null));
        try {
            ValidationOutcome outcome = capability.validate(content, object.name(), job.getOwnerId());
            if (outcome == null) {
                throw new IllegalStateException(capability.name() + " returned no result");
            }
            return outcome;
        } catch (Exception e) {
            throw new FileProcessingException(Stage.VALIDATE, object.key(), errorText(e), e);
        }
    }

    private String record(ScheduledValidationJob job, StorageObject object, ValidationOutcome outcome) {
        try {
            return validationHistory.record(job.getOwnerId(), object.name(), object.size(), outcome);
        } catch (RuntimeException e) {
            throw new FileProcessingException(Stage.RECORD, object.key(), errorText(e), e);
        }
    }

    private void applyPostAction(ScheduledValidationJob job, ObjectStorageClient client, StorageObject object) {
        PostAction action = job.postAction();
        try {
            switch (action) {
                case MOVE -> {
                    String destination = job.moveDestination(object.name());
                    client.moveFile(job.getBucketName(), object.key(), destination);
                    log.info("Moved file jobId={} from={} to={}", job.getId(), object.key(), destination);
                }
                case DELETE -> {
                    client.deleteFile(job.getBucketName(), object.key());
                    log.info("Deleted file jobId={} key={}", job.getId(), object.key());
                }
                case NONE -> {
                }
            }
        } catch (RuntimeException e) {
            throw new FileProcessingException(Stage.POST_ACTION, object.key(), errorText(e), e);
        }
    }

    private void publish(ScheduledValidationJob job, JobRun run, StorageObject object, ValidationOutcome outcome,
                         String validationId) {
        try {
            eventSink.onValidated(job.getOwnerId(),
                    ValidationEvent.of(validationId, object.name(), outcome, clock.instant(), job.getId(), run.getId()));
        } catch (RuntimeException e) {
            log.warn("Validation event not published jobId={} key={} msg={}", job.getId(), object.key(), e.getMessage(), e);
        }
    }

    private static String errorText(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
