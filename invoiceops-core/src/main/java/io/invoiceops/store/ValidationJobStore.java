package io.invoiceops.store;

import io.invoiceops.model.JobRun;
import io.invoiceops.model.ProcessedFile;
import io.invoiceops.model.ScheduledValidationJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of scheduled jobs, their runs and processed files.
 *
 * <p>Runs and files are owned by their job and removed with it.
 */
public interface ValidationJobStore {

    Optional<ScheduledValidationJob> findJob(String jobId);

    Optional<ScheduledValidationJob> findJob(String jobId, String ownerId);

    List<ScheduledValidationJob> findJobsByOwner(String ownerId);

    List<ScheduledValidationJob> findEnabledJobs();

    /**
     * Insert or fully replace the job.
     */
    ScheduledValidationJob saveJob(ScheduledValidationJob job);

    /**
     * Delete the job with its runs and files.
     *
     * @return whether the job existed
     */
    boolean deleteJob(String jobId);

    void insertRun(JobRun run);

    void saveRun(JobRun run);

    /**
     * Newest first.
     */
    List<JobRun> findRuns(String jobId, int limit);

    void insertFile(ProcessedFile file);

    void saveFile(ProcessedFile file);

    /**
     * In insertion order.
     */
    List<ProcessedFile> findFiles(String runId);

    /**
     * Roll the run's counters into the job totals, set status {@code ACTIVE} and last run status
     * {@code SUCCESS}. Counters are incremented atomically.
     */
    void recordRunSuccess(String jobId, JobRun run, Instant at);

    /**
     * Set status {@code ERROR} and last run status {@code ERROR}. Totals are left unchanged.
     */
    void recordRunFailure(String jobId, Instant at);
}
