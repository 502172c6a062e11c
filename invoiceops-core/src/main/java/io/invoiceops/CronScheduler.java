package io.invoiceops;

import io.invoiceops.core.ScheduleEntry;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * In-process registry of recurring triggers, one per job id.
 *
 * <p>The registry is not persistent: it is empty after {@link #start()} on a cold process and
 * the owner replays enabled jobs from storage.
 *
 * <pre>{@code
 * scheduler.start();
 * scheduler.addJob(job.getId(), "0 6 * * 1-5", "Europe/Berlin", () -> jobRunner.run(job.getId()));
 * scheduler.shutdown(true);
 * }</pre>
 */
public interface CronScheduler {

    /**
     * Start the timer loop. Idempotent.
     */
    void start();

    /**
     * Stop the timer loop. Registrations are kept and re-armed by a later {@link #start()}.
     *
     * @param waitForRunning block until in-flight job bodies finish (bounded by the shutdown timeout)
     */
    void shutdown(boolean waitForRunning);

    boolean isRunning();

    /**
     * Register or atomically replace the trigger for {@code jobId}.
     *
     * @param cronExpression 5-field cron: minute hour day-of-month month day-of-week
     * @param timezone       IANA zone id the expression is interpreted in
     * @throws io.invoiceops.exception.InvalidScheduleException when the expression or zone is invalid;
     *                                                          nothing is registered in that case
     */
    void addJob(String jobId, String cronExpression, String timezone, JobCallback callback);

    /**
     * @return whether a registration existed
     */
    boolean removeJob(String jobId);

    /**
     * @throws IllegalArgumentException when no registration exists for {@code jobId}
     */
    void pauseJob(String jobId);

    /**
     * @throws IllegalArgumentException when no registration exists for {@code jobId}
     */
    void resumeJob(String jobId);

    /**
     * @return the next firing, or {@code null} when the job is unknown or paused
     */
    Instant nextFireTime(String jobId);

    List<ScheduleEntry> getAllJobs();

    /**
     * Run {@code task} on the scheduler's worker pool under the same one-instance-per-job rule as
     * cron firings. The future fails with {@link io.invoiceops.exception.JobAlreadyRunningException}
     * when a run for the job is in flight.
     */
    <T> CompletableFuture<T> submitExclusive(String jobId, Callable<T> task);
}
