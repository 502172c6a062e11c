package io.invoiceops.model;

import io.invoiceops.core.RunStatus;

import java.time.Instant;

/**
 * One firing of a scheduled job. The terminal status is set exactly once.
 */
public class JobRun {

    private String id;
    private String jobId;
    private RunStatus status;
    private Instant startedAt;
    private Instant completedAt;

    private int filesFound;
    private int filesValidated;
    private int filesValid;
    private int filesInvalid;
    private int filesFailed;

    private String errorMessage;

    public JobRun() {
    }

    public static JobRun running(String id, String jobId, Instant startedAt) {
        JobRun run = new JobRun();
        run.id = id;
        run.jobId = jobId;
        run.status = RunStatus.RUNNING;
        run.startedAt = startedAt;
        return run;
    }

    public void recordValidated(boolean valid) {
        filesValidated++;
        if (valid) {
            filesValid++;
        } else {
            filesInvalid++;
        }
    }

    public void recordFailed() {
        filesFailed++;
    }

    public void complete(Instant at) {
        finish(RunStatus.COMPLETED, at, null);
    }

    public void fail(Instant at, String errorMessage) {
        finish(RunStatus.FAILED, at, errorMessage);
    }

    private void finish(RunStatus terminal, Instant at, String error) {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " is already " + status);
        }
        this.status = terminal;
        this.completedAt = at;
        this.errorMessage = error;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public int getFilesFound() {
        return filesFound;
    }

    public void setFilesFound(int filesFound) {
        this.filesFound = filesFound;
    }

    public int getFilesValidated() {
        return filesValidated;
    }

    public void setFilesValidated(int filesValidated) {
        this.filesValidated = filesValidated;
    }

    public int getFilesValid() {
        return filesValid;
    }

    public void setFilesValid(int filesValid) {
        this.filesValid = filesValid;
    }

    public int getFilesInvalid() {
        return filesInvalid;
    }

    public void setFilesInvalid(int filesInvalid) {
        this.filesInvalid = filesInvalid;
    }

    public int getFilesFailed() {
        return filesFailed;
    }

    public void setFilesFailed(int filesFailed) {
        this.filesFailed = filesFailed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
