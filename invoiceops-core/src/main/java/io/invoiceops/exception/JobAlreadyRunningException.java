package io.invoiceops.exception;

public class JobAlreadyRunningException extends InvoiceOpsException {

    private final String jobId;

    public JobAlreadyRunningException(String jobId) {
        super("Job is already running: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
