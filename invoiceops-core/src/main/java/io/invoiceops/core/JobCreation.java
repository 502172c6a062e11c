package io.invoiceops.core;

import io.invoiceops.model.ScheduledValidationJob;

/**
 * Result of creating a job: the connection pre-flight and, when it passed, the persisted job.
 */
public record JobCreation(
        ConnectionTestResult connection,
        ScheduledValidationJob job
) {
    public boolean created() {
        return job != null;
    }

    public static JobCreation rejected(ConnectionTestResult connection) {
        return new JobCreation(connection, null);
    }
}
