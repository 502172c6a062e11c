package io.invoiceops.core;

/**
 * Operational status of a scheduled job.
 */
public enum JobStatus {
    ACTIVE,
    PAUSED,
    ERROR
}
