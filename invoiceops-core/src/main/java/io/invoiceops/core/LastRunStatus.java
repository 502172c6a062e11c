package io.invoiceops.core;

public enum LastRunStatus {
    SUCCESS,
    ERROR
}
