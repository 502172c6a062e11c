package io.invoiceops.exception;

import io.invoiceops.core.ErrorKind;

/**
 * Failure talking to a remote object store.
 *
 * <p>Raised before per-file processing starts, it aborts the whole run.
 */
public class StorageException extends InvoiceOpsException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind kind() {
        return ErrorKind.UNKNOWN;
    }
}
