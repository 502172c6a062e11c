package io.invoiceops.exception;

import io.invoiceops.core.ErrorKind;

/**
 * Access to the bucket or container was denied.
 */
public class StoragePermissionException extends StorageException {

    public StoragePermissionException(String message) {
        super(message);
    }

    public StoragePermissionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMISSION;
    }
}
