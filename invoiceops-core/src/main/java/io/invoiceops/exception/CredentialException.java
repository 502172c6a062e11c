package io.invoiceops.exception;

import io.invoiceops.core.ErrorKind;

/**
 * Credentials are missing, malformed, expired or rejected by the provider.
 */
public class CredentialException extends StorageException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CREDENTIALS;
    }
}
