package io.invoiceops.core;

/**
 * Classification of an expected connection failure.
 */
public enum ErrorKind {
    CREDENTIALS,
    NOT_FOUND,
    PERMISSION,
    UNSUPPORTED_PROVIDER,
    UNKNOWN
}
