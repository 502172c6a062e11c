package io.invoiceops.exception;

/**
 * Root of the unchecked exceptions raised by the orchestration engine.
 */
public class InvoiceOpsException extends RuntimeException {

    public InvoiceOpsException(String message) {
        super(message);
    }

    public InvoiceOpsException(String message, Throwable cause) {
        super(message, cause);
    }
}
