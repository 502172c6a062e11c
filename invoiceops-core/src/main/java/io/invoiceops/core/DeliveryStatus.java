package io.invoiceops.core;

/**
 * Delivery state machine: {@code PENDING -> (RETRYING ->)* SUCCESS | FAILED}.
 */
public enum DeliveryStatus {
    PENDING,
    RETRYING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
