package io.invoiceops;

import io.invoiceops.core.ValidationEvent;

/**
 * Receives every successfully validated file of a scheduled run.
 */
@FunctionalInterface
public interface ValidationEventSink {

    ValidationEventSink NOOP = (ownerId, event) -> {
    };

    void onValidated(String ownerId, ValidationEvent event);
}
