package io.invoiceops;

import io.invoiceops.core.ValidationOutcome;

/**
 * Durable record of validation results, shared with interactive validations.
 */
public interface ValidationHistory {

    /**
     * @return id of the stored record, linked from the processed file
     */
    String record(String ownerId, String fileName, long sizeBytes, ValidationOutcome outcome);
}
