package io.invoiceops.core;

import java.time.Instant;

/**
 * A validation result that may be published to webhook subscribers.
 */
public record ValidationEvent(
        String validationId,
        String fileName,
        String fileType,
        boolean valid,
        int errorCount,
        int warningCount,
        Instant validatedAt,
        String jobId,
        String runId
) {
    public static ValidationEvent of(String validationId, String fileName, ValidationOutcome outcome,
                                     Instant validatedAt, String jobId, String runId) {
        return new ValidationEvent(
                validationId,
                fileName,
                outcome.fileType(),
                outcome.valid(),
                outcome.errorCount(),
                outcome.warningCount(),
                validatedAt,
                jobId,
                runId
        );
    }
}
