package io.invoiceops;

import io.invoiceops.core.ValidationOutcome;

/**
 * A validator for one invoice format, e.g. XRechnung XML or ZUGFeRD PDF.
 */
public interface ValidationCapability {

    String name();

    /**
     * Whether this capability handles {@code fileName}, decided by extension.
     */
    boolean supports(String fileName);

    ValidationOutcome validate(byte[] content, String fileName, String ownerId) throws Exception;
}
