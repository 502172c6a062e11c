package io.invoiceops.core;

import java.util.Map;

/**
 * Result returned by a {@link io.invoiceops.ValidationCapability}.
 */
public record ValidationOutcome(
        boolean valid,
        int errorCount,
        int warningCount,
        String fileType,
        Map<String, Object> metadata
) {
    public ValidationOutcome {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ValidationOutcome valid(String fileType, int warningCount) {
        return new ValidationOutcome(true, 0, warningCount, fileType, Map.of());
    }

    public static ValidationOutcome invalid(String fileType, int errorCount, int warningCount) {
        return new ValidationOutcome(false, errorCount, warningCount, fileType, Map.of());
    }
}
