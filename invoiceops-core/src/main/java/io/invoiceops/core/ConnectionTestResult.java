package io.invoiceops.core;

/**
 * Outcome of a storage connection pre-flight.
 *
 * @param ok        true when the bucket is reachable with the given credentials
 * @param errorKind failure classification, null when ok
 * @param message   human-readable reason
 */
public record ConnectionTestResult(
        boolean ok,
        ErrorKind errorKind,
        String message
) {
    public static ConnectionTestResult success() {
        return new ConnectionTestResult(true, null, "Connection successful");
    }

    public static ConnectionTestResult failure(ErrorKind kind, String message) {
        return new ConnectionTestResult(false, kind, message);
    }
}
