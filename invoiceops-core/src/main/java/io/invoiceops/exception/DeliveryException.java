package io.invoiceops.exception;

/**
 * A webhook request failed: non-2xx response, timeout or connection error.
 *
 * <p>Absorbed by the delivery state machine; callers of {@code attempt} never see it.
 */
public class DeliveryException extends InvoiceOpsException {

    private final Integer statusCode;
    private final String responseBody;

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
        this.responseBody = null;
    }

    public DeliveryException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * HTTP status of the response, or {@code null} when no response was received.
     */
    public Integer statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
