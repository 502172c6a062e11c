package io.invoiceops.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.invoiceops.core.ValidationEvent;
import io.invoiceops.core.WebhookEventType;
import io.invoiceops.utils.Ids;

import java.time.Instant;

/**
 * Body of a webhook request. Timestamps are ISO-8601 strings.
 */
public record ValidationEventPayload(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("validation_id") String validationId,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("file_type") String fileType,
        @JsonProperty("is_valid") boolean valid,
        @JsonProperty("error_count") int errorCount,
        @JsonProperty("warning_count") int warningCount,
        @JsonProperty("validated_at") String validatedAt,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("run_id") String runId
) {
    static ValidationEventPayload of(WebhookEventType type, ValidationEvent event, Instant now) {
        return new ValidationEventPayload(
                type.value(),
                Ids.eventId(),
                now.toString(),
                event.validationId(),
                event.fileName(),
                event.fileType(),
                event.valid(),
                event.errorCount(),
                event.warningCount(),
                event.validatedAt() != null ? event.validatedAt().toString() : null,
                event.jobId(),
                event.runId()
        );
    }

    static ValidationEventPayload test(Instant now) {
        return new ValidationEventPayload(
                WebhookEventType.TEST.value(),
                Ids.testEventId(),
                now.toString(),
                Ids.newId(),
                "test-invoice.xml",
                "xrechnung",
                true,
                0,
                1,
                now.toString(),
                null,
                null
        );
    }
}
