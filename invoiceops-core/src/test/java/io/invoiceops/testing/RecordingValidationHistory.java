package io.invoiceops.testing;

import io.invoiceops.ValidationHistory;
import io.invoiceops.core.ValidationOutcome;

import java.util.ArrayList;
import java.util.List;

public class RecordingValidationHistory implements ValidationHistory {

    public record Entry(String id, String ownerId, String fileName, long sizeBytes, ValidationOutcome outcome) {
    }

    private final List<Entry> entries = new ArrayList<>();

    @Override
    public synchronized String record(String ownerId, String fileName, long sizeBytes, ValidationOutcome outcome) {
        String id = "val-" + (entries.size() + 1);
        entries.add(new Entry(id, ownerId, fileName, sizeBytes, outcome));
        return id;
    }

    public synchronized List<Entry> entries() {
        return new ArrayList<>(entries);
    }
}
