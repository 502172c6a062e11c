package io.invoiceops.model;

import io.invoiceops.core.StorageObject;
import io.invoiceops.core.ValidationOutcome;

import java.time.Instant;

/**
 * One file discovered during a run.
 *
 * <p>Either the outcome fields or the error text are populated. A file whose post-action failed
 * carries both.
 */
public class ProcessedFile {

    private String id;
    private String runId;
    private String fileKey;
    private String fileName;
    private long fileSize;

    private Boolean valid;
    private Integer errorCount;
    private Integer warningCount;
    private String validationId;

    private String errorMessage;
    private Instant processedAt;

    public ProcessedFile() {
    }

    public static ProcessedFile discovered(String id, String runId, StorageObject object) {
        ProcessedFile file = new ProcessedFile();
        file.id = id;
        file.runId = runId;
        file.fileKey = object.key();
        file.fileName = object.name();
        file.fileSize = object.size();
        return file;
    }

    public void recordOutcome(ValidationOutcome outcome, String validationId, Instant at) {
        this.valid = outcome.valid();
        this.errorCount = outcome.errorCount();
        this.warningCount = outcome.warningCount();
        this.validationId = validationId;
        this.processedAt = at;
    }

    public void recordError(String errorMessage, Instant at) {
        this.errorMessage = errorMessage;
        this.processedAt = at;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getFileKey() {
        return fileKey;
    }

    public void setFileKey(String fileKey) {
        this.fileKey = fileKey;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public Boolean getValid() {
        return valid;
    }

    public void setValid(Boolean valid) {
        this.valid = valid;
    }

    public Integer getErrorCount() {
        return errorCount;
    }

    public void setErrorCount(Integer errorCount) {
        this.errorCount = errorCount;
    }

    public Integer getWarningCount() {
        return warningCount;
    }

    public void setWarningCount(Integer warningCount) {
        this.warningCount = warningCount;
    }

    public String getValidationId() {
        return validationId;
    }

    public void setValidationId(String validationId) {
        this.validationId = validationId;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(Instant processedAt) {
        this.processedAt = processedAt;
    }
}
