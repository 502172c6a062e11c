package io.invoiceops.model;

import io.invoiceops.core.JobStatus;
import io.invoiceops.core.LastRunStatus;
import io.invoiceops.core.PostAction;
import io.invoiceops.core.StorageProvider;

import java.time.Instant;

/**
 * A recurring validation of files in one bucket.
 */
public class ScheduledValidationJob {

    private String id;
    private String ownerId;
    private String name;

    private StorageProvider provider;
    private String encryptedCredentials;
    private String bucketName;
    private String prefix;
    private String filePattern;

    private String cronExpression;
    private String timezone;
    private boolean enabled;
    private JobStatus status;

    private boolean deleteAfterValidation;
    private String moveToFolder;
    private String webhookUrl;

    private long totalRuns;
    private long totalFilesValidated;
    private long totalFilesValid;
    private long totalFilesInvalid;

    private Instant lastRunAt;
    private LastRunStatus lastRunStatus;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduledValidationJob() {
    }

    public PostAction postAction() {
        return PostAction.of(deleteAfterValidation, moveToFolder);
    }

    /**
     * Destination key of {@code fileName} when the job moves validated files.
     */
    public String moveDestination(String fileName) {
        String folder = moveToFolder;
        while (folder.endsWith("/")) {
            folder = folder.substring(0, folder.length() - 1);
        }
        return folder + "/" + fileName;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public StorageProvider getProvider() {
        return provider;
    }

    public void setProvider(StorageProvider provider) {
        this.provider = provider;
    }

    public String getEncryptedCredentials() {
        return encryptedCredentials;
    }

    public void setEncryptedCredentials(String encryptedCredentials) {
        this.encryptedCredentials = encryptedCredentials;
    }

    public String getBucketName() {
        return bucketName;
    }

    public void setBucketName(String bucketName) {
        this.bucketName = bucketName;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getFilePattern() {
        return filePattern;
    }

    public void setFilePattern(String filePattern) {
        this.filePattern = filePattern;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public boolean isDeleteAfterValidation() {
        return deleteAfterValidation;
    }

    public void setDeleteAfterValidation(boolean deleteAfterValidation) {
        this.deleteAfterValidation = deleteAfterValidation;
    }

    public String getMoveToFolder() {
        return moveToFolder;
    }

    public void setMoveToFolder(String moveToFolder) {
        this.moveToFolder = moveToFolder;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public long getTotalRuns() {
        return totalRuns;
    }

    public void setTotalRuns(long totalRuns) {
        this.totalRuns = totalRuns;
    }

    public long getTotalFilesValidated() {
        return totalFilesValidated;
    }

    public void setTotalFilesValidated(long totalFilesValidated) {
        this.totalFilesValidated = totalFilesValidated;
    }

    public long getTotalFilesValid() {
        return totalFilesValid;
    }

    public void setTotalFilesValid(long totalFilesValid) {
        this.totalFilesValid = totalFilesValid;
    }

    public long getTotalFilesInvalid() {
        return totalFilesInvalid;
    }

    public void setTotalFilesInvalid(long totalFilesInvalid) {
        this.totalFilesInvalid = totalFilesInvalid;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public LastRunStatus getLastRunStatus() {
        return lastRunStatus;
    }

    public void setLastRunStatus(LastRunStatus lastRunStatus) {
        this.lastRunStatus = lastRunStatus;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
