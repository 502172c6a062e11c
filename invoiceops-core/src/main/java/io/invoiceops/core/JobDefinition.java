package io.invoiceops.core;

import java.util.Objects;

/**
 * Everything needed to create a scheduled validation job.
 *
 * <p>Credentials are plaintext here; they are encrypted before the job is persisted.
 */
public final class JobDefinition {

    public static final String DEFAULT_FILE_PATTERN = "*.xml";
    public static final String DEFAULT_TIMEZONE = "Europe/Berlin";

    private final String ownerId;
    private final String name;
    private final StorageProvider provider;
    private final StorageCredentials credentials;
    private final String bucketName;
    private final String prefix;
    private final String filePattern;
    private final String cronExpression;
    private final String timezone;
    private final boolean deleteAfterValidation;
    private final String moveToFolder;
    private final String webhookUrl;

    private JobDefinition(Builder b) {
        this.ownerId = b.ownerId;
        this.name = b.name;
        this.provider = b.provider;
        this.credentials = b.credentials;
        this.bucketName = b.bucketName;
        this.prefix = b.prefix;
        this.filePattern = b.filePattern;
        this.cronExpression = b.cronExpression;
        this.timezone = b.timezone;
        this.deleteAfterValidation = b.deleteAfterValidation;
        this.moveToFolder = b.moveToFolder;
        this.webhookUrl = b.webhookUrl;
    }

    public String ownerId() {
        return ownerId;
    }

    public String name() {
        return name;
    }

    public StorageProvider provider() {
        return provider;
    }

    public StorageCredentials credentials() {
        return credentials;
    }

    public String bucketName() {
        return bucketName;
    }

    public String prefix() {
        return prefix;
    }

    public String filePattern() {
        return filePattern;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public String timezone() {
        return timezone;
    }

    public boolean deleteAfterValidation() {
        return deleteAfterValidation;
    }

    public String moveToFolder() {
        return moveToFolder;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String ownerId;
        private String name;
        private StorageProvider provider = StorageProvider.S3;
        private StorageCredentials credentials;
        private String bucketName;
        private String prefix;
        private String filePattern = DEFAULT_FILE_PATTERN;
        private String cronExpression;
        private String timezone = DEFAULT_TIMEZONE;
        private boolean deleteAfterValidation;
        private String moveToFolder;
        private String webhookUrl;

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder provider(StorageProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder credentials(StorageCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder bucketName(String bucketName) {
            this.bucketName = bucketName;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder filePattern(String filePattern) {
            this.filePattern = filePattern;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder deleteAfterValidation(boolean deleteAfterValidation) {
            this.deleteAfterValidation = deleteAfterValidation;
            return this;
        }

        public Builder moveToFolder(String moveToFolder) {
            this.moveToFolder = moveToFolder;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public JobDefinition build() {
            Objects.requireNonNull(ownerId, "ownerId must not be null");
            Objects.requireNonNull(provider, "provider must not be null");
            Objects.requireNonNull(credentials, "credentials must not be null");
            Objects.requireNonNull(cronExpression, "cronExpression must not be null");
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            if (bucketName == null || bucketName.isBlank()) {
                throw new IllegalArgumentException("bucketName must not be blank");
            }
            if (filePattern == null || filePattern.isBlank()) {
                filePattern = DEFAULT_FILE_PATTERN;
            }
            if (timezone == null || timezone.isBlank()) {
                timezone = DEFAULT_TIMEZONE;
            }
            return new JobDefinition(this);
        }
    }
}
