package io.invoiceops.core;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Partial update of a scheduled job. Only fields that were set are applied.
 *
 * <p>{@link Field#PREFIX}, {@link Field#MOVE_TO_FOLDER} and {@link Field#WEBHOOK_URL} may be set to
 * {@code null} to clear them; every other field rejects null.
 */
public final class JobUpdate {

    public enum Field {
        NAME,
        PREFIX,
        FILE_PATTERN,
        CRON_EXPRESSION,
        TIMEZONE,
        ENABLED,
        DELETE_AFTER_VALIDATION,
        MOVE_TO_FOLDER,
        WEBHOOK_URL,
        CREDENTIALS;

        /**
         * Fields whose change requires re-registering or removing the timer.
         */
        public boolean affectsSchedule() {
            return this == CRON_EXPRESSION || this == TIMEZONE || this == ENABLED;
        }
    }

    private final Set<Field> fields;
    private final String name;
    private final String prefix;
    private final String filePattern;
    private final String cronExpression;
    private final String timezone;
    private final Boolean enabled;
    private final Boolean deleteAfterValidation;
    private final String moveToFolder;
    private final String webhookUrl;
    private final StorageCredentials credentials;

    private JobUpdate(Builder b) {
        this.fields = Set.copyOf(b.fields);
        this.name = b.name;
        this.prefix = b.prefix;
        this.filePattern = b.filePattern;
        this.cronExpression = b.cronExpression;
        this.timezone = b.timezone;
        this.enabled = b.enabled;
        this.deleteAfterValidation = b.deleteAfterValidation;
        this.moveToFolder = b.moveToFolder;
        this.webhookUrl = b.webhookUrl;
        this.credentials = b.credentials;
    }

    public Set<Field> fields() {
        return fields;
    }

    public boolean has(Field field) {
        return fields.contains(field);
    }

    public boolean affectsSchedule() {
        return fields.stream().anyMatch(Field::affectsSchedule);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public String name() {
        return name;
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

    public Boolean enabled() {
        return enabled;
    }

    public Boolean deleteAfterValidation() {
        return deleteAfterValidation;
    }

    public String moveToFolder() {
        return moveToFolder;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public StorageCredentials credentials() {
        return credentials;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<Field> fields = EnumSet.noneOf(Field.class);
        private String name;
        private String prefix;
        private String filePattern;
        private String cronExpression;
        private String timezone;
        private Boolean enabled;
        private Boolean deleteAfterValidation;
        private String moveToFolder;
        private String webhookUrl;
        private StorageCredentials credentials;

        public Builder name(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            fields.add(Field.NAME);
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            fields.add(Field.PREFIX);
            return this;
        }

        public Builder filePattern(String filePattern) {
            if (filePattern == null || filePattern.isBlank()) {
                throw new IllegalArgumentException("filePattern must not be blank");
            }
            this.filePattern = filePattern;
            fields.add(Field.FILE_PATTERN);
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = Objects.requireNonNull(cronExpression, "cronExpression must not be null");
            fields.add(Field.CRON_EXPRESSION);
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
            fields.add(Field.TIMEZONE);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            fields.add(Field.ENABLED);
            return this;
        }

        public Builder deleteAfterValidation(boolean deleteAfterValidation) {
            this.deleteAfterValidation = deleteAfterValidation;
            fields.add(Field.DELETE_AFTER_VALIDATION);
            return this;
        }

        public Builder moveToFolder(String moveToFolder) {
            this.moveToFolder = moveToFolder;
            fields.add(Field.MOVE_TO_FOLDER);
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            fields.add(Field.WEBHOOK_URL);
            return this;
        }

        public Builder credentials(StorageCredentials credentials) {
            this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
            fields.add(Field.CREDENTIALS);
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(this);
        }
    }
}
