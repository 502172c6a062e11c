package io.invoiceops.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provider credentials, stored encrypted on the job. Only one provider section is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StorageCredentials(
        @JsonProperty("s3") S3 s3
) {

    public static StorageCredentials ofS3(String accessKeyId, String secretAccessKey, String region) {
        return new StorageCredentials(new S3(accessKeyId, secretAccessKey, region, null));
    }

    @Override
    public String toString() {
        return "StorageCredentials[s3=" + s3 + "]";
    }

    /**
     * @param endpoint optional endpoint override for S3-compatible stores
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record S3(
            @JsonProperty("access_key_id") String accessKeyId,
            @JsonProperty("secret_access_key") String secretAccessKey,
            @JsonProperty("region") String region,
            @JsonProperty("endpoint") String endpoint
    ) {
        public static final String DEFAULT_REGION = "eu-central-1";

        public S3 {
            if (region == null || region.isBlank()) {
                region = DEFAULT_REGION;
            }
        }

        @Override
        public String toString() {
            return "S3[accessKeyId=" + mask(accessKeyId) + ", secretAccessKey=***, region=" + region
                    + ", endpoint=" + endpoint + "]";
        }

        private static String mask(String value) {
            if (value == null || value.length() <= 4) {
                return "***";
            }
            return value.substring(0, 4) + "***";
        }
    }
}
