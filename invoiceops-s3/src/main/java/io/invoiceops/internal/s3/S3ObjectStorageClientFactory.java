package io.invoiceops.internal.s3;

import io.invoiceops.ObjectStorageClient;
import io.invoiceops.ObjectStorageClientFactory;
import io.invoiceops.core.StorageCredentials;
import io.invoiceops.core.StorageProvider;
import io.invoiceops.exception.CredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.util.Objects;

/**
 * Opens an {@link S3ObjectStorageClient} per job run from the job's own static credentials.
 */
public class S3ObjectStorageClientFactory implements ObjectStorageClientFactory {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorageClientFactory.class);

    private final S3ClientSettings settings;

    public S3ObjectStorageClientFactory(S3ClientSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public StorageProvider provider() {
        return StorageProvider.S3;
    }

    /**
     * @throws CredentialException when the S3 section, access key or secret is missing, or the endpoint is malformed
     */
    @Override
    public ObjectStorageClient open(StorageCredentials credentials) {
        Objects.requireNonNull(credentials, "credentials must not be null");
        StorageCredentials.S3 s3 = credentials.s3();
        if (s3 == null || isBlank(s3.accessKeyId()) || isBlank(s3.secretAccessKey())) {
            throw new CredentialException("Invalid AWS credentials");
        }
        return new S3ObjectStorageClient(buildClient(s3));
    }

    S3Client buildClient(StorageCredentials.S3 s3) {
        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(s3.accessKeyId(), s3.secretAccessKey())))
                .region(Region.of(s3.region()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(settings.apiCallTimeout())
                        .apiCallAttemptTimeout(settings.apiCallAttemptTimeout())
                        .build());

        if (!isBlank(s3.endpoint())) {
            URI endpoint;
            try {
                endpoint = URI.create(s3.endpoint());
            } catch (IllegalArgumentException e) {
                throw new CredentialException("Invalid S3 endpoint: " + s3.endpoint(), e);
            }
            if (endpoint.getScheme() == null || endpoint.getHost() == null) {
                throw new CredentialException("Invalid S3 endpoint: " + s3.endpoint());
            }
            builder.endpointOverride(endpoint).forcePathStyle(true);
        }

        log.debug("Opening S3 client region={} endpoint={}", s3.region(), s3.endpoint());
        return builder.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
