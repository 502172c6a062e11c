package io.invoiceops.internal.s3;

import io.invoiceops.exception.CredentialException;
import io.invoiceops.exception.StorageException;
import io.invoiceops.exception.StorageNotFoundException;
import io.invoiceops.exception.StoragePermissionException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.Set;

/**
 * Maps AWS SDK failures onto the storage exception hierarchy.
 */
final class S3Errors {

    private static final Set<String> CREDENTIAL_ERROR_CODES = Set.of(
            "InvalidAccessKeyId",
            "SignatureDoesNotMatch",
            "ExpiredToken",
            "InvalidToken",
            "TokenRefreshRequired"
    );

    private S3Errors() {
    }

    /**
     * @param key object key, or null for bucket-level calls
     */
    static StorageException translate(SdkException e, String bucket, String key) {
        if (e instanceof NoSuchBucketException) {
            return new StorageNotFoundException(bucketNotFound(bucket), e);
        }
        if (e instanceof NoSuchKeyException) {
            return new StorageNotFoundException("Object not found: " + key, e);
        }
        if (e instanceof S3Exception s3) {
            String code = s3.awsErrorDetails() == null ? null : s3.awsErrorDetails().errorCode();
            if (code != null && CREDENTIAL_ERROR_CODES.contains(code)) {
                return new CredentialException("Invalid AWS credentials", e);
            }
            if (s3.statusCode() == 404) {
                return new StorageNotFoundException(key == null ? bucketNotFound(bucket) : "Object not found: " + key, e);
            }
            if (s3.statusCode() == 403) {
                return new StoragePermissionException("Access denied to bucket '" + bucket + "'", e);
            }
            return new StorageException("S3 request failed with HTTP " + s3.statusCode() + ": " + describe(s3), e);
        }
        if (e instanceof SdkClientException && isMissingCredentials(e)) {
            return new CredentialException("Invalid AWS credentials", e);
        }
        return new StorageException("S3 request failed: " + e.getMessage(), e);
    }

    private static String bucketNotFound(String bucket) {
        return "Bucket '" + bucket + "' does not exist";
    }

    private static String describe(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
            return e.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }

    private static boolean isMissingCredentials(SdkException e) {
        String message = e.getMessage();
        return message != null && message.contains("Unable to load credentials");
    }
}
