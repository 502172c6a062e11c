package io.invoiceops.internal.s3;

import io.invoiceops.ObjectStorageClient;
import io.invoiceops.core.ConnectionTestResult;
import io.invoiceops.core.ErrorKind;
import io.invoiceops.core.StorageObject;
import io.invoiceops.exception.StorageException;
import io.invoiceops.utils.GlobPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ObjectStorageClient} over one AWS SDK {@link S3Client}. The SDK client is owned and closed here.
 */
public class S3ObjectStorageClient implements ObjectStorageClient {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorageClient.class);

    private final S3Client s3Client;

    public S3ObjectStorageClient(S3Client s3Client) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client must not be null");
    }

    @Override
    public ConnectionTestResult testConnection(String bucket) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return ConnectionTestResult.success();
        } catch (SdkException e) {
            StorageException mapped = S3Errors.translate(e, bucket, null);
            log.info("S3 connection test failed bucket={} kind={} msg={}", bucket, mapped.kind(), e.getMessage());
            if (mapped.kind() == ErrorKind.UNKNOWN) {
                return ConnectionTestResult.failure(ErrorKind.UNKNOWN, "Connection failed: " + e.getMessage());
            }
            return ConnectionTestResult.failure(mapped.kind(), mapped.getMessage());
        }
    }

    @Override
    public List<StorageObject> listFiles(String bucket, String prefix, String globPattern) {
        GlobPattern glob = GlobPattern.compile(globPattern);
        List<StorageObject> files = new ArrayList<>();
        String continuationToken = null;
        int pages = 0;
        try {
            do {
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
                if (prefix != null && !prefix.isEmpty()) {
                    request.prefix(prefix);
                }
                if (continuationToken != null) {
                    request.continuationToken(continuationToken);
                }
                ListObjectsV2Response page = s3Client.listObjectsV2(request.build());
                pages++;

                for (S3Object object : page.contents()) {
                    String key = object.key();
                    if (key.endsWith("/")) {
                        continue;
                    }
                    String name = GlobPattern.basename(key);
                    if (glob.matches(name)) {
                        long size = object.size() == null ? 0L : object.size();
                        files.add(new StorageObject(key, name, size, object.lastModified()));
                    }
                }
                continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (continuationToken != null);
        } catch (SdkException e) {
            log.error("Failed to list s3://{}/{} msg={}", bucket, prefix == null ? "" : prefix, e.getMessage());
            throw S3Errors.translate(e, bucket, null);
        }

        log.info("Found {} files matching '{}' in s3://{}/{} pages={}",
                files.size(), globPattern, bucket, prefix == null ? "" : prefix, pages);
        return files;
    }

    @Override
    public byte[] downloadFile(String bucket, String key) {
        try {
            byte[] content = s3Client.getObjectAsBytes(
                    GetObjectRequest.builder().bucket(bucket).key(key).build()).asByteArray();
            log.debug("Downloaded {} bytes from s3://{}/{}", content.length, bucket, key);
            return content;
        } catch (SdkException e) {
            log.error("Failed to download s3://{}/{} msg={}", bucket, key, e.getMessage());
            throw S3Errors.translate(e, bucket, key);
        }
    }

    @Override
    public void deleteFile(String bucket, String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.info("Deleted s3://{}/{}", bucket, key);
        } catch (SdkException e) {
            log.error("Failed to delete s3://{}/{} msg={}", bucket, key, e.getMessage());
            throw S3Errors.translate(e, bucket, key);
        }
    }

    @Override
    public void moveFile(String bucket, String sourceKey, String destinationKey) {
        try {
            s3Client.copyObject(CopyObjectRequest.builder()
                    .sourceBucket(bucket)
                    .sourceKey(sourceKey)
                    .destinationBucket(bucket)
                    .destinationKey(destinationKey)
                    .build());
        } catch (SdkException e) {
            log.error("Failed to copy s3://{}/{} -> {} msg={}", bucket, sourceKey, destinationKey, e.getMessage());
            throw S3Errors.translate(e, bucket, sourceKey);
        }

        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(sourceKey).build());
        } catch (SdkException e) {
            log.error("Copied s3://{}/{} -> {} but failed to delete the source msg={}",
                    bucket, sourceKey, destinationKey, e.getMessage());
            throw new StorageException("Copied " + sourceKey + " to " + destinationKey
                    + " but could not delete the source; the object exists at both keys", e);
        }
        log.info("Moved s3://{}/{} -> s3://{}/{}", bucket, sourceKey, bucket, destinationKey);
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
