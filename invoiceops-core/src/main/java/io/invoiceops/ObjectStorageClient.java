package io.invoiceops;

import io.invoiceops.core.ConnectionTestResult;
import io.invoiceops.core.StorageObject;

import java.util.List;

/**
 * Provider-neutral access to one account's object storage.
 *
 * <p>Failures surface as {@link io.invoiceops.exception.StorageException} subclasses:
 * {@link io.invoiceops.exception.CredentialException}, {@link io.invoiceops.exception.StorageNotFoundException}
 * and {@link io.invoiceops.exception.StoragePermissionException}.
 */
public interface ObjectStorageClient extends AutoCloseable {

    /**
     * Pre-flight check against {@code container}. Expected failure modes are returned, not thrown.
     */
    ConnectionTestResult testConnection(String container);

    /**
     * Objects under {@code prefix} whose basename matches {@code globPattern} (case-insensitive).
     * Directory markers are excluded. Order is the provider's listing order.
     */
    List<StorageObject> listFiles(String container, String prefix, String globPattern);

    byte[] downloadFile(String container, String key);

    void deleteFile(String container, String key);

    /**
     * Copy then delete. When the delete fails after a successful copy the object exists at both keys.
     */
    void moveFile(String container, String sourceKey, String destinationKey);

    @Override
    void close();
}
