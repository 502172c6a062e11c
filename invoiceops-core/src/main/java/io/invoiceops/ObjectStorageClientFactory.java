package io.invoiceops;

import io.invoiceops.core.StorageCredentials;
import io.invoiceops.core.StorageProvider;

public interface ObjectStorageClientFactory {

    StorageProvider provider();

    /**
     * Open a client for decrypted credentials. Callers close it when the run or test is over.
     */
    ObjectStorageClient open(StorageCredentials credentials);
}
