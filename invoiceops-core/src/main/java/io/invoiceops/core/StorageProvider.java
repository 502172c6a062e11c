package io.invoiceops.core;

public enum StorageProvider {
    S3,
    GCS,
    AZURE_BLOB
}
