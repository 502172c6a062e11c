package io.invoiceops.exception;

import io.invoiceops.core.ErrorKind;
import io.invoiceops.core.StorageProvider;

public class UnsupportedProviderException extends StorageException {

    private final StorageProvider provider;

    public UnsupportedProviderException(StorageProvider provider) {
        super("Unsupported provider: " + provider);
        this.provider = provider;
    }

    public StorageProvider provider() {
        return provider;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNSUPPORTED_PROVIDER;
    }
}
