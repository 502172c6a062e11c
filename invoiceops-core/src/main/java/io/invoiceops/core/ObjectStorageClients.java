package io.invoiceops.core;

import io.invoiceops.ObjectStorageClient;
import io.invoiceops.ObjectStorageClientFactory;
import io.invoiceops.exception.UnsupportedProviderException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dispatches to the {@link ObjectStorageClientFactory} registered for a provider.
 */
public class ObjectStorageClients {

    private final Map<StorageProvider, ObjectStorageClientFactory> factoriesByProvider;

    public ObjectStorageClients(List<ObjectStorageClientFactory> factories) {
        this.factoriesByProvider = factories.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ObjectStorageClientFactory::provider,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate storage factory for provider: " + a.provider());
                        }
                ));
    }

    public boolean supports(StorageProvider provider) {
        return factoriesByProvider.containsKey(provider);
    }

    public ObjectStorageClient open(StorageProvider provider, StorageCredentials credentials) {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        ObjectStorageClientFactory factory = factoriesByProvider.get(provider);
        if (factory == null) {
            throw new UnsupportedProviderException(provider);
        }
        return factory.open(credentials);
    }
}
