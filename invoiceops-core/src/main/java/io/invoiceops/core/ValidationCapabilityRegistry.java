package io.invoiceops.core;

import io.invoiceops.ValidationCapability;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ValidationCapabilityRegistry {

    private final List<ValidationCapability> capabilities;

    public ValidationCapabilityRegistry(List<ValidationCapability> capabilities) {
        // rejects duplicate names; lookup order stays the registration order
        capabilities.stream()
                .collect(Collectors.toMap(
                        ValidationCapability::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate ValidationCapability name: " + a.name());
                        }
                ));
        this.capabilities = List.copyOf(capabilities);
    }

    /**
     * First registered capability that supports {@code fileName}.
     */
    public Optional<ValidationCapability> forFileName(String fileName) {
        for (ValidationCapability capability : capabilities) {
            if (capability.supports(fileName)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}
