package com.libragraph.modelgate.core.provider;

import com.libragraph.modelgate.core.error.ValidationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name-to-provider table. Built once through {@link #builder()} and
 * never mutated afterwards.
 */
public final class ProviderRegistry {

    private final Map<String, ModelProvider> providers;

    private ProviderRegistry(Map<String, ModelProvider> providers) {
        this.providers = Map.copyOf(providers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ModelProvider> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(providers.get(name));
    }

    /**
     * @throws ValidationException when no provider is registered under {@code name}
     */
    public ModelProvider require(String name) {
        return lookup(name).orElseThrow(() -> new ValidationException(
                "Provider '" + name + "' not supported. Supported providers: "
                        + String.join(", ", providers.keySet())));
    }

    public Collection<ModelProvider> all() {
        return providers.values();
    }

    public int size() {
        return providers.size();
    }

    public static final class Builder {

        private final Map<String, ModelProvider> providers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(ModelProvider provider) {
            ModelProvider existing = providers.putIfAbsent(provider.name(), provider);
            if (existing != null) {
                throw new IllegalStateException("Duplicate provider '" + provider.name() + "': "
                        + existing.getClass().getName() + " and " + provider.getClass().getName());
            }
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(providers);
        }
    }
}
