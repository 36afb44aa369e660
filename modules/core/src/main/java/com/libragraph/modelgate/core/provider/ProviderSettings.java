package com.libragraph.modelgate.core.provider;

import java.util.List;

/**
 * Configuration-derived provider descriptor: endpoint, credential and the
 * models a request may name.
 *
 * @param apiKey null when not configured; invocations then fail with
 *               {@link FailureCategory#CONFIGURATION}
 */
public record ProviderSettings(
        String name,
        String apiKey,
        String baseUrl,
        List<String> supportedModels
) {
    public ProviderSettings {
        supportedModels = List.copyOf(supportedModels);
        if (apiKey != null && apiKey.isBlank()) {
            apiKey = null;
        }
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }
}
