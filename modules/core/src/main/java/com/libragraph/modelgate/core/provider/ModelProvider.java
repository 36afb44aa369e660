package com.libragraph.modelgate.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.modelgate.types.ChatCompletion;

import java.util.Map;
import java.util.Set;

/**
 * One vendor's text-generation API behind a uniform contract.
 * <p>
 * Callers never branch on provider identity: they look a provider up in the
 * {@link ProviderRegistry}, {@link #invoke} it and {@link #normalize} whatever
 * native reply comes back.
 */
public interface ModelProvider {

    String name();

    Set<String> supportedModels();

    default boolean supports(String model) {
        return supportedModels().contains(model);
    }

    /**
     * Validates caller parameters and returns the vendor-ready copy with
     * defaults applied and knobs clamped. The input map is not modified.
     *
     * @throws com.libragraph.modelgate.core.error.ValidationException on unsupported
     *         model or malformed parameters
     */
    Map<String, Object> prepare(String model, Map<String, Object> parameters);

    /**
     * Calls the vendor. Blocks until the reply arrives.
     *
     * @throws ProviderException categorized upstream failure
     */
    JsonNode invoke(String model, Map<String, Object> parameters);

    /**
     * Maps a native reply onto the unified schema.
     *
     * @throws ProviderException with {@link FailureCategory#MALFORMED_RESPONSE}
     *         when the reply cannot be interpreted
     */
    ChatCompletion normalize(String model, JsonNode nativeResponse);
}
