package com.libragraph.modelgate.core.auth;

import java.util.Optional;

/**
 * Credential presented with a request. {@link #toString()} never reveals the secret.
 */
public record Credential(CredentialKind kind, String value) {

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Reads a credential from request headers. A bearer token wins over an API key
     * when both are present; blank values count as absent.
     */
    public static Optional<Credential> fromHeaders(String authorization, String apiKey) {
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(new Credential(CredentialKind.BEARER, token));
            }
        }
        if (apiKey != null && !apiKey.isBlank()) {
            return Optional.of(new Credential(CredentialKind.API_KEY, apiKey.trim()));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Credential[" + kind.wireName() + "]";
    }
}
