package com.libragraph.modelgate.core.auth;

public enum CredentialKind {
    BEARER("bearer"),
    API_KEY("api_key");

    private final String wireName;

    CredentialKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
