package com.libragraph.modelgate.core.permission;

/** A {@code resource:action} pair the caller's credential must be granted. */
public record PermissionRequirement(String resource, String action) {

    public static PermissionRequirement of(String resource, String action) {
        return new PermissionRequirement(resource, action);
    }

    @Override
    public String toString() {
        return resource + ":" + action;
    }
}
