package com.libragraph.modelgate.core.auth;

/**
 * Authenticated identity of the current request.
 */
public record Caller(String principal, CallerScope scope) {

    /** Identity used when gating is disabled or the route is public. */
    public static final Caller ANONYMOUS = new Caller("anonymous", CallerScope.SYSTEM);

    public boolean isSystem() {
        return scope == CallerScope.SYSTEM;
    }

    /** Whether this caller may read a task owned by {@code owner}. */
    public boolean canSee(String owner) {
        return isSystem() || principal.equals(owner);
    }
}
