package com.libragraph.modelgate.core.permission;

import java.util.Locale;

/**
 * One gated route: {@code method pattern -> resource:action}.
 */
public record RoutePermission(PathPattern pattern, String method, PermissionRequirement requirement) {

    public RoutePermission {
        method = method.toUpperCase(Locale.ROOT);
    }

    public static RoutePermission of(String method, String pattern, String resource, String action) {
        return new RoutePermission(PathPattern.parse(pattern), method, PermissionRequirement.of(resource, action));
    }

    String key() {
        return method + " " + pattern.template();
    }
}
