package com.libragraph.modelgate.core.permission;

import java.util.List;

/**
 * Implemented by every component that serves routes, declaring the permission
 * each gated route requires. Routes not declared are public.
 */
public interface RoutePermissionSource {

    List<RoutePermission> routePermissions();
}
