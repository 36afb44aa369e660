package com.libragraph.modelgate.core.permission;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Single source of truth for route permissions, collected from every
 * {@link RoutePermissionSource} at startup. Immutable once built; a duplicate
 * {@code (pattern, method)} declaration aborts startup.
 */
@ApplicationScoped
@Startup
public class PermissionRegistry {

    private static final Logger log = Logger.getLogger(PermissionRegistry.class);

    @Inject
    Instance<RoutePermissionSource> sources;

    private volatile Map<String, RoutePermission> byKey = Map.of();
    private volatile List<RoutePermission> ordered = List.of();

    @PostConstruct
    void init() {
        List<RoutePermission> declared = new ArrayList<>();
        for (RoutePermissionSource source : sources) {
            List<RoutePermission> routes = source.routePermissions();
            declared.addAll(routes);
            log.debugf("Collected %d route permissions from %s", routes.size(), source.getClass().getSimpleName());
        }
        freeze(declared);
        log.infof("PermissionRegistry initialized with %d gated routes", byKey.size());
    }

    /** Builds a registry outside CDI. */
    public static PermissionRegistry of(Iterable<RoutePermission> routes) {
        PermissionRegistry registry = new PermissionRegistry();
        List<RoutePermission> declared = new ArrayList<>();
        routes.forEach(declared::add);
        registry.freeze(declared);
        return registry;
    }

    /** Requirement for {@code method path}, or empty when the route is public. */
    public Optional<PermissionRequirement> lookup(String path, String method) {
        String upper = method.toUpperCase(Locale.ROOT);
        for (RoutePermission route : ordered) {
            if (route.method().equals(upper) && route.pattern().matches(path)) {
                return Optional.of(route.requirement());
            }
        }
        return Optional.empty();
    }

    public List<RoutePermission> routes() {
        return ordered;
    }

    public int size() {
        return byKey.size();
    }

    private void freeze(List<RoutePermission> declared) {
        Map<String, RoutePermission> table = new LinkedHashMap<>();
        for (RoutePermission route : declared) {
            RoutePermission existing = table.putIfAbsent(route.key(), route);
            if (existing != null) {
                throw new IllegalStateException("Duplicate route permission for " + route.key()
                        + ": " + existing.requirement() + " and " + route.requirement());
            }
        }
        List<RoutePermission> sorted = new ArrayList<>(table.values());
        // literal segments win over variables
        sorted.sort(Comparator.comparingInt(r -> r.pattern().variableCount()));
        this.byKey = Map.copyOf(table);
        this.ordered = List.copyOf(sorted);
    }
}
