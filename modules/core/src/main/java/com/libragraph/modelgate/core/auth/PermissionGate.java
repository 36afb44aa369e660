package com.libragraph.modelgate.core.auth;

import com.libragraph.modelgate.core.error.AuthException;
import com.libragraph.modelgate.core.error.PermissionDeniedException;
import com.libragraph.modelgate.core.permission.PermissionRegistry;
import com.libragraph.modelgate.core.permission.PermissionRequirement;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Decides whether a request may proceed. Routes without a registered requirement
 * are public; every other route needs a credential the auth gateway accepts.
 */
@ApplicationScoped
public class PermissionGate {

    private static final Logger log = Logger.getLogger(PermissionGate.class);

    @Inject
    PermissionRegistry registry;

    @Inject
    AuthGatewayClient authGateway;

    @ConfigProperty(name = "modelgate.auth.enabled", defaultValue = "false")
    boolean enabled;

    @ConfigProperty(name = "modelgate.auth.service-name", defaultValue = "modelgate")
    String serviceName;

    PermissionGate() {
    }

    PermissionGate(PermissionRegistry registry, AuthGatewayClient authGateway,
                   boolean enabled, String serviceName) {
        this.registry = registry;
        this.authGateway = authGateway;
        this.enabled = enabled;
        this.serviceName = serviceName;
    }

    /**
     * @return the caller the request runs as
     * @throws AuthException when a gated route has no credential or the gateway fails
     * @throws PermissionDeniedException when the gateway denies the credential
     */
    public Caller authorize(String path, String method, Optional<Credential> credential) {
        if (!enabled) {
            return Caller.ANONYMOUS;
        }
        Optional<PermissionRequirement> requirement = registry.lookup(path, method);
        if (requirement.isEmpty()) {
            return Caller.ANONYMOUS;
        }
        PermissionRequirement required = requirement.get();
        Credential presented = credential.orElseThrow(() ->
                new AuthException("Missing credentials: send 'Authorization: Bearer <token>' or 'X-API-Key'"));

        AuthDecision decision = authGateway.verify(presented, serviceName, required);
        if (!decision.allowed()) {
            log.infof("Denied %s %s (%s) for %s", method, path, required, presented);
            throw new PermissionDeniedException(required.resource(), required.action());
        }
        if (decision.principal() == null || decision.principal().isBlank()) {
            throw new AuthException("Auth gateway allowed the request without naming a principal");
        }
        CallerScope scope = decision.scope() != null ? decision.scope() : CallerScope.USER;
        return new Caller(decision.principal(), scope);
    }
}
