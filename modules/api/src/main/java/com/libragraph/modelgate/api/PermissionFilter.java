package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.auth.Caller;
import com.libragraph.modelgate.core.auth.Credential;
import com.libragraph.modelgate.core.auth.PermissionGate;
import com.libragraph.modelgate.core.error.ModelGateException;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Gates every request through the {@link PermissionGate} before it reaches a
 * resource. Rejections are answered here with the standard error envelope.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class PermissionFilter implements ContainerRequestFilter {

    private static final Logger log = Logger.getLogger(PermissionFilter.class);

    static final String API_KEY_HEADER = "X-API-Key";

    @Inject
    PermissionGate gate;

    @Inject
    CallerContext callerContext;

    @Override
    public void filter(ContainerRequestContext request) {
        String path = request.getUriInfo().getPath();
        String method = request.getMethod();
        try {
            Caller caller = gate.authorize(path, method, Credential.fromHeaders(
                    request.getHeaderString(HttpHeaders.AUTHORIZATION),
                    request.getHeaderString(API_KEY_HEADER)));
            callerContext.set(caller);
        } catch (ModelGateException e) {
            log.debugf("Rejected %s %s: %s", method, path, e.getMessage());
            request.abortWith(ErrorResponses.of(e));
        }
    }
}
