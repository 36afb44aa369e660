package com.libragraph.modelgate.core.auth;

import com.libragraph.modelgate.core.permission.PermissionRequirement;

/**
 * Asks the external authorization service whether a credential may perform an
 * action on a resource of a named service.
 */
public interface AuthGatewayClient {

    /**
     * @return the gateway's decision; a denial is a normal result, not an exception
     * @throws com.libragraph.modelgate.core.error.AuthException when the credential is
     *         rejected outright or the gateway cannot be reached or understood
     */
    AuthDecision verify(Credential credential, String serviceName, PermissionRequirement requirement);
}
