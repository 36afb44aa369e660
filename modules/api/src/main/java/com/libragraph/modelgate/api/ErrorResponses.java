package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.error.ModelGateException;
import com.libragraph.modelgate.core.provider.ProviderException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

final class ErrorResponses {

    private ErrorResponses() {
    }

    static Response of(ModelGateException e) {
        String label = e instanceof ProviderException pe ? pe.category().label() : e.kind().label();
        return of(e.kind().httpStatus(), e.getMessage(), label);
    }

    static Response of(int status, String message, String label) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(ApiResponse.error(message, label))
                .build();
    }
}
