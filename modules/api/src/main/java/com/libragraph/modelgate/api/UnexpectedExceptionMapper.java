package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.error.ErrorKind;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Last-resort mapper. JAX-RS errors keep their status; anything else is logged
 * and reported as an internal error without leaking details.
 */
@Provider
public class UnexpectedExceptionMapper implements ExceptionMapper<Exception> {

    private static final Logger log = Logger.getLogger(UnexpectedExceptionMapper.class);

    @Override
    public Response toResponse(Exception e) {
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            return ErrorResponses.of(status, wae.getMessage(), "http_" + status);
        }
        log.error("Unhandled exception", e);
        return ErrorResponses.of(ErrorKind.INTERNAL.httpStatus(), "Internal server error",
                ErrorKind.INTERNAL.label());
    }
}
