package com.libragraph.modelgate.api;

import com.libragraph.modelgate.core.error.ErrorKind;
import com.libragraph.modelgate.core.error.ModelGateException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class ModelGateExceptionMapper implements ExceptionMapper<ModelGateException> {

    private static final Logger log = Logger.getLogger(ModelGateExceptionMapper.class);

    @Override
    public Response toResponse(ModelGateException e) {
        if (e.kind() == ErrorKind.INTERNAL) {
            log.error("Internal error", e);
        } else {
            log.debugf("%s: %s", e.kind(), e.getMessage());
        }
        return ErrorResponses.of(e);
    }
}
