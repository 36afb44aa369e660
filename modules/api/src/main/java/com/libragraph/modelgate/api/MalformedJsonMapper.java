package com.libragraph.modelgate.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.libragraph.modelgate.core.error.ErrorKind;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/** Request bodies that are not valid JSON, or do not fit the expected shape. */
@Provider
public class MalformedJsonMapper implements ExceptionMapper<JsonProcessingException> {

    @Override
    public Response toResponse(JsonProcessingException e) {
        return ErrorResponses.of(ErrorKind.VALIDATION.httpStatus(),
                "Malformed request body: " + e.getOriginalMessage(), ErrorKind.VALIDATION.label());
    }
}
