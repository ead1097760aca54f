package com.e2eq.composite.rest.exceptions;

import com.e2eq.composite.rest.models.RestError;
import com.e2eq.composite.util.ExceptionLoggingUtils;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class NotFoundExceptionMapper implements ExceptionMapper<NotFoundException> {
    @Override
    public Response toResponse(NotFoundException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Resource not found");

        RestError error = RestError.builder()
                .status(Response.Status.NOT_FOUND.getStatusCode())
                .statusMessage(exception.getMessage())
                .reasonMessage(String.format("Not found: %s", exception.getMessage()))
                .debugMessage(ExceptionLoggingUtils.getStackTrace(exception))
                .build();

        return Response.status(Response.Status.NOT_FOUND).type(MediaType.APPLICATION_JSON).entity(error).build();
    }
}
