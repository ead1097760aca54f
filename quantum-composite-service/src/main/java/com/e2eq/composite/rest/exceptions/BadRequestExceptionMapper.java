package com.e2eq.composite.rest.exceptions;

import com.e2eq.composite.rest.models.RestError;
import com.e2eq.composite.util.ExceptionLoggingUtils;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps BadRequestException, raised for missing or invalid request fields, to a 400 response.
 */
@Provider
public class BadRequestExceptionMapper implements ExceptionMapper<BadRequestException> {
    @Override
    public Response toResponse(BadRequestException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Bad request");

        RestError error = RestError.builder()
                .status(Response.Status.BAD_REQUEST.getStatusCode())
                .statusMessage(exception.getMessage())
                .reasonMessage(String.format("Bad request: %s", exception.getMessage()))
                .debugMessage(ExceptionLoggingUtils.getStackTrace(exception))
                .build();

        return Response.status(Response.Status.BAD_REQUEST).type(MediaType.APPLICATION_JSON).entity(error).build();
    }
}
