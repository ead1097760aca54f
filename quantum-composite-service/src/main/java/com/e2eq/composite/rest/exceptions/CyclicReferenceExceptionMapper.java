package com.e2eq.composite.rest.exceptions;

import com.e2eq.composite.exceptions.CyclicReferenceException;
import com.e2eq.composite.rest.models.RestError;
import com.e2eq.composite.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * A rejected component map is a client error: the write is refused with 400 and the cycle message.
 */
@Provider
public class CyclicReferenceExceptionMapper implements ExceptionMapper<CyclicReferenceException> {
    @Override
    public Response toResponse(CyclicReferenceException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Cyclic reference rejected for document %s",
                exception.getEditedDocumentId());

        RestError error = RestError.builder()
                .status(Response.Status.BAD_REQUEST.getStatusCode())
                .statusMessage(exception.getMessage())
                .reasonMessage(exception.getGroupId() == null
                        ? String.format("Document %s closes a reference cycle", exception.getOffendingDocumentId())
                        : String.format("Group %s member %s closes a reference cycle",
                                exception.getGroupId(), exception.getOffendingDocumentId()))
                .build();

        return Response.status(Response.Status.BAD_REQUEST).type(MediaType.APPLICATION_JSON).entity(error).build();
    }
}
