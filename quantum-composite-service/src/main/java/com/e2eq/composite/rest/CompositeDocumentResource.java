package com.e2eq.composite.rest;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.rest.dto.DocumentRequest;
import com.e2eq.composite.rest.dto.DocumentResponse;
import com.e2eq.composite.rest.dto.GroupResolutionResponse;
import com.e2eq.composite.rest.dto.ResolveRequest;
import com.e2eq.composite.rest.dto.ResolvedDocumentResponse;
import com.e2eq.composite.rest.dto.ValidateRequest;
import com.e2eq.composite.rest.dto.ValidationResponse;
import com.e2eq.composite.service.CompositeDocumentService;
import com.e2eq.composite.service.ResolvedDocument;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Map;

@Path("/composite")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "composite", description = "Composite document resolution, validation and writes")
public class CompositeDocumentResource {

    private final CompositeDocumentService service;

    @Inject
    public CompositeDocumentResource(CompositeDocumentService service) {
        this.service = service;
    }

    @GET
    @Path("/documents/{id}/resolved")
    public ResolvedDocumentResponse resolved(@PathParam("id") String id) {
        ResolvedDocument resolved = service.resolve(id, Map.of());
        return ResolvedDocumentResponse.of(resolved.document(), resolved.expansion());
    }

    @POST
    @Path("/documents/{id}/resolve")
    public ResolvedDocumentResponse resolve(@PathParam("id") String id, ResolveRequest request) {
        Map<String, String> overrides = request == null ? Map.of() : request.overrides();
        ResolvedDocument resolved = service.resolve(id, overrides);
        return ResolvedDocumentResponse.of(resolved.document(), resolved.expansion());
    }

    @POST
    @Path("/documents/{id}/validate")
    public ValidationResponse validate(@PathParam("id") String id, ValidateRequest request) {
        if (request == null) {
            return ValidationResponse.of(service.validate(id, null, Map.of()));
        }
        return ValidationResponse.of(service.validate(id, request.projectId(), request.components()));
    }

    @POST
    @Path("/projects/{projectId}/documents")
    public Response create(@PathParam("projectId") String projectId, DocumentRequest request) {
        Document created = service.create(projectId, request);
        return Response.status(Response.Status.CREATED).entity(DocumentResponse.from(created)).build();
    }

    @PUT
    @Path("/projects/{projectId}/documents/{id}")
    public DocumentResponse update(@PathParam("projectId") String projectId,
                                   @PathParam("id") String id,
                                   DocumentRequest request) {
        return DocumentResponse.from(service.update(projectId, id, request));
    }

    @GET
    @Path("/projects/{projectId}/groups/{groupId}/resolve")
    public GroupResolutionResponse resolveGroup(@PathParam("projectId") String projectId,
                                                @PathParam("groupId") String groupId,
                                                @QueryParam("preferredType") String preferredType) {
        return GroupResolutionResponse.from(service.resolveGroup(projectId, groupId, preferredType));
    }
}
