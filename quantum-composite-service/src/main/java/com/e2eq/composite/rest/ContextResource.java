package com.e2eq.composite.rest;

import com.e2eq.composite.rest.dto.ContextRequest;
import com.e2eq.composite.service.ContextAssemblyService;
import com.e2eq.composite.service.ContextAssemblyService.AssembledContext;
import com.e2eq.composite.service.ContextAssemblyService.ContextOptions;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path("/composite/projects/{projectId}/context")
@Tag(name = "composite-context", description = "Prompt context assembled from resolved documents")
public class ContextResource {

    private final ContextAssemblyService assembly;

    @Inject
    public ContextResource(ContextAssemblyService assembly) {
        this.assembly = assembly;
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public AssembledContext assemble(@PathParam("projectId") String projectId, ContextRequest request) {
        if (request == null || request.primaryDocumentId() == null || request.primaryDocumentId().isBlank()) {
            throw new BadRequestException("primaryDocumentId is required");
        }
        ContextOptions defaults = assembly.defaultOptions();
        ContextOptions options = new ContextOptions(
                request.includeRelated() == null ? defaults.includeRelated() : request.includeRelated(),
                request.maxTokens() == null ? defaults.maxTokens() : request.maxTokens(),
                request.preferredTypes());
        return assembly.assemble(projectId, request.primaryDocumentId(), request.additionalDocumentIds(), options);
    }
}
