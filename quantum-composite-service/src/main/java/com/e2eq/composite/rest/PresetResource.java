package com.e2eq.composite.rest;

import com.e2eq.composite.rest.dto.PresetRequest;
import com.e2eq.composite.rest.dto.PresetResponse;
import com.e2eq.composite.service.Preset;
import com.e2eq.composite.service.PresetService;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

@Path("/composite")
@Tag(name = "composite-presets", description = "Named document renders with stored overrides")
public class PresetResource {

    private final PresetService presets;

    @Inject
    public PresetResource(PresetService presets) {
        this.presets = presets;
    }

    @GET
    @Path("/projects/{projectId}/presets")
    @Produces(MediaType.APPLICATION_JSON)
    public List<PresetResponse> list(@PathParam("projectId") String projectId) {
        return presets.list(projectId).stream().map(this::toResponse).toList();
    }

    @POST
    @Path("/projects/{projectId}/presets")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response create(@PathParam("projectId") String projectId, PresetRequest request) {
        if (request == null) {
            throw new BadRequestException("Name and documentId are required");
        }
        Preset preset = presets.create(projectId, request.name(), request.documentId(), request.overrides());
        return Response.status(Response.Status.CREATED).entity(toResponse(preset)).build();
    }

    @DELETE
    @Path("/presets/{id}")
    public Response delete(@PathParam("id") String id) {
        presets.delete(id);
        return Response.noContent().build();
    }

    @GET
    @Path("/presets/{id}/render")
    @Produces(MediaType.TEXT_PLAIN)
    public String render(@PathParam("id") String id) {
        return presets.render(id);
    }

    private PresetResponse toResponse(Preset preset) {
        return PresetResponse.of(preset, presets.documentTitle(preset).orElse(null));
    }
}
