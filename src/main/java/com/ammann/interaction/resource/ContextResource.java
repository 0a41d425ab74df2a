/* (C)2026 */
package com.ammann.interaction.resource;

import com.ammann.interaction.dto.ContextDetailDTO;
import com.ammann.interaction.dto.ContextSummaryDTO;
import com.ammann.interaction.properties.ApiProperties;
import com.ammann.interaction.service.InteractionEngineService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Read-only view of the detection contexts held by the interaction engine.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Contexts API", description = "Tracked entities and interaction events per camera")
@Produces(MediaType.APPLICATION_JSON)
public class ContextResource
{
    @Inject
    InteractionEngineService engine;

    @GET
    @Path(ApiProperties.Contexts.BASE)
    @Operation(summary = "List contexts", description = "Entity and event counts of every context")
    public List<ContextSummaryDTO> listContexts()
    {
        return engine.summarize();
    }

    @GET
    @Path(ApiProperties.Contexts.BY_NAME)
    @Operation(summary = "Context detail", description = "Tracked entities and event records of one context")
    public ContextDetailDTO getContext(@PathParam("name") String name)
    {
        return engine.describe(name)
                .orElseThrow(() -> new NotFoundException("Unknown context: " + name));
    }
}
