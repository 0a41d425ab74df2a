/* (C)2026 */
package com.ammann.interaction.resource;

import com.ammann.interaction.dto.InteractionTemplateDTO;
import com.ammann.interaction.properties.ApiProperties;
import com.ammann.interaction.service.InteractionTemplateRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Interactions API", description = "Configured interaction templates")
@Produces(MediaType.APPLICATION_JSON)
public class InteractionResource
{
    @Inject
    InteractionTemplateRegistry registry;

    @GET
    @Path(ApiProperties.Interactions.BASE)
    @Operation(summary = "List interactions", description = "Templates evaluated on every tick")
    public List<InteractionTemplateDTO> listInteractions()
    {
        return registry.all().stream().map(InteractionTemplateDTO::from).toList();
    }
}
