/* (C)2026 */
package com.ammann.interaction.dto;

import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Tracked entities and interaction events of a detection context")
public record ContextDetailDTO(
        @Schema(description = "Context name") String name,
        @Schema(description = "Tracked entities keyed by id") Map<String, TrackedEntityDTO> entities,
        @Schema(description = "Interaction events") List<EventRecordDTO> events) {}
