/* (C)2026 */
package com.ammann.interaction.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Counts describing one detection context.
 *
 * @param name          context (camera) name
 * @param entityCount   tracked entities
 * @param pendingEvents candidates not yet sustained
 * @param activeEvents  published interactions
 */
@Schema(description = "Summary of a detection context")
public record ContextSummaryDTO(
        @Schema(description = "Context name") String name,
        @Schema(description = "Tracked entities") int entityCount,
        @Schema(description = "Candidates waiting for the minimum sustain time") long pendingEvents,
        @Schema(description = "Published interactions") long activeEvents) {}
