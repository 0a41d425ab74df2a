/* (C)2026 */
package com.ammann.interaction.dto;

import com.ammann.interaction.model.InteractionTemplate;
import java.util.List;
import java.util.Set;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Configured interaction template")
public record InteractionTemplateDTO(
        @Schema(description = "Interaction name") String name,
        @Schema(description = "Accepted labels per slot") List<Set<String>> slots,
        @Schema(description = "Minimum intersection over smaller area") double threshold,
        @Schema(description = "Seconds a match must persist before it is published") double minSustainSeconds,
        @Schema(description = "Seconds of absence after which an event is dropped") double expireAfterSeconds) {

    public static InteractionTemplateDTO from(InteractionTemplate template) {
        return new InteractionTemplateDTO(
                template.name(),
                template.slots(),
                template.overlapThreshold(),
                template.minSustain().toMillis() / 1000.0,
                template.expireAfter().toMillis() / 1000.0);
    }
}
