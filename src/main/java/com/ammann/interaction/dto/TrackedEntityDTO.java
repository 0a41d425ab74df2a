/* (C)2026 */
package com.ammann.interaction.dto;

import com.ammann.interaction.model.BoundingBox;
import com.ammann.interaction.model.TrackedEntity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Flat wire record of a {@link TrackedEntity} as published by the detection feed.
 *
 * <p>{@code framesSeen} is part of the record for compatibility with existing publishers;
 * it is carried through unchanged. {@code label} and {@code box} are omitted for an entity
 * that has been tracked but not yet classified.
 */
@Schema(description = "Tracked entity as exchanged with the detection feed")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackedEntityDTO(
        @Schema(description = "Best label of the entity")
        String label,

        @Schema(description = "Confidence of the best label")
        Double confidence,

        @Schema(description = "Number of polling cycles the entity has existed")
        Long age,

        @Schema(description = "Consecutive polling cycles without a detection")
        Long missingStreak,

        @Schema(description = "Reserved counter, not updated")
        Long framesSeen,

        @Schema(description = "Most recent bounding box as [x, y, w, h] in normalized coordinates")
        List<Double> box
) {
    /**
     * Creates the wire record for an entity.
     *
     * @param entity the entity to serialize
     * @return a new {@code TrackedEntityDTO}
     */
    public static TrackedEntityDTO from(TrackedEntity entity) {
        BoundingBox box = entity.getLastBox();
        return new TrackedEntityDTO(
                entity.getBestLabel(),
                entity.getBestConfidence(),
                entity.getAge(),
                entity.getMissingStreak(),
                entity.getFramesSeen(),
                box == null ? null : box.toList()
        );
    }
}
