/* (C)2026 */
package com.ammann.interaction.model;

import java.util.List;

/**
 * One valid slot assignment found for an interaction template in the current snapshot.
 *
 * @param interaction  template name
 * @param slotLabels   best labels of the assigned entities, in slot order
 * @param entityIds    ids of the assigned entities, in slot order (diagnostics only)
 * @param overlapRatio overlap ratio of the pair that produced the match
 */
public record CandidateMatch(
        String interaction, List<String> slotLabels, List<String> entityIds, double overlapRatio) {

    public CandidateMatch {
        slotLabels = List.copyOf(slotLabels);
        entityIds = List.copyOf(entityIds);
    }

    public EventKey key() {
        return new EventKey(interaction, slotLabels);
    }
}
