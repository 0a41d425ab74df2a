/* (C)2026 */
package com.ammann.interaction.model;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * A configured relationship between co-located labelled entities.
 *
 * <p>Each slot is the set of labels acceptable at that position. A match is raised when the
 * members of an overlapping pair can be assigned to the slots and the overlap ratio is at
 * least {@code overlapThreshold}. The match must recur for {@code minSustain} before it is
 * published and is cleared once it has been absent for longer than {@code expireAfter}.
 *
 * @param name             interaction name, used in event topics
 * @param slots            ordered slots, each a set of acceptable labels
 * @param overlapThreshold minimum intersection-over-smaller-area ratio, inclusive
 * @param minSustain       time a candidate must persist before activation
 * @param expireAfter      absence after which a record is dropped
 */
public record InteractionTemplate(
        String name,
        List<Set<String>> slots,
        double overlapThreshold,
        Duration minSustain,
        Duration expireAfter) {

    public InteractionTemplate {
        slots = slots.stream().map(Set::copyOf).toList();
    }

    public int slotCount() {
        return slots.size();
    }
}
