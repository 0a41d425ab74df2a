/* (C)2026 */
package com.ammann.interaction.model;

/**
 * Two entities of a snapshot whose boxes intersect.
 *
 * @param first  index of the first entity in the snapshot, always less than {@code second}
 * @param second index of the second entity in the snapshot
 * @param ratio  intersection over the smaller of the two areas
 */
public record OverlapPair(int first, int second, double ratio) {}
