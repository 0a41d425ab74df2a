/* (C)2026 */
package com.ammann.interaction.model;

/**
 * Where a detection update belongs: the source context and the tracked id within it.
 *
 * @param context  context (camera) name
 * @param entityId tracked id assigned by the box tracker
 */
public record DetectionAddress(String context, String entityId) {}
