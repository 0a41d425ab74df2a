/* (C)2026 */
package com.ammann.interaction.model;

/**
 * A single labelled, confidence-scored box reported by the detector for one tracked id.
 *
 * @param label      class label reported by the model
 * @param confidence model confidence in [0, 1]
 * @param box        bounding box in the normalized frame
 */
public record Detection(String label, double confidence, BoundingBox box) {}
