/* (C)2026 */
package com.ammann.interaction.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates the detections reported for one tracked id into a single (label, confidence)
 * judgment per polling cycle.
 *
 * <p>The detector may report several competing labels for the same physical object over
 * time. Each label keeps its own {@link RunningStats} over the reported confidences. The
 * best label is the one holding the largest share of the total confidence mass, so a label
 * is weighted both by how often it was reported and by how confident those reports were:
 *
 * <pre>
 *   totalMass      = sum over labels of sum(confidences)
 *   share(L)       = sum(L) / totalMass
 *   bestLabel      = argmax share(L)
 *   bestConfidence = avg(bestLabel) * share(bestLabel)
 * </pre>
 *
 * <p>Labels are evaluated in first-observed order with a strict comparison, so on an exact
 * share tie the label that was observed first wins.
 *
 * <p>Not thread-safe; callers serialize access through the owning {@link DetectionContext}.
 */
public class TrackedEntity {

    private final String id;
    private final Map<String, LabelObservation> observations = new LinkedHashMap<>();

    private long age;
    private long missingStreak;
    // Carried on the wire for compatibility with existing publishers; nothing increments it.
    private long framesSeen;

    private String bestLabel;
    private double bestConfidence;
    private BoundingBox lastBox;

    public TrackedEntity(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * Rebuilds an entity from its flat wire record. The restored entity carries the
     * published judgment as-is and has no per-label statistics until it is seen again.
     */
    public static TrackedEntity restore(
            String id,
            String label,
            double confidence,
            long age,
            long missingStreak,
            long framesSeen,
            BoundingBox box) {
        TrackedEntity entity = new TrackedEntity(id);
        entity.bestLabel = label;
        entity.bestConfidence = confidence;
        entity.age = age;
        entity.missingStreak = missingStreak;
        entity.framesSeen = framesSeen;
        entity.lastBox = box;
        return entity;
    }

    /** Marks a new polling cycle in which the entity was tracked but not classified. */
    public void markSeen() {
        markSeen(null, true);
    }

    public void markSeen(Detection detection) {
        markSeen(detection, true);
    }

    /**
     * Marks the entity as seen.
     *
     * @param detection    fresh classification, or {@code null} for a tracking-only cycle
     * @param newPollCycle whether this call starts a new polling cycle (increments age)
     */
    public void markSeen(Detection detection, boolean newPollCycle) {
        if (newPollCycle) {
            age++;
        }
        missingStreak = 0;

        if (detection == null) {
            return;
        }

        LabelObservation observation =
                observations.computeIfAbsent(detection.label(), label -> new LabelObservation());
        observation.stats.addValue(detection.confidence());
        if (detection.box() != null) {
            observation.lastBox = detection.box();
            lastBox = detection.box();
        }
        recalculateBest();
    }

    /** Records one polling cycle without a detection for this entity. */
    public void markMissing() {
        missingStreak++;
    }

    /**
     * Share of the total confidence mass held by {@code label}.
     *
     * @return the derived share, or 0 if the label was never observed
     */
    public double labelConf(String label) {
        LabelObservation observation = observations.get(label);
        return observation == null ? 0.0 : observation.share;
    }

    private void recalculateBest() {
        double totalMass = 0.0;
        for (LabelObservation observation : observations.values()) {
            totalMass += observation.stats.sum();
        }

        String candidateLabel = null;
        LabelObservation candidate = null;
        double candidateShare = -1.0;

        for (Map.Entry<String, LabelObservation> entry : observations.entrySet()) {
            LabelObservation observation = entry.getValue();
            observation.share = totalMass > 0.0 ? observation.stats.sum() / totalMass : 0.0;
            if (observation.share > candidateShare) {
                candidateShare = observation.share;
                candidateLabel = entry.getKey();
                candidate = observation;
            }
        }

        bestLabel = candidateLabel;
        bestConfidence = candidate == null ? 0.0 : candidate.stats.avg() * candidateShare;
    }

    public String getId() {
        return id;
    }

    public String getBestLabel() {
        return bestLabel;
    }

    public double getBestConfidence() {
        return bestConfidence;
    }

    public BoundingBox getLastBox() {
        return lastBox;
    }

    public long getAge() {
        return age;
    }

    public long getMissingStreak() {
        return missingStreak;
    }

    public long getFramesSeen() {
        return framesSeen;
    }

    /**
     * Independent copies of the per-label confidence statistics, in first-observed order.
     */
    public Map<String, RunningStats> getLabelStats() {
        Map<String, RunningStats> copy = new LinkedHashMap<>();
        observations.forEach((label, observation) -> copy.put(label, observation.stats.copy()));
        return Collections.unmodifiableMap(copy);
    }

    /** Most recent box reported together with {@code label}, or {@code null}. */
    public BoundingBox lastBoxFor(String label) {
        LabelObservation observation = observations.get(label);
        return observation == null ? null : observation.lastBox;
    }

    @Override
    public String toString() {
        return String.format("TrackedEntity[%s %s:%.2f age=%d missing=%d]",
                id, bestLabel, bestConfidence, age, missingStreak);
    }

    private static final class LabelObservation {
        private final RunningStats stats = new RunningStats();
        private BoundingBox lastBox;
        private double share;
    }
}
