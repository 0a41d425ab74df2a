/* (C)2026 */
package com.ammann.interaction.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TrackedEntityTest {

    private static final BoundingBox BOX = new BoundingBox(0.1, 0.1, 0.2, 0.2);

    @Test
    void singleLabelKeepsItsConfidence() {
        TrackedEntity entity = new TrackedEntity("7");

        for (int i = 0; i < 5; i++) {
            entity.markSeen(new Detection("cat", 0.8, BOX));
        }

        assertThat(entity.getBestLabel()).isEqualTo("cat");
        assertThat(entity.getBestConfidence()).isCloseTo(0.8, within(1e-12));
        assertThat(entity.labelConf("cat")).isEqualTo(1.0);
        assertThat(entity.getAge()).isEqualTo(5);
    }

    @Test
    void bestLabelIsWeightedByShareOfConfidenceMass() {
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("cat", 0.9, BOX));
        entity.markSeen(new Detection("cat", 0.9, BOX));
        entity.markSeen(new Detection("cat", 0.9, BOX));
        entity.markSeen(new Detection("dog", 0.6, BOX));

        // cat holds 2.7 of 3.3
        assertThat(entity.getBestLabel()).isEqualTo("cat");
        assertThat(entity.labelConf("cat")).isCloseTo(2.7 / 3.3, within(1e-9));
        assertThat(entity.labelConf("dog")).isCloseTo(0.6 / 3.3, within(1e-9));
        assertThat(entity.getBestConfidence()).isCloseTo(0.9 * 2.7 / 3.3, within(1e-9));
        assertThat(entity.getLabelStats()).containsOnlyKeys("cat", "dog");
    }

    @Test
    void firstObservedLabelWinsATie() {
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("dog", 0.5, BOX));
        entity.markSeen(new Detection("cat", 0.5, BOX));

        assertThat(entity.getBestLabel()).isEqualTo("dog");
        assertThat(entity.getBestConfidence()).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void zeroConfidenceMassYieldsZeroConfidence() {
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("cat", 0.0, BOX));

        assertThat(entity.getBestLabel()).isEqualTo("cat");
        assertThat(entity.getBestConfidence()).isZero();
        assertThat(entity.labelConf("cat")).isZero();
    }

    @Test
    void trackingOnlyCycleAgesWithoutChangingJudgment() {
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("cat", 0.8, BOX));
        entity.markMissing();
        entity.markMissing();

        assertThat(entity.getMissingStreak()).isEqualTo(2);

        entity.markSeen();

        assertThat(entity.getAge()).isEqualTo(2);
        assertThat(entity.getMissingStreak()).isZero();
        assertThat(entity.getBestLabel()).isEqualTo("cat");
        assertThat(entity.getBestConfidence()).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void repeatedDetectionWithinCycleDoesNotAge() {
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("cat", 0.8, BOX), true);
        entity.markSeen(new Detection("dog", 0.4, BOX), false);

        assertThat(entity.getAge()).isEqualTo(1);
        assertThat(entity.getLabelStats().get("dog").n()).isEqualTo(1);
    }

    @Test
    void remembersLastBoxPerLabel() {
        BoundingBox later = new BoundingBox(0.5, 0.5, 0.1, 0.1);
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("cat", 0.8, BOX));
        entity.markSeen(new Detection("dog", 0.3, later));

        assertThat(entity.getLastBox()).isEqualTo(later);
        assertThat(entity.lastBoxFor("cat")).isEqualTo(BOX);
        assertThat(entity.lastBoxFor("horse")).isNull();
        assertThat(entity.labelConf("horse")).isZero();
    }

    @Test
    void labelStatsAreCopies() {
        TrackedEntity entity = new TrackedEntity("7");
        entity.markSeen(new Detection("cat", 0.8, BOX));

        entity.getLabelStats().get("cat").addValue(0.1);

        assertThat(entity.getLabelStats().get("cat").n()).isEqualTo(1);
    }

    @Test
    void restoreCarriesTheWireRecord() {
        TrackedEntity entity = TrackedEntity.restore("3", "person", 0.66, 12, 1, 4, BOX);

        assertThat(entity.getId()).isEqualTo("3");
        assertThat(entity.getBestLabel()).isEqualTo("person");
        assertThat(entity.getBestConfidence()).isEqualTo(0.66);
        assertThat(entity.getAge()).isEqualTo(12);
        assertThat(entity.getMissingStreak()).isEqualTo(1);
        assertThat(entity.getFramesSeen()).isEqualTo(4);
        assertThat(entity.getLastBox()).isEqualTo(BOX);
        assertThat(entity.getLabelStats()).isEmpty();
    }
}
