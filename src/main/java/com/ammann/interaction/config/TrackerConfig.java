/* (C)2026 */
package com.ammann.interaction.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code tracker.*} configuration tree.
 *
 * <p>Interaction templates are declared per name, one slot per list element, with the
 * labels of a slot separated by {@code |}:
 *
 * <pre>
 * tracker.interactions.PetRidingObject.slots[0]=cat|dog
 * tracker.interactions.PetRidingObject.slots[1]=bicycle|car|motorcycle|horse
 * tracker.interactions.PetRidingObject.threshold=0.3
 * tracker.interactions.PetRidingObject.min-sustain=6s
 * tracker.interactions.PetRidingObject.expire-after=4s
 * </pre>
 */
@ConfigMapping(prefix = "tracker")
public interface TrackerConfig {

    /** Separator between the labels accepted by one slot. */
    String SLOT_LABEL_SEPARATOR = "|";

    Mqtt mqtt();

    Discovery discovery();

    Evaluation evaluation();

    Map<String, Interaction> interactions();

    /** Dump every context at DEBUG level after each evaluation pass. */
    @WithDefault("false")
    boolean debug();

    interface Mqtt {
        /** Prefix applied to every detection and event topic. */
        @WithDefault("myhome/ObjectTrackers")
        String prefix();

        /** Topic segment (under the prefix) interaction events are published to. */
        @WithDefault("events")
        String events();

        /** Topic segment (under the prefix) detections arrive on. */
        @WithDefault("detections")
        String detections();
    }

    interface Evaluation {
        /** Period of the evaluation pass, in scheduler syntax. */
        @WithDefault("1s")
        String interval();
    }

    interface Discovery {
        @WithDefault("false")
        boolean enabled();

        /** Discovery prefix watched by the home automation hub. */
        @WithDefault("homeassistant")
        String prefix();

        /** Prefix of the generated entity ids and display names. */
        @WithDefault("Tracker")
        String entityPrefix();
    }

    interface Interaction {
        List<String> slots();

        @WithDefault("0.5")
        double threshold();

        @WithDefault("3s")
        Duration minSustain();

        @WithDefault("5s")
        Duration expireAfter();
    }
}
