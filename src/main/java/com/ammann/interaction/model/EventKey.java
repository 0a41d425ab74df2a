/* (C)2026 */
package com.ammann.interaction.model;

import java.util.List;

/**
 * Identity of an interaction event within a context: the interaction name plus the ordered
 * labels that filled its slots. Different physical entities producing the same label
 * sequence share one key.
 *
 * @param interaction interaction template name
 * @param slotLabels  labels in slot order
 */
public record EventKey(String interaction, List<String> slotLabels) {

    public EventKey {
        slotLabels = List.copyOf(slotLabels);
    }

    /** {@code interaction/slot1/slot2/...} */
    public String path() {
        return interaction + "/" + String.join("/", slotLabels);
    }

    @Override
    public String toString() {
        return path();
    }
}
