/* (C)2026 */
package com.ammann.interaction.dto;

import com.ammann.interaction.model.EventKey;
import java.util.List;

/**
 * JSON body published on an interaction's state topic when it activates.
 *
 * @param name  interaction name
 * @param slots labels that filled the slots, in slot order
 */
public record InteractionPayloadDTO(String name, List<String> slots) {

    public static InteractionPayloadDTO from(EventKey key) {
        return new InteractionPayloadDTO(key.interaction(), key.slotLabels());
    }
}
