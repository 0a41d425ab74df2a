/* (C)2026 */
package com.ammann.interaction.dto;

import com.ammann.interaction.enumeration.EventState;
import com.ammann.interaction.model.EventKey;
import com.ammann.interaction.model.EventRecord;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Debounce state of one interaction event")
public record EventRecordDTO(
        @Schema(description = "Interaction name") String interaction,
        @Schema(description = "Slot labels in slot order") List<String> slots,
        @Schema(description = "PENDING until sustained, then ACTIVE") EventState state,
        @Schema(description = "First time the candidate was seen") Instant firstObservedAt,
        @Schema(description = "Most recent time the candidate was seen") Instant lastObservedAt) {

    public static EventRecordDTO from(EventKey key, EventRecord record) {
        return new EventRecordDTO(
                key.interaction(),
                key.slotLabels(),
                record.getState(),
                record.getFirstObservedAt(),
                record.getLastObservedAt());
    }
}
