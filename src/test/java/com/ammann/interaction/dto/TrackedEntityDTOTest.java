/* (C)2026 */
package com.ammann.interaction.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.interaction.enumeration.EventState;
import com.ammann.interaction.model.BoundingBox;
import com.ammann.interaction.model.Detection;
import com.ammann.interaction.model.EventKey;
import com.ammann.interaction.model.EventRecord;
import com.ammann.interaction.model.TrackedEntity;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrackedEntityDTOTest {

    @Test
    void flattensEntityJudgment() {
        TrackedEntity entity = new TrackedEntity("4");
        entity.markSeen(new Detection("cat", 0.9, new BoundingBox(0.1, 0.2, 0.3, 0.4)));

        TrackedEntityDTO dto = TrackedEntityDTO.from(entity);

        assertThat(dto.label()).isEqualTo("cat");
        assertThat(dto.confidence()).isEqualTo(0.9);
        assertThat(dto.age()).isEqualTo(1L);
        assertThat(dto.missingStreak()).isZero();
        assertThat(dto.framesSeen()).isZero();
        assertThat(dto.box()).containsExactly(0.1, 0.2, 0.3, 0.4);
    }

    @Test
    void entityWithoutBoxHasNoBox() {
        TrackedEntity entity = new TrackedEntity("4");
        entity.markSeen();

        assertThat(TrackedEntityDTO.from(entity).box()).isNull();
        assertThat(TrackedEntityDTO.from(entity).label()).isNull();
    }

    @Test
    void eventRecordViewCarriesKeyAndState() {
        Instant first = Instant.parse("2026-03-01T12:00:00Z");
        EventRecord record = new EventRecord(first);
        record.refresh(first.plusSeconds(4));
        record.markPublished();

        EventRecordDTO dto = EventRecordDTO.from(new EventKey("Ride", List.of("dog", "car")), record);

        assertThat(dto.interaction()).isEqualTo("Ride");
        assertThat(dto.slots()).containsExactly("dog", "car");
        assertThat(dto.state()).isEqualTo(EventState.ACTIVE);
        assertThat(dto.lastObservedAt()).isEqualTo(first.plusSeconds(4));
    }

    @Test
    void activationPayloadMirrorsKey() {
        InteractionPayloadDTO payload =
                InteractionPayloadDTO.from(new EventKey("Ride", List.of("dog", "car")));

        assertThat(payload.name()).isEqualTo("Ride");
        assertThat(payload.slots()).containsExactly("dog", "car");
    }
}
