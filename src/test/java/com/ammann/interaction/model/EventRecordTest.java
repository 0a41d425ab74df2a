/* (C)2026 */
package com.ammann.interaction.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.interaction.enumeration.EventState;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventRecordTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void sustainedBoundaryIsInclusive() {
        EventRecord record = new EventRecord(T0);

        assertThat(record.isSustained(T0.plusMillis(2999), Duration.ofSeconds(3))).isFalse();
        assertThat(record.isSustained(T0.plusSeconds(3), Duration.ofSeconds(3))).isTrue();
    }

    @Test
    void expiryBoundaryIsExclusive() {
        EventRecord record = new EventRecord(T0);
        record.refresh(T0.plusSeconds(2));

        assertThat(record.isExpired(T0.plusSeconds(7), Duration.ofSeconds(5))).isFalse();
        assertThat(record.isExpired(T0.plusMillis(7001), Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void stateFollowsPublication() {
        EventRecord record = new EventRecord(T0);

        assertThat(record.getState()).isEqualTo(EventState.PENDING);
        record.markPublished();
        assertThat(record.getState()).isEqualTo(EventState.ACTIVE);
        assertThat(record.getFirstObservedAt()).isEqualTo(T0);
    }
}
