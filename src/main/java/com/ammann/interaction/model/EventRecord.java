/* (C)2026 */
package com.ammann.interaction.model;

import com.ammann.interaction.enumeration.EventState;
import java.time.Duration;
import java.time.Instant;

/**
 * Debounce bookkeeping for one {@link EventKey} within a context.
 */
public class EventRecord {

    private final Instant firstObservedAt;
    private Instant lastObservedAt;
    private boolean published;

    public EventRecord(Instant observedAt) {
        this.firstObservedAt = observedAt;
        this.lastObservedAt = observedAt;
    }

    public void refresh(Instant observedAt) {
        this.lastObservedAt = observedAt;
    }

    public void markPublished() {
        this.published = true;
    }

    /** Whether the candidate has persisted for at least {@code minSustain} as of {@code now}. */
    public boolean isSustained(Instant now, Duration minSustain) {
        return Duration.between(firstObservedAt, now).compareTo(minSustain) >= 0;
    }

    /** Whether the candidate has been absent for longer than {@code expireAfter} as of {@code now}. */
    public boolean isExpired(Instant now, Duration expireAfter) {
        return Duration.between(lastObservedAt, now).compareTo(expireAfter) > 0;
    }

    public Instant getFirstObservedAt() {
        return firstObservedAt;
    }

    public Instant getLastObservedAt() {
        return lastObservedAt;
    }

    public boolean isPublished() {
        return published;
    }

    public EventState getState() {
        return published ? EventState.ACTIVE : EventState.PENDING;
    }
}
