/* (C)2026 */
package com.ammann.interaction.enumeration;

/**
 * Lifecycle of a tracked interaction event. A record that expires is removed rather than
 * moved to a terminal state.
 */
public enum EventState
{
    /** Seen at least once, not yet sustained long enough to publish. */
    PENDING,
    /** Sustained past the minimum time and published. */
    ACTIVE
}
