/* (C)2026 */
package com.ammann.interaction.model;

import com.ammann.interaction.enumeration.EventTransition;
import java.time.Instant;

/**
 * A state transition of one interaction event, ready to be published.
 *
 * @param context    context the event belongs to
 * @param key        event identity
 * @param transition activation or clear
 * @param at         evaluation time that produced the transition
 */
public record InteractionEvent(
        String context, EventKey key, EventTransition transition, Instant at) {}
