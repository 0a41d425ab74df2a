/* (C)2026 */
package com.ammann.interaction.enumeration;

/**
 * Outbound transitions emitted by the interaction engine.
 */
public enum EventTransition
{
    ACTIVATED("ON"),
    CLEARED("OFF");

    private final String discoveryState;

    EventTransition(String discoveryState) {
        this.discoveryState = discoveryState;
    }

    /** Binary sensor state published on the discovery state topic. */
    public String getDiscoveryState() { return discoveryState; }
}
