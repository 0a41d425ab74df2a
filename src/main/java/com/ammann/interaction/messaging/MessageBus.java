/* (C)2026 */
package com.ammann.interaction.messaging;

/**
 * Outbound side of the message bus.
 *
 * <p>Topics are absolute. Implementations hand the message to the transport and return;
 * delivery, retries and reconnects belong to the transport.
 */
public interface MessageBus {

    /**
     * Publishes a payload.
     *
     * @param topic   absolute topic
     * @param payload message body; empty to clear a retained message
     * @param retain  whether the broker keeps the message for late subscribers
     */
    void publish(String topic, String payload, boolean retain);
}
