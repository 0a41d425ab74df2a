/* (C)2026 */
package com.ammann.interaction.messaging;

import io.netty.handler.codec.mqtt.MqttQoS;
import io.smallrye.reactive.messaging.mqtt.MqttMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * {@link MessageBus} backed by the SmallRye MQTT connector.
 *
 * <p>Each message carries its own topic, QoS and retain flag; the
 * {@code interaction-events} channel only supplies the broker connection.
 */
@ApplicationScoped
public class MqttMessageBus implements MessageBus {

    private static final Logger LOG = Logger.getLogger(MqttMessageBus.class);

    @Inject
    @Channel("interaction-events")
    Emitter<String> emitter;

    @Override
    public void publish(String topic, String payload, boolean retain) {
        LOG.debugf("Publishing %s (retain=%b): %s", topic, retain, payload);
        emitter.send(MqttMessage.of(topic, payload, MqttQoS.AT_LEAST_ONCE, retain));
    }
}
