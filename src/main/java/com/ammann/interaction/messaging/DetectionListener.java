/* (C)2026 */
package com.ammann.interaction.messaging;

import com.ammann.interaction.exception.InvalidDetectionException;
import com.ammann.interaction.model.DetectionAddress;
import com.ammann.interaction.service.DetectionMappingService;
import com.ammann.interaction.service.InteractionEngineService;
import io.smallrye.reactive.messaging.mqtt.MqttMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.concurrent.CompletionStage;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

/**
 * Consumes detection updates from the {@code detections} channel and hands them to the
 * interaction engine.
 *
 * <p>Every message is acknowledged, including rejected ones: a malformed update is dropped,
 * never redelivered.
 */
@ApplicationScoped
public class DetectionListener {

    private static final Logger LOG = Logger.getLogger(DetectionListener.class);

    private final DetectionMappingService mappingService;
    private final InteractionEngineService engine;

    @Inject
    public DetectionListener(DetectionMappingService mappingService, InteractionEngineService engine) {
        this.mappingService = mappingService;
        this.engine = engine;
    }

    @Incoming("detections")
    public CompletionStage<Void> onDetection(Message<byte[]> message) {
        String topic = message instanceof MqttMessage<?> mqttMessage ? mqttMessage.getTopic() : null;
        try {
            handle(topic, message.getPayload());
        } catch (InvalidDetectionException e) {
            engine.recordRejected(e);
            LOG.warnf("Dropping detection update: %s", e.getMessage());
        }
        return message.ack();
    }

    /**
     * Routes one update: an empty payload removes the entity, anything else replaces it.
     *
     * @throws InvalidDetectionException if the topic is not a detection topic
     */
    void handle(String topic, byte[] payload) {
        DetectionAddress address = mappingService.parseTopic(topic);
        engine.ingest(address.context(), address.entityId(), payload);
    }
}
