/* (C)2026 */
package com.ammann.interaction.service;

import com.ammann.interaction.config.TrackerConfig;
import com.ammann.interaction.dto.DiscoveryConfigDTO;
import com.ammann.interaction.dto.InteractionPayloadDTO;
import com.ammann.interaction.enumeration.EventTransition;
import com.ammann.interaction.messaging.MessageBus;
import com.ammann.interaction.model.EventKey;
import com.ammann.interaction.model.InteractionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Turns engine transitions into bus messages.
 *
 * <p>Two channels are written:
 * <ul>
 *   <li><b>State:</b> {@code {prefix}/{events}/{context}/{interaction}/{slot...}} carries a
 *       JSON body on activation and an empty retained body on clear</li>
 *   <li><b>Discovery</b> (optional): {@code {discoveryPrefix}/binary_sensor/{entityId}}
 *       receives a retained {@code config} registration once per entity id for the lifetime
 *       of the process, ahead of any state message for that identity, followed by retained
 *       {@code ON}/{@code OFF} states</li>
 * </ul>
 *
 * <p>Bus failures are logged and counted, never rethrown: the engine's state transition
 * stands whether or not the message went out, and nothing is retried.
 */
@ApplicationScoped
public class InteractionEventPublisher {

    private static final Logger LOG = Logger.getLogger(InteractionEventPublisher.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static final String STATE_CHANNEL = "state";
    static final String DISCOVERY_CHANNEL = "discovery";

    private final MessageBus bus;
    private final TrackerConfig config;
    private final Set<String> registeredEntities = ConcurrentHashMap.newKeySet();

    @Inject MeterRegistry meterRegistry;

    @Inject
    public InteractionEventPublisher(MessageBus bus, TrackerConfig config) {
        this.bus = bus;
        this.config = config;
    }

    /**
     * Publishes one transition on the state topic and, when enabled, the discovery topics.
     */
    public void publish(InteractionEvent event) {
        EventKey key = event.key();
        String topic = stateTopic(event.context(), key);
        boolean discovery = config.discovery().enabled();
        String entityId = discovery ? entityId(event.context(), key) : null;

        if (discovery) {
            registerOnce(event.context(), key, entityId);
        }

        if (event.transition() == EventTransition.ACTIVATED) {
            LOG.infof("Interaction %s activated in %s", key.path(), event.context());
            send(STATE_CHANNEL, topic, activationPayload(key), false);
        } else {
            LOG.infof("Interaction %s cleared in %s", key.path(), event.context());
            send(STATE_CHANNEL, topic, "", true);
        }

        if (discovery) {
            send(DISCOVERY_CHANNEL,
                    discoveryTopic(entityId) + "/state",
                    event.transition().getDiscoveryState(),
                    true);
        }
    }

    private void registerOnce(String context, EventKey key, String entityId) {
        if (!registeredEntities.add(entityId)) {
            return;
        }
        String baseTopic = discoveryTopic(entityId);
        String name = friendlyName(context, key);
        DiscoveryConfigDTO registration =
                new DiscoveryConfigDTO(name, name, entityId, baseTopic + "/state");
        LOG.infof("Registering discovery entity %s", entityId);
        send(DISCOVERY_CHANNEL, baseTopic + "/config", toJson(registration), true);
    }

    private void send(String channel, String topic, String payload, boolean retain) {
        try {
            bus.publish(topic, payload, retain);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to publish %s message to %s", channel, topic);
            recordFailure(channel);
        }
    }

    private void recordFailure(String channel) {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("tracker_publish_failures_total")
                .description("Outbound messages the bus refused")
                .tag("channel", channel)
                .register(meterRegistry)
                .increment();
    }

    String stateTopic(String context, EventKey key) {
        return trimTrailingSlash(config.mqtt().prefix())
                + "/" + config.mqtt().events() + "/" + context + "/" + key.path();
    }

    String discoveryTopic(String entityId) {
        return trimTrailingSlash(config.discovery().prefix()) + "/binary_sensor/" + entityId;
    }

    /**
     * Deterministic entity id: {@code {entityPrefix}-{context}-{interaction-slot1-slot2}} with
     * dashes and underscores removed from the context and event names.
     */
    String entityId(String context, EventKey key) {
        String contextName = stripSeparators(context);
        String eventName = stripSeparators(key.path()).replace('/', '-');
        return config.discovery().entityPrefix() + "-" + contextName + "-" + eventName;
    }

    String friendlyName(String context, EventKey key) {
        return String.format("%s - [%s] [%s]",
                config.discovery().entityPrefix(), key.path().replace('/', '|'), context);
    }

    private static String trimTrailingSlash(String value) {
        return value.replaceAll("/+$", "");
    }

    private static String stripSeparators(String value) {
        return value.replace("-", "").replace("_", "");
    }

    private static String activationPayload(EventKey key) {
        return toJson(InteractionPayloadDTO.from(key));
    }

    private static String toJson(Object value) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value, e);
        }
    }

    /** Entity ids registered so far. */
    public Set<String> getRegisteredEntities() {
        return Set.copyOf(registeredEntities);
    }
}
