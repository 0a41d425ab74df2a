/* (C)2026 */
package com.ammann.interaction.service;

import com.ammann.interaction.config.TrackerConfig;
import com.ammann.interaction.dto.TrackedEntityDTO;
import com.ammann.interaction.exception.InvalidDetectionException;
import com.ammann.interaction.model.BoundingBox;
import com.ammann.interaction.model.DetectionAddress;
import com.ammann.interaction.model.TrackedEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps between the detection feed's wire format and {@link TrackedEntity}.
 *
 * <p>Detection topics follow {@code {prefix}/{detections}/{context}/{entityId}}; payloads
 * are the JSON form of {@link TrackedEntityDTO}. Anything that does not fit is rejected
 * with {@link InvalidDetectionException}.
 */
@ApplicationScoped
public class DetectionMappingService
{
    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Pattern topicPattern;

    @Inject
    public DetectionMappingService(TrackerConfig config)
    {
        this(config.mqtt().prefix(), config.mqtt().detections());
    }

    public DetectionMappingService(String prefix, String detectionsSegment)
    {
        String base = trimSlashes(prefix) + "/" + trimSlashes(detectionsSegment);
        this.topicPattern = Pattern.compile(
                "^/?" + Pattern.quote(base) + "/(?<context>[^/]+)/(?<entity>.+)$");
    }

    /**
     * Splits a detection topic into its context and entity id. The entity id is the rest of
     * the topic and may itself contain {@code /}.
     *
     * @throws InvalidDetectionException if the topic is not a detection topic
     */
    public DetectionAddress parseTopic(String topic)
    {
        Matcher matcher = topic == null ? null : topicPattern.matcher(topic);
        if (matcher == null || !matcher.matches()) {
            throw InvalidDetectionException.unexpectedTopic(topic);
        }
        return new DetectionAddress(matcher.group("context"), matcher.group("entity"));
    }

    /**
     * Decodes a non-empty detection payload into an entity.
     *
     * @param entityId tracked id taken from the topic
     * @param payload  JSON wire record
     * @return the restored entity
     * @throws InvalidDetectionException if the payload is not a valid wire record
     */
    public TrackedEntity decode(String entityId, byte[] payload)
    {
        TrackedEntityDTO dto;
        try {
            dto = JSON_MAPPER.readValue(payload, TrackedEntityDTO.class);
        } catch (IOException e) {
            throw InvalidDetectionException.malformedPayload(entityId, e);
        }
        if (dto == null) {
            throw InvalidDetectionException.invalidField(entityId, "payload", null);
        }
        return toEntity(entityId, dto);
    }

    /**
     * Validates a wire record and converts it to an entity.
     *
     * <p>An entity that has been tracked but never classified has no label and no box; a
     * missing or blank label and a missing box restore as {@code null}.
     */
    public TrackedEntity toEntity(String entityId, TrackedEntityDTO dto)
    {
        String label = dto.label() == null || dto.label().isBlank() ? null : dto.label();
        double confidence = dto.confidence() == null ? 0.0 : dto.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw InvalidDetectionException.invalidField(entityId, "confidence", dto.confidence());
        }
        long age = dto.age() == null ? 0L : dto.age();
        long missingStreak = dto.missingStreak() == null ? 0L : dto.missingStreak();
        if (age < 0 || missingStreak < 0) {
            throw InvalidDetectionException.invalidField(
                    entityId, age < 0 ? "age" : "missingStreak", age < 0 ? age : missingStreak);
        }
        if (dto.box() != null && (dto.box().size() != 4 || dto.box().contains(null))) {
            throw InvalidDetectionException.invalidField(entityId, "box", dto.box());
        }

        return TrackedEntity.restore(
                entityId,
                label,
                confidence,
                age,
                missingStreak,
                dto.framesSeen() == null ? 0L : dto.framesSeen(),
                dto.box() == null ? null : BoundingBox.fromList(dto.box()));
    }

    /**
     * Encodes an entity as its JSON wire record.
     */
    public String encode(TrackedEntity entity)
    {
        try {
            return JSON_MAPPER.writeValueAsString(TrackedEntityDTO.from(entity));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize entity " + entity.getId(), e);
        }
    }

    private static String trimSlashes(String segment)
    {
        String trimmed = segment == null ? "" : segment.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
