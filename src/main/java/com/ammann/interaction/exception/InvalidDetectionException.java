package com.ammann.interaction.exception;

/**
 * Exception indicating that an inbound detection update could not be understood.
 *
 * <p>Raised while decoding a detection topic or payload. Ingestion catches it, logs and
 * drops the update; the context's entity map is left untouched.
 */
public class InvalidDetectionException extends TrackerException
{
    private final String reason;

    public InvalidDetectionException(String reason, String message)
    {
        super(message);
        this.reason = reason;
    }

    public InvalidDetectionException(String reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = reason;
    }

    /** Short machine-readable reason, used as a metric tag. */
    public String getReason()
    {
        return reason;
    }

    /**
     * Creates an exception for a topic that does not follow the detection topic layout.
     */
    public static InvalidDetectionException unexpectedTopic(String topic)
    {
        return new InvalidDetectionException(
                "topic", String.format("Topic '%s' is not a detection topic", topic));
    }

    /**
     * Creates an exception for a payload that is not a valid entity record.
     */
    public static InvalidDetectionException malformedPayload(String entityId, Throwable cause)
    {
        return new InvalidDetectionException(
                "payload",
                String.format("Malformed detection payload for entity '%s': %s",
                        entityId, cause.getMessage()),
                cause);
    }

    /**
     * Creates an exception for a payload that parsed but violates a field constraint.
     */
    public static InvalidDetectionException invalidField(String entityId, String field, Object value)
    {
        return new InvalidDetectionException(
                "field",
                String.format("Invalid field '%s' for entity '%s': got '%s'", field, entityId, value));
    }
}
