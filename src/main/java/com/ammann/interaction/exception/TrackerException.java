package com.ammann.interaction.exception;

/**
 * Base unchecked exception for all application-level errors in the interaction tracker.
 *
 * <p>Subclasses separate recoverable input problems (malformed detections) from fatal
 * configuration errors. REST-facing failures are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class TrackerException extends RuntimeException
{
    public TrackerException(String message, Throwable cause) {
        super(message, cause);
    }

    public TrackerException(String message) {
        super(message);
    }
}
