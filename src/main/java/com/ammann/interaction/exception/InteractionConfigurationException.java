package com.ammann.interaction.exception;

/**
 * Exception indicating an interaction template that cannot be evaluated.
 *
 * <p>Fatal: thrown at startup while building the template registry, never retried.
 */
public class InteractionConfigurationException extends TrackerException
{
    public InteractionConfigurationException(String message)
    {
        super(message);
    }

    /**
     * Creates an exception for an invalid template property.
     */
    public static InteractionConfigurationException invalidTemplate(String template, String problem)
    {
        return new InteractionConfigurationException(
                String.format("Interaction '%s' is invalid: %s", template, problem));
    }
}
