package com.ammann.interaction.exception;

/**
 * Raised when slot matching recurses past its depth limit.
 *
 * <p>Treated as a fatal configuration error: the evaluation pass is aborted rather than
 * silently truncating the search.
 */
public class SlotMatchingException extends InteractionConfigurationException
{
    public SlotMatchingException(String template, int depth, int maxDepth)
    {
        super(String.format(
                "Slot matching for interaction '%s' exceeded depth %d (limit %d)",
                template, depth, maxDepth));
    }
}
