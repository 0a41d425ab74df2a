/* (C)2026 */
package com.ammann.interaction.service;

import com.ammann.interaction.config.TrackerConfig;
import com.ammann.interaction.exception.InteractionConfigurationException;
import com.ammann.interaction.model.InteractionTemplate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Holds the interaction templates the engine evaluates, keyed and ordered by name.
 *
 * <p>Templates are validated once when the registry is built. A template that cannot be
 * evaluated aborts startup with {@link InteractionConfigurationException}.
 */
@ApplicationScoped
public class InteractionTemplateRegistry {

    private static final Logger LOG = Logger.getLogger(InteractionTemplateRegistry.class);
    private static final Pattern SLOT_SEPARATOR =
            Pattern.compile(Pattern.quote(TrackerConfig.SLOT_LABEL_SEPARATOR));

    private volatile Map<String, InteractionTemplate> templates = Map.of();

    @Inject
    public InteractionTemplateRegistry(TrackerConfig config) {
        this(fromConfig(config.interactions()));
    }

    public InteractionTemplateRegistry(Collection<InteractionTemplate> templates) {
        replaceAll(templates);
    }

    /**
     * Looks up a template by name.
     *
     * @return the template, or empty when no template of that name is configured
     */
    public Optional<InteractionTemplate> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    /** All templates in name order. */
    public Collection<InteractionTemplate> all() {
        return templates.values();
    }

    /**
     * Swaps in a new template set. Event records whose template is gone are expired by the
     * engine on its next pass.
     */
    public void replaceAll(Collection<InteractionTemplate> replacement) {
        Map<String, InteractionTemplate> validated = new TreeMap<>();
        for (InteractionTemplate template : replacement) {
            validate(template);
            if (validated.put(template.name(), template) != null) {
                throw InteractionConfigurationException.invalidTemplate(
                        template.name(), "declared more than once");
            }
            if (template.slotCount() != 2) {
                LOG.warnf(
                        "Interaction '%s' declares %d slots; only overlapping pairs are matched,"
                                + " so it will never trigger",
                        template.name(), template.slotCount());
            }
        }
        this.templates = Collections.unmodifiableMap(validated);
        LOG.infof("Loaded %d interaction templates: %s", validated.size(), validated.keySet());
    }

    static List<InteractionTemplate> fromConfig(Map<String, TrackerConfig.Interaction> config) {
        List<InteractionTemplate> result = new ArrayList<>(config.size());
        config.forEach(
                (name, interaction) ->
                        result.add(
                                new InteractionTemplate(
                                        name,
                                        parseSlots(name, interaction.slots()),
                                        interaction.threshold(),
                                        interaction.minSustain(),
                                        interaction.expireAfter())));
        return result;
    }

    static List<Set<String>> parseSlots(String name, List<String> rawSlots) {
        if (rawSlots == null || rawSlots.isEmpty()) {
            throw InteractionConfigurationException.invalidTemplate(name, "no slots declared");
        }
        List<Set<String>> slots = new ArrayList<>(rawSlots.size());
        for (String rawSlot : rawSlots) {
            Set<String> labels = new LinkedHashSet<>();
            Arrays.stream(SLOT_SEPARATOR.split(rawSlot == null ? "" : rawSlot))
                    .map(String::trim)
                    .filter(label -> !label.isEmpty())
                    .forEach(labels::add);
            slots.add(labels);
        }
        return slots;
    }

    private static void validate(InteractionTemplate template) {
        String name = template.name();
        if (name == null || name.isBlank() || name.contains("/")) {
            throw InteractionConfigurationException.invalidTemplate(
                    String.valueOf(name), "name must be non-blank and must not contain '/'");
        }
        if (template.slots().isEmpty()) {
            throw InteractionConfigurationException.invalidTemplate(name, "no slots declared");
        }
        if (template.slotCount() > OverlapMatcherService.MAX_SLOT_DEPTH) {
            throw InteractionConfigurationException.invalidTemplate(
                    name,
                    String.format("%d slots exceed the limit of %d",
                            template.slotCount(), OverlapMatcherService.MAX_SLOT_DEPTH));
        }
        for (int i = 0; i < template.slotCount(); i++) {
            if (template.slots().get(i).isEmpty()) {
                throw InteractionConfigurationException.invalidTemplate(
                        name, "slot " + i + " accepts no labels");
            }
        }
        double threshold = template.overlapThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw InteractionConfigurationException.invalidTemplate(
                    name, "threshold must be within [0, 1], got " + threshold);
        }
        if (isNegative(template.minSustain()) || isNegative(template.expireAfter())) {
            throw InteractionConfigurationException.invalidTemplate(
                    name, "min-sustain and expire-after must be non-negative");
        }
    }

    private static boolean isNegative(Duration duration) {
        return duration == null || duration.isNegative();
    }
}
