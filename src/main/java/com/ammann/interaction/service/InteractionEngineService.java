/* (C)2026 */
package com.ammann.interaction.service;

import com.ammann.interaction.config.TrackerConfig;
import com.ammann.interaction.dto.ContextDetailDTO;
import com.ammann.interaction.dto.ContextSummaryDTO;
import com.ammann.interaction.dto.EventRecordDTO;
import com.ammann.interaction.dto.TrackedEntityDTO;
import com.ammann.interaction.enumeration.EventTransition;
import com.ammann.interaction.exception.InvalidDetectionException;
import com.ammann.interaction.model.CandidateMatch;
import com.ammann.interaction.model.DetectionContext;
import com.ammann.interaction.model.EventKey;
import com.ammann.interaction.model.EventRecord;
import com.ammann.interaction.model.InteractionEvent;
import com.ammann.interaction.model.InteractionTemplate;
import com.ammann.interaction.model.TrackedEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * Per-context state machine turning momentary overlap matches into debounced interaction
 * events.
 *
 * <p>Two paths touch a context:
 * <ul>
 *   <li><b>Ingestion</b> ({@link #ingest}) replaces or removes tracked entities as the
 *       detection feed reports them</li>
 *   <li><b>Evaluation</b> ({@link #evaluateAll}) runs on a fixed tick, matches the current
 *       entity snapshot and reconciles the matches against the context's event records</li>
 * </ul>
 * Both hold the context's lock, so they are mutually exclusive per context while different
 * contexts proceed independently.
 *
 * <p>Each event key moves {@code PENDING -> ACTIVE -> removed}:
 * <ol>
 *   <li>first sighting creates a PENDING record</li>
 *   <li>a later sighting at least {@code minSustain} after the first activates it (once)</li>
 *   <li>absence for longer than {@code expireAfter} removes the record, emitting a clear
 *       only if it had been activated</li>
 * </ol>
 * Transitions are published after the context lock is released; a failed publish never
 * rolls back the transition.
 */
@ApplicationScoped
public class InteractionEngineService {

    private static final Logger LOG = Logger.getLogger(InteractionEngineService.class);

    private final Map<String, DetectionContext> contexts = new ConcurrentHashMap<>();

    private final InteractionTemplateRegistry registry;
    private final OverlapMatcherService matcher;
    private final DetectionMappingService mappingService;
    private final InteractionEventPublisher publisher;
    private final boolean debugContexts;

    @Inject MeterRegistry meterRegistry;

    // Metrics
    private volatile Counter ingestedCounter;
    private volatile Counter removedCounter;
    private volatile Counter activatedCounter;
    private volatile Counter clearedCounter;

    @Inject
    public InteractionEngineService(
            InteractionTemplateRegistry registry,
            OverlapMatcherService matcher,
            DetectionMappingService mappingService,
            InteractionEventPublisher publisher,
            TrackerConfig config) {
        this.registry = registry;
        this.matcher = matcher;
        this.mappingService = mappingService;
        this.publisher = publisher;
        this.debugContexts = config.debug();
    }

    /**
     * Initialize metrics on first use.
     */
    synchronized void initMetrics() {
        if (ingestedCounter != null) {
            return;
        }
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        removedCounter =
                Counter.builder("tracker_detections_removed_total")
                        .description("Entities removed on request of the detection feed")
                        .register(meterRegistry);

        activatedCounter =
                Counter.builder("tracker_events_activated_total")
                        .description("Interaction events that became active")
                        .register(meterRegistry);

        clearedCounter =
                Counter.builder("tracker_events_cleared_total")
                        .description("Active interaction events that expired")
                        .register(meterRegistry);

        Gauge.builder("tracker_contexts", contexts, Map::size)
                .description("Detection contexts currently tracked")
                .register(meterRegistry);

        // Assigned last; ensureMetrics and the guard above test this field.
        ingestedCounter =
                Counter.builder("tracker_detections_ingested_total")
                        .description("Detection updates applied to a context")
                        .register(meterRegistry);
    }

    private void ensureMetrics() {
        if (meterRegistry != null && ingestedCounter == null) {
            initMetrics();
        }
    }

    /**
     * Applies one detection update.
     *
     * <p>An empty payload removes the entity. Any other payload is decoded as a tracked
     * entity record and replaces the entity; a payload that cannot be decoded is logged,
     * counted and dropped without touching the context.
     *
     * @param contextName source context, created on first use
     * @param entityId    tracked id within the context
     * @param payload     wire record, or empty for removal
     */
    public void ingest(String contextName, String entityId, byte[] payload) {
        if (payload == null || payload.length == 0) {
            removeEntity(contextName, entityId);
            return;
        }

        TrackedEntity entity;
        try {
            entity = mappingService.decode(entityId, payload);
        } catch (InvalidDetectionException e) {
            recordRejected(e);
            LOG.warnf("%s: dropping update for %s: %s", contextName, entityId, e.getMessage());
            return;
        }
        putEntity(contextName, entity);
    }

    /**
     * Inserts or replaces an entity, creating the context if it is new.
     */
    public void putEntity(String contextName, TrackedEntity entity) {
        ensureMetrics();
        DetectionContext context =
                contexts.computeIfAbsent(
                        contextName,
                        name -> {
                            LOG.infof("New detection context %s", name);
                            return new DetectionContext(name);
                        });

        boolean added;
        int tracked;
        ReentrantLock lock = context.lock();
        lock.lock();
        try {
            added = context.entities().put(entity.getId(), entity) == null;
            tracked = context.entities().size();
        } finally {
            lock.unlock();
        }

        if (ingestedCounter != null) {
            ingestedCounter.increment();
        }
        if (added) {
            LOG.infof("%s Added %s. Tracking %d objects.", contextName, entity.getId(), tracked);
        } else {
            LOG.debugf("%s Updated %s: %s", contextName, entity.getId(), entity);
        }
    }

    /**
     * Drops an entity from its context. Unknown contexts and ids are ignored.
     */
    public void removeEntity(String contextName, String entityId) {
        ensureMetrics();
        DetectionContext context = contexts.get(contextName);
        if (context == null) {
            LOG.debugf("%s Removal of %s for unknown context ignored", contextName, entityId);
            return;
        }

        boolean removed;
        int tracked;
        ReentrantLock lock = context.lock();
        lock.lock();
        try {
            removed = context.entities().remove(entityId) != null;
            tracked = context.entities().size();
        } finally {
            lock.unlock();
        }

        if (removed) {
            if (removedCounter != null) {
                removedCounter.increment();
            }
            LOG.infof("%s Removed %s. Tracking %d objects.", contextName, entityId, tracked);
        }
    }

    /**
     * Counts a rejected detection update by reason.
     */
    public void recordRejected(InvalidDetectionException e) {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("tracker_detections_rejected_total")
                .description("Detection updates dropped as malformed")
                .tag("reason", e.getReason())
                .register(meterRegistry)
                .increment();
    }

    /**
     * Runs one evaluation pass over every context using a single timestamp.
     *
     * @param now time of this pass, shared by every key evaluated
     * @return transitions emitted during the pass, in emission order
     */
    public List<InteractionEvent> evaluateAll(Instant now) {
        List<InteractionEvent> emitted = new ArrayList<>();
        for (DetectionContext context : contexts.values()) {
            emitted.addAll(evaluate(context, now));
        }
        return emitted;
    }

    /**
     * Runs one evaluation pass over a single context.
     *
     * @return transitions emitted, empty if the context does not exist
     */
    public List<InteractionEvent> evaluate(String contextName, Instant now) {
        DetectionContext context = contexts.get(contextName);
        return context == null ? List.of() : evaluate(context, now);
    }

    private List<InteractionEvent> evaluate(DetectionContext context, Instant now) {
        ensureMetrics();
        List<InteractionEvent> transitions;
        ReentrantLock lock = context.lock();
        lock.lock();
        try {
            transitions = reconcile(context, now);
            if (debugContexts) {
                LOG.debug(describeLocked(context));
            }
        } finally {
            lock.unlock();
        }

        for (InteractionEvent event : transitions) {
            if (event.transition() == EventTransition.ACTIVATED) {
                if (activatedCounter != null) {
                    activatedCounter.increment();
                }
            } else if (clearedCounter != null) {
                clearedCounter.increment();
            }
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to publish %s for %s in %s",
                        event.transition(), event.key().path(), event.context());
            }
        }
        return transitions;
    }

    /**
     * Reconciles this tick's matches with the context's event records. Caller holds the lock.
     */
    private List<InteractionEvent> reconcile(DetectionContext context, Instant now) {
        List<TrackedEntity> snapshot = context.snapshotEntities();
        List<CandidateMatch> matches = matcher.findMatches(snapshot, registry.all());

        // Several slot permutations or entity pairs can yield the same key; first one wins.
        Map<EventKey, CandidateMatch> current = new LinkedHashMap<>();
        for (CandidateMatch match : matches) {
            current.putIfAbsent(match.key(), match);
        }

        List<InteractionEvent> transitions = new ArrayList<>();
        Map<EventKey, EventRecord> events = context.events();

        for (Map.Entry<EventKey, CandidateMatch> entry : current.entrySet()) {
            EventKey key = entry.getKey();
            EventRecord record = events.get(key);
            if (record == null) {
                events.put(key, new EventRecord(now));
                LOG.debugf("%s %s pending (entities %s)",
                        context.getName(), key.path(), entry.getValue().entityIds());
                continue;
            }

            Optional<InteractionTemplate> template = registry.find(key.interaction());
            if (!record.isPublished()
                    && template.isPresent()
                    && record.isSustained(now, template.get().minSustain())) {
                record.markPublished();
                transitions.add(
                        new InteractionEvent(context.getName(), key, EventTransition.ACTIVATED, now));
            }
            record.refresh(now);
        }

        Iterator<Map.Entry<EventKey, EventRecord>> iterator = events.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<EventKey, EventRecord> entry = iterator.next();
            EventKey key = entry.getKey();
            if (current.containsKey(key)) {
                continue;
            }

            EventRecord record = entry.getValue();
            Optional<InteractionTemplate> template = registry.find(key.interaction());
            boolean expired =
                    template.isEmpty() || record.isExpired(now, template.get().expireAfter());
            if (!expired) {
                continue;
            }

            if (record.isPublished()) {
                transitions.add(
                        new InteractionEvent(context.getName(), key, EventTransition.CLEARED, now));
            } else {
                LOG.debugf("%s %s expired before activation", context.getName(), key.path());
            }
            iterator.remove();
        }

        return transitions;
    }

    /** Names of all known contexts, sorted. */
    public Set<String> contextNames() {
        return new TreeSet<>(contexts.keySet());
    }

    /**
     * Counts of every context, in name order.
     */
    public List<ContextSummaryDTO> summarize() {
        List<ContextSummaryDTO> summaries = new ArrayList<>();
        for (String name : contextNames()) {
            DetectionContext context = contexts.get(name);
            ReentrantLock lock = context.lock();
            lock.lock();
            try {
                long active =
                        context.events().values().stream().filter(EventRecord::isPublished).count();
                summaries.add(
                        new ContextSummaryDTO(
                                name,
                                context.entities().size(),
                                context.events().size() - active,
                                active));
            } finally {
                lock.unlock();
            }
        }
        return summaries;
    }

    /**
     * Consistent copy of one context's entities and events.
     *
     * @return the snapshot, or empty if no such context exists
     */
    public Optional<ContextDetailDTO> describe(String contextName) {
        DetectionContext context = contexts.get(contextName);
        if (context == null) {
            return Optional.empty();
        }

        ReentrantLock lock = context.lock();
        lock.lock();
        try {
            Map<String, TrackedEntityDTO> entities = new LinkedHashMap<>();
            context.entities().forEach((id, entity) -> entities.put(id, TrackedEntityDTO.from(entity)));
            List<EventRecordDTO> events = new ArrayList<>();
            context.events().forEach((key, record) -> events.add(EventRecordDTO.from(key, record)));
            return Optional.of(new ContextDetailDTO(contextName, entities, events));
        } finally {
            lock.unlock();
        }
    }

    private static String describeLocked(DetectionContext context) {
        StringBuilder dump = new StringBuilder("Context ").append(context.getName()).append(':');
        context.entities().forEach(
                (id, entity) -> dump.append("\n  entity ").append(entity));
        context.events().forEach(
                (key, record) ->
                        dump.append("\n  event ")
                                .append(key.path())
                                .append(' ')
                                .append(record.getState())
                                .append(" first=")
                                .append(record.getFirstObservedAt())
                                .append(" last=")
                                .append(record.getLastObservedAt()));
        return dump.toString();
    }
}
