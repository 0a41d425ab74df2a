/* (C)2026 */
package com.ammann.interaction.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Isolated per-source (per camera) set of tracked entities and interaction event records.
 *
 * <p>The feed and the evaluator both touch this state, so every access to the maps must
 * hold {@link #lock()}. Entity and event maps keep insertion order so evaluation order is
 * deterministic.
 */
public class DetectionContext {

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TrackedEntity> entities = new LinkedHashMap<>();
    private final Map<EventKey, EventRecord> events = new LinkedHashMap<>();

    public DetectionContext(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public ReentrantLock lock() {
        return lock;
    }

    /** Live entity map; caller must hold the lock. */
    public Map<String, TrackedEntity> entities() {
        return entities;
    }

    /** Live event map; caller must hold the lock. */
    public Map<EventKey, EventRecord> events() {
        return events;
    }

    /** Entities in insertion order; caller must hold the lock. */
    public List<TrackedEntity> snapshotEntities() {
        return new ArrayList<>(entities.values());
    }
}
