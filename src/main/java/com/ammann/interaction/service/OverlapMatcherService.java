/* (C)2026 */
package com.ammann.interaction.service;

import com.ammann.interaction.exception.SlotMatchingException;
import com.ammann.interaction.model.BoundingBox;
import com.ammann.interaction.model.CandidateMatch;
import com.ammann.interaction.model.InteractionTemplate;
import com.ammann.interaction.model.OverlapPair;
import com.ammann.interaction.model.TrackedEntity;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Finds the interactions evidenced by one snapshot of tracked entities.
 *
 * <p>Matching runs in three steps:
 * <ol>
 *   <li>pairwise overlap: intersection over the smaller area (IoS) for every unordered
 *       pair of entities; pairs that do not intersect are dropped</li>
 *   <li>threshold: per template, pairs with {@code ios >= overlapThreshold}</li>
 *   <li>slot matching: every assignment of the pair's members to the template's slots in
 *       which each member's best label is accepted by its slot</li>
 * </ol>
 *
 * <p>Only pairs are ever matched, so a template with more than two slots never produces a
 * candidate. The service never mutates the entities it is given.
 */
@ApplicationScoped
public class OverlapMatcherService
{
    private static final Logger LOG = Logger.getLogger(OverlapMatcherService.class);

    /** Deepest slot recursion allowed before matching is aborted as a configuration error. */
    public static final int MAX_SLOT_DEPTH = 8;

    /**
     * Computes the overlap of every intersecting unordered pair.
     *
     * @param entities snapshot of one context; entities without a box are ignored
     * @return intersecting pairs with {@code first < second}, in snapshot order
     */
    public List<OverlapPair> computeOverlaps(List<TrackedEntity> entities)
    {
        List<OverlapPair> pairs = new ArrayList<>();
        for (int i = 0; i < entities.size(); i++) {
            BoundingBox first = entities.get(i).getLastBox();
            if (first == null) {
                continue;
            }
            for (int j = i + 1; j < entities.size(); j++) {
                BoundingBox second = entities.get(j).getLastBox();
                if (second == null) {
                    continue;
                }
                double ratio = first.overlapOnSmaller(second);
                if (ratio > 0.0) {
                    pairs.add(new OverlapPair(i, j, ratio));
                }
            }
        }
        return pairs;
    }

    /**
     * Finds every candidate match of every template in the snapshot.
     *
     * @param entities  snapshot of one context
     * @param templates templates to evaluate, in evaluation order
     * @return all candidate matches; the same label sequence may appear more than once
     * @throws SlotMatchingException if a template exceeds the slot recursion limit
     */
    public List<CandidateMatch> findMatches(
            List<TrackedEntity> entities, Collection<InteractionTemplate> templates)
    {
        List<OverlapPair> pairs = computeOverlaps(entities);
        List<CandidateMatch> matches = new ArrayList<>();
        if (pairs.isEmpty()) {
            return matches;
        }

        for (InteractionTemplate template : templates) {
            for (OverlapPair pair : pairs) {
                if (pair.ratio() < template.overlapThreshold()) {
                    continue;
                }
                List<TrackedEntity> members =
                        List.of(entities.get(pair.first()), entities.get(pair.second()));
                List<String> labels = members.stream().map(TrackedEntity::getBestLabel).toList();

                for (int[] assignment : assignSlots(template.name(), labels, template.slots())) {
                    List<String> slotLabels = new ArrayList<>(assignment.length);
                    List<String> entityIds = new ArrayList<>(assignment.length);
                    for (int memberIndex : assignment) {
                        slotLabels.add(labels.get(memberIndex));
                        entityIds.add(members.get(memberIndex).getId());
                    }
                    matches.add(new CandidateMatch(
                            template.name(), slotLabels, entityIds, pair.ratio()));
                }
            }
        }

        LOG.debugf("Matched %d candidates from %d entities and %d overlapping pairs",
                matches.size(), entities.size(), pairs.size());
        return matches;
    }

    /**
     * Enumerates every assignment of members to slots in which each slot receives exactly
     * one member whose label it accepts and every member is used exactly once.
     *
     * @param template     template name, for error reporting
     * @param memberLabels best label of each member; {@code null} labels match no slot
     * @param slots        acceptable labels per slot
     * @return member indices in slot order, one array per valid assignment
     * @throws SlotMatchingException if the recursion would exceed {@link #MAX_SLOT_DEPTH}
     */
    List<int[]> assignSlots(String template, List<String> memberLabels, List<Set<String>> slots)
    {
        List<int[]> assignments = new ArrayList<>();
        if (memberLabels.size() != slots.size()) {
            return assignments;
        }
        assign(template, memberLabels, slots, 0, new boolean[memberLabels.size()],
                new int[slots.size()], assignments);
        return assignments;
    }

    private void assign(
            String template,
            List<String> memberLabels,
            List<Set<String>> slots,
            int slotIndex,
            boolean[] used,
            int[] current,
            List<int[]> assignments)
    {
        if (slotIndex > MAX_SLOT_DEPTH) {
            throw new SlotMatchingException(template, slotIndex, MAX_SLOT_DEPTH);
        }
        if (slotIndex == slots.size()) {
            assignments.add(current.clone());
            return;
        }

        Set<String> accepted = slots.get(slotIndex);
        for (int member = 0; member < memberLabels.size(); member++) {
            String label = memberLabels.get(member);
            if (used[member] || label == null || !accepted.contains(label)) {
                continue;
            }
            used[member] = true;
            current[slotIndex] = member;
            assign(template, memberLabels, slots, slotIndex + 1, used, current, assignments);
            used[member] = false;
        }
    }
}
