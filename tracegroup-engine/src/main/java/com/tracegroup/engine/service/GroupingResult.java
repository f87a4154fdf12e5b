package com.tracegroup.engine.service;

import com.tracegroup.core.trace.TraceEvent;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import com.tracegroup.engine.forest.GroupMetadata;
import com.tracegroup.engine.pipeline.StageId;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * Outcome of grouping one trace: the forest and the group metadata built over it.
 */
public record GroupingResult(
    EventForest forest,
    Map<StageId, Integer> stageChanges
) {
    public SortedMap<Long, GroupMetadata> groups() {
        return forest.groupMetadataMap();
    }

    /**
     * Groups that still have members. A group emptied by the worker merge keeps its metadata
     * entry but is not counted.
     */
    public int groupCount() {
        Set<Long> populated = new HashSet<>();
        for (EventNode node : forest.nodes()) {
            node.groupId().ifPresent(populated::add);
        }
        return populated.size();
    }

    public int ungroupedCount() {
        int ungrouped = 0;
        for (EventNode node : forest.nodes()) {
            if (!node.hasGroup()) {
                ungrouped++;
            }
        }
        return ungrouped;
    }

    /**
     * Group of the given event, matched by identity.
     */
    public Optional<Long> groupOf(TraceEvent event) {
        for (EventNode node : forest.nodes()) {
            if (node.event() == event) {
                return node.groupId();
            }
        }
        return Optional.empty();
    }

    public List<EventNode> members(long groupId) {
        return forest.groupMembers(groupId);
    }
}
