package com.tracegroup.engine.forest;

import com.tracegroup.core.exception.InvalidTraceException;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.core.trace.Timeline;
import com.tracegroup.core.trace.Trace;
import com.tracegroup.core.trace.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Owns one node per trace event and the group metadata built over them.
 *
 * Nodes are stored in an arena and addressed by index. Within a timeline, nodes are created in
 * nesting order (start ascending, longer first), and timelines follow the trace's order. This
 * arena order is the discovery order used for every deterministic tie-break.
 *
 * Not thread-safe. The trace must not be mutated by anyone else while passes run.
 */
public class EventForest {

    private static final Logger log = LoggerFactory.getLogger(EventForest.class);

    private final Trace trace;
    private final List<EventNode> nodes = new ArrayList<>();
    private final Map<Long, List<EventNode>> nodesByTimeline = new LinkedHashMap<>();
    private final Map<HostEventType, List<EventNode>> nodesByType = new EnumMap<>(HostEventType.class);

    private final SortedMap<Long, GroupMetadata> groupMetadata = new TreeMap<>();
    private final Map<Long, EventNode> groupRoots = new TreeMap<>();
    private final List<EventNode> loopRoots = new ArrayList<>();
    private long nextGroupId = 0;

    /**
     * Create a node for every event of the trace. No edges are added yet.
     *
     * @throws InvalidTraceException if the trace is structurally unusable
     */
    public EventForest(Trace trace) {
        validate(trace);
        this.trace = trace;
        for (Timeline timeline : trace.timelines()) {
            List<TraceEvent> ordered = new ArrayList<>(timeline.events());
            ordered.sort(IntraTimelineNester.NESTING_ORDER);
            List<EventNode> timelineNodes = new ArrayList<>(ordered.size());
            for (TraceEvent event : ordered) {
                EventNode node = new EventNode(nodes.size(), timeline.id(), event);
                nodes.add(node);
                timelineNodes.add(node);
                nodesByType.computeIfAbsent(event.type(), t -> new ArrayList<>()).add(node);
            }
            nodesByTimeline.put(timeline.id(), timelineNodes);
        }
        log.debug("Created {} event nodes over {} timelines for trace {}",
            nodes.size(), nodesByTimeline.size(), trace.name());
    }

    private static void validate(Trace trace) {
        if (trace == null) {
            throw new InvalidTraceException("trace", "must not be null");
        }
        if (trace.timelines() == null) {
            throw new InvalidTraceException("trace.timelines", "must not be null");
        }
        Set<Long> timelineIds = new HashSet<>();
        for (Timeline timeline : trace.timelines()) {
            if (timeline == null) {
                throw new InvalidTraceException("trace.timelines", "contains a null timeline");
            }
            if (!timelineIds.add(timeline.id())) {
                throw new InvalidTraceException("timeline " + timeline.id(), "duplicate timeline id");
            }
            if (timeline.events() == null) {
                throw new InvalidTraceException("timeline " + timeline.id(), "events must not be null");
            }
            for (TraceEvent event : timeline.events()) {
                if (event == null) {
                    throw new InvalidTraceException("timeline " + timeline.id(), "contains a null event");
                }
                if (event.type() == null) {
                    throw new InvalidTraceException("event " + event.name(), "type must not be null");
                }
                if (event.startPs() < 0 || event.durationPs() < 0) {
                    throw new InvalidTraceException("event " + event.name(), String.format(
                        "negative time span (start=%d, duration=%d)", event.startPs(), event.durationPs()));
                }
                if (event.durationPs() > Long.MAX_VALUE - event.startPs()) {
                    throw new InvalidTraceException("event " + event.name(), String.format(
                        "end of time span overflows (start=%d, duration=%d)", event.startPs(), event.durationPs()));
                }
            }
        }
    }

    // ========== Nodes ==========

    public Trace trace() {
        return trace;
    }

    /**
     * All nodes in discovery order.
     */
    public List<EventNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public EventNode node(int index) {
        return nodes.get(index);
    }

    public List<EventNode> nodesOfType(HostEventType type) {
        return Collections.unmodifiableList(nodesByType.getOrDefault(type, List.of()));
    }

    public List<Long> timelineIds() {
        return List.copyOf(nodesByTimeline.keySet());
    }

    /**
     * Nodes of one timeline in nesting order.
     */
    public List<EventNode> timelineNodes(long timelineId) {
        return Collections.unmodifiableList(nodesByTimeline.getOrDefault(timelineId, List.of()));
    }

    // ========== Edges ==========

    /**
     * Link parent to child. Existing edges and self edges are ignored.
     *
     * @return true if a new edge was added
     */
    public boolean addChild(EventNode parent, EventNode child) {
        if (parent.index() == child.index() || parent.hasChild(child.index())) {
            return false;
        }
        parent.linkChild(child);
        return true;
    }

    public List<EventNode> parentsOf(EventNode node) {
        return resolve(node.parentIndexes());
    }

    public List<EventNode> childrenOf(EventNode node) {
        return resolve(node.childIndexes());
    }

    private List<EventNode> resolve(List<Integer> indexes) {
        List<EventNode> resolved = new ArrayList<>(indexes.size());
        for (int index : indexes) {
            resolved.add(nodes.get(index));
        }
        return resolved;
    }

    /**
     * Closest node, the node itself included, of the given type, searching parents breadth first.
     */
    public Optional<EventNode> findParent(EventNode node, HostEventType type) {
        return findAncestorOrSelf(node, candidate -> candidate.type() == type);
    }

    public Optional<EventNode> findAncestorOrSelf(EventNode node, Predicate<EventNode> predicate) {
        Queue<EventNode> queue = new ArrayDeque<>();
        Set<Integer> seen = new HashSet<>();
        queue.add(node);
        seen.add(node.index());
        while (!queue.isEmpty()) {
            EventNode current = queue.poll();
            if (predicate.test(current)) {
                return Optional.of(current);
            }
            for (int parentIndex : current.parentIndexes()) {
                if (seen.add(parentIndex)) {
                    queue.add(nodes.get(parentIndex));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Stat of the node, or of its closest ancestor carrying it.
     */
    public Optional<StatValue> contextStat(EventNode node, StatType statType) {
        return findAncestorOrSelf(node, candidate -> candidate.event().stat(statType).isPresent())
            .flatMap(found -> found.event().stat(statType));
    }

    // ========== Groups ==========

    /**
     * Allocate the next group id and create its metadata entry.
     */
    public long allocateGroup(EventNode root) {
        long groupId = nextGroupId++;
        groupMetadata.put(groupId, new GroupMetadata(groupId));
        groupRoots.put(groupId, root);
        return groupId;
    }

    public SortedMap<Long, GroupMetadata> groupMetadataMap() {
        return Collections.unmodifiableSortedMap(groupMetadata);
    }

    public GroupMetadata groupMetadata(long groupId) {
        GroupMetadata metadata = groupMetadata.get(groupId);
        if (metadata == null) {
            throw new IllegalArgumentException("Unknown group id: " + groupId);
        }
        return metadata;
    }

    public Optional<EventNode> groupRoot(long groupId) {
        return Optional.ofNullable(groupRoots.get(groupId));
    }

    /**
     * Record that parentGroupId reaches childGroupId, in both directions.
     */
    public void relateGroups(long parentGroupId, long childGroupId) {
        if (parentGroupId == childGroupId) {
            return;
        }
        groupMetadata(parentGroupId).addChild(childGroupId);
        groupMetadata(childGroupId).addParent(parentGroupId);
    }

    /**
     * Unlink a group whose members all moved elsewhere. Its metadata entry stays, with no
     * relationships and no root, and no other group refers to it any more.
     */
    public void detachGroup(long groupId) {
        GroupMetadata metadata = groupMetadata(groupId);
        for (long parent : metadata.parents()) {
            groupMetadata(parent).removeChild(groupId);
        }
        for (long child : metadata.children()) {
            groupMetadata(child).removeParent(groupId);
        }
        metadata.clearRelationships();
        groupRoots.remove(groupId);
    }

    public List<EventNode> groupMembers(long groupId) {
        List<EventNode> members = new ArrayList<>();
        for (EventNode node : nodes) {
            if (node.groupId().filter(id -> id == groupId).isPresent()) {
                members.add(node);
            }
        }
        return members;
    }

    // ========== Loop roots ==========

    public void addLoopRoot(EventNode node) {
        node.setRoot(true);
        loopRoots.add(node);
    }

    public List<EventNode> loopRoots() {
        return Collections.unmodifiableList(loopRoots);
    }
}
