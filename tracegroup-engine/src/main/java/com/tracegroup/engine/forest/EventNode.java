package com.tracegroup.engine.forest;

import com.tracegroup.core.model.ContextType;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.core.trace.TraceEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Graph wrapper around one trace event.
 *
 * Nodes live in the arena of an {@link EventForest} and refer to each other by arena index.
 * Edges are only added through {@link EventForest#addChild}, which keeps both directions in step.
 */
public class EventNode {

    private final int index;
    private final long timelineId;
    private final TraceEvent event;

    private final List<Integer> parentIndexes = new ArrayList<>();
    private final List<Integer> childIndexes = new ArrayList<>();

    private final ContextInfo producerContext;
    private final ContextInfo consumerContext;
    private final boolean async;

    private Long groupId;
    private boolean root;
    private boolean eager;
    private SortedSet<Long> selectedGroupIds = Collections.emptySortedSet();

    EventNode(int index, long timelineId, TraceEvent event) {
        this.index = index;
        this.timelineId = timelineId;
        this.event = event;
        this.producerContext = readContext(event, StatType.PRODUCER_TYPE, StatType.PRODUCER_ID);
        this.consumerContext = readContext(event, StatType.CONSUMER_TYPE, StatType.CONSUMER_ID);
        this.root = event.stat(StatType.IS_ROOT).map(StatValue::isTrue).orElse(false);
        this.async = event.stat(StatType.IS_ASYNC).map(StatValue::isTrue).orElse(false);
    }

    private static ContextInfo readContext(TraceEvent event, StatType typeStat, StatType idStat) {
        Optional<StatValue> type = event.stat(typeStat).filter(StatValue::isIntegral);
        Optional<StatValue> id = event.stat(idStat).filter(StatValue::isIntegral);
        if (type.isEmpty() || id.isEmpty()) {
            return null;
        }
        return ContextType.fromCode(type.get().intOrUintValue())
            .map(contextType -> new ContextInfo(contextType, id.get().intOrUintValue()))
            .orElse(null);
    }

    // ========== Identity ==========

    public int index() {
        return index;
    }

    public long timelineId() {
        return timelineId;
    }

    public TraceEvent event() {
        return event;
    }

    public String name() {
        return event.name();
    }

    public HostEventType type() {
        return event.type();
    }

    public long startPs() {
        return event.startPs();
    }

    public long endPs() {
        return event.endPs();
    }

    public boolean startsBefore(EventNode other) {
        return event.startPs() < other.event.startPs();
    }

    // ========== Links ==========

    public List<Integer> parentIndexes() {
        return Collections.unmodifiableList(parentIndexes);
    }

    public List<Integer> childIndexes() {
        return Collections.unmodifiableList(childIndexes);
    }

    boolean hasChild(int childIndex) {
        return childIndexes.contains(childIndex);
    }

    void linkChild(EventNode child) {
        childIndexes.add(child.index);
        child.parentIndexes.add(index);
    }

    // ========== Context ==========

    public Optional<ContextInfo> producerContext() {
        return Optional.ofNullable(producerContext);
    }

    public Optional<ContextInfo> consumerContext() {
        return Optional.ofNullable(consumerContext);
    }

    // ========== Grouping state ==========

    public Optional<Long> groupId() {
        return Optional.ofNullable(groupId);
    }

    public boolean hasGroup() {
        return groupId != null;
    }

    /**
     * Set the group and persist it on the event.
     */
    public void setGroupId(long groupId) {
        this.groupId = groupId;
        event.setStat(StatType.GROUP_ID, StatValue.ofInt(groupId));
    }

    public boolean isRoot() {
        return root;
    }

    public void setRoot(boolean root) {
        this.root = root;
    }

    public boolean isAsync() {
        return async;
    }

    public boolean isEager() {
        return eager;
    }

    /**
     * Set the eager flag and persist it on the event.
     */
    public void setEager(boolean eager) {
        this.eager = eager;
        event.setStat(StatType.IS_EAGER, StatValue.ofBoolean(eager));
    }

    public Optional<String> stepName() {
        return event.stat(StatType.STEP_NAME).map(StatValue::asString);
    }

    public void setStepName(String stepName) {
        event.setStat(StatType.STEP_NAME, StatValue.ofString(stepName));
    }

    public SortedSet<Long> selectedGroupIds() {
        return selectedGroupIds;
    }

    /**
     * Replace the selected group ids and persist them as a comma separated list.
     */
    public void setSelectedGroupIds(SortedSet<Long> groupIds) {
        this.selectedGroupIds = Collections.unmodifiableSortedSet(new TreeSet<>(groupIds));
        StringBuilder joined = new StringBuilder();
        for (Long id : selectedGroupIds) {
            if (joined.length() > 0) {
                joined.append(',');
            }
            joined.append(id);
        }
        event.setStat(StatType.SELECTED_GROUP_IDS, StatValue.ofString(joined.toString()));
    }

    @Override
    public String toString() {
        return "EventNode{" + index + ":" + event.name() + "@" + timelineId
            + (groupId != null ? ", group=" + groupId : "") + "}";
    }
}
