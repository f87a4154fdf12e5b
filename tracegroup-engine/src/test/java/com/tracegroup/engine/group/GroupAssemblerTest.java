package com.tracegroup.engine.group;

import com.tracegroup.core.model.ConnectRule;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.core.trace.InMemoryTimeline;
import com.tracegroup.core.trace.InMemoryTrace;
import com.tracegroup.core.trace.InMemoryTraceEvent;
import com.tracegroup.engine.config.TensorFlowGrouping;
import com.tracegroup.engine.connect.InterTimelineConnector;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import com.tracegroup.engine.forest.GroupMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.tracegroup.engine.test.ForestFixtures.nested;
import static com.tracegroup.engine.test.ForestFixtures.node;
import static com.tracegroup.engine.test.ForestFixtures.persistedGroup;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Group assembly")
class GroupAssemblerTest {

    private final GroupAssembler assembler = new GroupAssembler(TensorFlowGrouping.defaultRootEventTypes());
    private final SelectedGroupAnnotator annotator = new SelectedGroupAnnotator();

    private InMemoryTrace trace;

    @BeforeEach
    void setUp() {
        trace = new InMemoryTrace("groups");
    }

    @Test
    @DisplayName("Nested events under one root form a single group 0")
    void assemble_singleRoot_shouldGroupDescendants() {
        InMemoryTimeline timeline = trace.addTimeline(1, "T");
        InMemoryTraceEvent a = timeline.addEvent(HostEventType.SESSION_RUN, 0, 100);
        InMemoryTraceEvent b = timeline.addEvent("B", 10, 30);
        InMemoryTraceEvent c = timeline.addEvent("C", 50, 40);
        EventForest forest = nested(trace);

        assertEquals(1, assembler.assemble(forest));
        annotator.annotate(forest);

        assertEquals(List.of(node(forest, a)), forest.parentsOf(node(forest, b)));
        assertEquals(List.of(node(forest, a)), forest.parentsOf(node(forest, c)));
        assertEquals(Set.of(0L), forest.groupMetadataMap().keySet());
        for (InMemoryTraceEvent event : List.of(a, b, c)) {
            assertEquals(0L, persistedGroup(event).orElseThrow());
            assertEquals(new TreeSet<>(Set.of(0L)), node(forest, event).selectedGroupIds());
            assertEquals(StatValue.ofString("0"), event.stat(StatType.SELECTED_GROUP_IDS).orElseThrow());
        }
        assertEquals("SessionRun 0", forest.groupMetadata(0).name());
        assertEquals("SessionRun 0", node(forest, a).stepName().orElseThrow());
    }

    @Test
    @DisplayName("A receiver reachable from two roots stays in the first group and the groups are related")
    void assemble_sharedNode_shouldRelateGroups() {
        InMemoryTimeline first = trace.addTimeline(1, "T1");
        InMemoryTimeline second = trace.addTimeline(2, "T2");
        InMemoryTraceEvent firstRoot = first.addEvent(HostEventType.SESSION_RUN, 0, 100);
        first.addEvent(HostEventType.KERNEL_LAUNCH, 10, 10).withStat(StatType.CORRELATION_ID, 7);
        InMemoryTraceEvent secondRoot = second.addEvent(HostEventType.SESSION_RUN, 5, 100);
        InMemoryTraceEvent recv = second.addEvent(HostEventType.KERNEL_EXECUTE, 20, 10)
            .withStat(StatType.CORRELATION_ID, 7);
        EventForest forest = nested(trace);
        new InterTimelineConnector(List.of(ConnectRule.of(
            HostEventType.KERNEL_LAUNCH, HostEventType.KERNEL_EXECUTE, StatType.CORRELATION_ID))).connect(forest);

        assertEquals(2, assembler.assemble(forest));

        assertEquals(0L, persistedGroup(firstRoot).orElseThrow());
        assertEquals(0L, persistedGroup(recv).orElseThrow());
        assertEquals(1L, persistedGroup(secondRoot).orElseThrow());
        assertEquals(Set.of(1L), forest.groupMetadata(0).parents());
        assertEquals(Set.of(0L), forest.groupMetadata(1).children());
        assertTrue(forest.groupMetadata(0).children().isEmpty());
        assertTrue(forest.groupMetadata(1).parents().isEmpty());
    }

    @Test
    @DisplayName("Group ids follow root start times across timelines")
    void assemble_shouldNumberGroupsByRootStart() {
        InMemoryTraceEvent late = trace.addTimeline(1, "T1").addEvent(HostEventType.SESSION_RUN, 200, 10);
        InMemoryTraceEvent early = trace.addTimeline(2, "T2").addEvent(HostEventType.SESSION_RUN, 100, 10);
        EventForest forest = nested(trace);

        assembler.assemble(forest);

        assertEquals(0L, persistedGroup(early).orElseThrow());
        assertEquals(1L, persistedGroup(late).orElseThrow());
    }

    @Test
    @DisplayName("Roots with equal start times are numbered in discovery order")
    void assemble_equalStarts_shouldKeepDiscoveryOrder() {
        InMemoryTraceEvent onFirst = trace.addTimeline(9, "first").addEvent(HostEventType.FUNCTION_RUN, 50, 10);
        InMemoryTraceEvent onSecond = trace.addTimeline(1, "second").addEvent(HostEventType.SESSION_RUN, 50, 10);
        EventForest forest = nested(trace);

        assembler.assemble(forest);

        assertEquals(0L, persistedGroup(onFirst).orElseThrow());
        assertEquals(1L, persistedGroup(onSecond).orElseThrow());
    }

    @Test
    @DisplayName("Events unreachable from any root stay ungrouped")
    void assemble_unreachable_shouldStayUngrouped() {
        trace.addTimeline(1, "T1").addEvent(HostEventType.SESSION_RUN, 0, 10);
        InMemoryTraceEvent stray = trace.addTimeline(2, "T2").addEvent("stray", 0, 10);
        EventForest forest = nested(trace);

        assembler.assemble(forest);
        annotator.annotate(forest);

        assertFalse(node(forest, stray).hasGroup());
        assertTrue(stray.stat(StatType.GROUP_ID).isEmpty());
        assertTrue(stray.stat(StatType.SELECTED_GROUP_IDS).isEmpty());
    }

    @Test
    @DisplayName("Events flagged as root open a group whatever their type")
    void assemble_flaggedRoot_shouldOpenGroup() {
        InMemoryTraceEvent flagged = trace.addTimeline(1, "T1").addEvent("Request", 0, 10)
            .withStat(StatType.IS_ROOT, 1);
        EventForest forest = nested(trace);

        assertEquals(1, assembler.assemble(forest));
        assertEquals(0L, persistedGroup(flagged).orElseThrow());
        assertTrue(node(forest, flagged).isRoot());
    }

    @Test
    @DisplayName("Every node reachable from a root has exactly one group")
    void assemble_shouldCoverReachableNodes() {
        InMemoryTimeline host = trace.addTimeline(1, "host");
        host.addEvent(HostEventType.SESSION_RUN, 0, 1000);
        host.addEvent(HostEventType.EXECUTOR_STATE_PROCESS, 10, 500);
        host.addEvent(HostEventType.TF_OP_RUN, 20, 100);
        host.addEvent(HostEventType.KERNEL_LAUNCH, 30, 10).withStat(StatType.CORRELATION_ID, 1);
        host.addEvent(HostEventType.SESSION_RUN, 2000, 100);
        trace.addTimeline(2, "gpu").addEvent(HostEventType.KERNEL_EXECUTE, 50, 20)
            .withStat(StatType.CORRELATION_ID, 1);
        EventForest forest = nested(trace);
        new InterTimelineConnector(TensorFlowGrouping.defaultConnectRules()).connect(forest);

        assembler.assemble(forest);

        for (EventNode node : forest.nodes()) {
            assertTrue(node.hasGroup(), () -> node + " should be grouped");
        }
        assertEquals(5, forest.groupMembers(0).size());
        assertEquals(1, forest.groupMembers(1).size());
    }

    @Test
    @DisplayName("Assembling twice creates no new groups")
    void assemble_twice_shouldBeIdempotent() {
        InMemoryTimeline host = trace.addTimeline(1, "host");
        host.addEvent(HostEventType.SESSION_RUN, 0, 100);
        host.addEvent("child", 10, 10);
        EventForest forest = nested(trace);

        assertEquals(1, assembler.assemble(forest));
        assertEquals(0, assembler.assemble(forest));
        assertEquals(1, forest.groupMetadataMap().size());
    }

    @Test
    @DisplayName("Group names prefer the step name, then graph type with iteration or step number")
    void groupName_shouldFollowStatPrecedence() {
        InMemoryTimeline host = trace.addTimeline(1, "host");
        InMemoryTraceEvent named = host.addEvent(HostEventType.SESSION_RUN, 0, 10)
            .withStat(StatType.STEP_NAME, "warmup");
        InMemoryTraceEvent iteration = host.addEvent(HostEventType.SESSION_RUN, 20, 10)
            .withStat(StatType.GRAPH_TYPE, "train").withStat(StatType.ITER_NUM, 5).withStat(StatType.STEP_NUM, 9);
        InMemoryTraceEvent step = host.addEvent(HostEventType.SESSION_RUN, 40, 10)
            .withStat(StatType.GRAPH_TYPE, "eval").withStat(StatType.STEP_NUM, 9);
        InMemoryTraceEvent bare = host.addEvent(HostEventType.FUNCTION_RUN, 60, 10);
        EventForest forest = nested(trace);

        assertEquals("warmup", GroupAssembler.groupName(node(forest, named), 0));
        assertEquals("train 5", GroupAssembler.groupName(node(forest, iteration), 1));
        assertEquals("eval 9", GroupAssembler.groupName(node(forest, step), 2));
        assertEquals("FunctionRun 3", GroupAssembler.groupName(node(forest, bare), 3));

        assembler.assemble(forest);
        Map<Long, GroupMetadata> groups = forest.groupMetadataMap();
        assertEquals("warmup", groups.get(0L).name());
        assertEquals("train 5", groups.get(1L).name());
        assertEquals(StatValue.ofString("eval 9"), step.stat(StatType.STEP_NAME).orElseThrow());
    }
}
