package com.tracegroup.engine.connect;

import com.tracegroup.core.model.ContextType;
import com.tracegroup.core.trace.InMemoryTrace;
import com.tracegroup.core.trace.InMemoryTraceEvent;
import com.tracegroup.engine.forest.EventForest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tracegroup.engine.test.ForestFixtures.consumer;
import static com.tracegroup.engine.test.ForestFixtures.node;
import static com.tracegroup.engine.test.ForestFixtures.producer;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Context-based cross-timeline connection")
class ContextConnectorTest {

    private final ContextConnector connector = new ContextConnector();

    private InMemoryTrace trace;

    @BeforeEach
    void setUp() {
        trace = new InMemoryTrace("contexts");
    }

    @Test
    @DisplayName("Every producer of a context becomes a parent of every consumer")
    void connect_shouldLinkFullCrossProduct() {
        InMemoryTraceEvent schedule = producer(
            trace.addTimeline(1, "client").addEvent("Schedule", 0, 10), ContextType.SHARED_BATCH_SCHEDULER, 5);
        InMemoryTraceEvent firstBatch = consumer(
            trace.addTimeline(2, "batch-1").addEvent("ProcessBatch", 20, 10), ContextType.SHARED_BATCH_SCHEDULER, 5);
        InMemoryTraceEvent secondBatch = consumer(
            trace.addTimeline(3, "batch-2").addEvent("ProcessBatch", 30, 10), ContextType.SHARED_BATCH_SCHEDULER, 5);
        InMemoryTraceEvent unrelated = consumer(
            trace.addTimeline(4, "batch-3").addEvent("ProcessBatch", 40, 10), ContextType.SHARED_BATCH_SCHEDULER, 6);
        EventForest forest = new EventForest(trace);

        int edges = connector.connectAllExcept(forest, ContextType.DATA_PIPELINE);

        assertThat(edges).isEqualTo(2);
        assertThat(forest.childrenOf(node(forest, schedule)))
            .containsExactly(node(forest, firstBatch), node(forest, secondBatch));
        assertThat(forest.parentsOf(node(forest, unrelated))).isEmpty();
    }

    @Test
    @DisplayName("Contexts of the same id but different kinds do not connect")
    void connect_differentKinds_shouldNotLink() {
        producer(trace.addTimeline(1, "a").addEvent("p", 0, 10), ContextType.GENERIC, 5);
        InMemoryTraceEvent other = consumer(trace.addTimeline(2, "b").addEvent("c", 20, 10), ContextType.GPU_LAUNCH, 5);
        EventForest forest = new EventForest(trace);

        assertThat(connector.connectAllExcept(forest, ContextType.DATA_PIPELINE)).isZero();
        assertThat(forest.parentsOf(node(forest, other))).isEmpty();
    }

    @Test
    @DisplayName("The general pass leaves the data pipeline kind alone")
    void connectAllExcept_shouldSkipExcludedKind() {
        InMemoryTraceEvent produce = producer(
            trace.addTimeline(1, "iterator").addEvent("Prefetch::Produce", 0, 10), ContextType.DATA_PIPELINE, 1);
        InMemoryTraceEvent consume = consumer(
            trace.addTimeline(2, "main").addEvent("Prefetch::Consume", 20, 10), ContextType.DATA_PIPELINE, 1);
        EventForest forest = new EventForest(trace);

        assertThat(connector.connectAllExcept(forest, ContextType.DATA_PIPELINE)).isZero();
        assertThat(connector.connectOnly(forest, ContextType.DATA_PIPELINE)).isEqualTo(1);
        assertThat(forest.parentsOf(node(forest, consume))).containsExactly(node(forest, produce));
    }

    @Test
    @DisplayName("Connecting again adds no duplicate edges")
    void connect_twice_shouldBeIdempotent() {
        producer(trace.addTimeline(1, "a").addEvent("p", 0, 10), ContextType.GENERIC, 5);
        consumer(trace.addTimeline(2, "b").addEvent("c", 20, 10), ContextType.GENERIC, 5);
        EventForest forest = new EventForest(trace);

        assertThat(connector.connectAllExcept(forest, ContextType.DATA_PIPELINE)).isEqualTo(1);
        assertThat(connector.connectAllExcept(forest, ContextType.DATA_PIPELINE)).isZero();
    }
}
