package com.tracegroup.engine.metrics;

import com.tracegroup.engine.pipeline.StageId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Metrics for grouping runs.
 *
 * Metrics exposed:
 * - Stage duration and change counts, tagged by stage
 * - Events processed, groups created and events left ungrouped
 *
 * Until bound to a registry, meters are recorded in a private {@link SimpleMeterRegistry}.
 */
public class GroupingMetrics implements MeterBinder {

    public static final String STAGE_DURATION = "tracegroup.stage.duration";
    public static final String STAGE_CHANGES = "tracegroup.stage.changes";
    public static final String TRACES_GROUPED = "tracegroup.traces.grouped";
    public static final String EVENTS_PROCESSED = "tracegroup.events.processed";
    public static final String GROUPS_CREATED = "tracegroup.groups.created";
    public static final String EVENTS_UNGROUPED = "tracegroup.events.ungrouped";

    private MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Stage Metrics ==========

    public void stageCompleted(StageId stage, Duration elapsed, int changes) {
        Timer.builder(STAGE_DURATION)
            .tag("stage", stage.name())
            .description("Grouping stage duration")
            .register(registry)
            .record(elapsed);

        Counter.builder(STAGE_CHANGES)
            .tag("stage", stage.name())
            .description("Edges, assignments and annotations made by a grouping stage")
            .register(registry)
            .increment(changes);
    }

    // ========== Trace Metrics ==========

    public void traceGrouped(int events, int groups, int ungrouped) {
        Counter.builder(TRACES_GROUPED)
            .description("Total traces grouped")
            .register(registry)
            .increment();

        Counter.builder(EVENTS_PROCESSED)
            .description("Total events processed")
            .register(registry)
            .increment(events);

        Counter.builder(GROUPS_CREATED)
            .description("Total groups created")
            .register(registry)
            .increment(groups);

        Counter.builder(EVENTS_UNGROUPED)
            .description("Total events left without a group")
            .register(registry)
            .increment(ungrouped);
    }
}
