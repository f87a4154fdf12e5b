package com.tracegroup.core.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Semantic types of host and device events recognised by the grouping pipeline.
 * Each constant carries the event name emitted by the profiler.
 * Events whose name is not listed map to {@link #UNKNOWN}.
 */
public enum HostEventType {
    UNKNOWN(""),

    // Step and session roots
    TRACE_CONTEXT("TraceContext"),
    SESSION_RUN("SessionRun"),
    FUNCTION_RUN("FunctionRun"),
    RUN_GRAPH("RunGraph"),
    RUN_GRAPH_DONE("RunGraphDone"),

    // Op execution
    TF_OP_RUN("TfOpRun"),
    EAGER_KERNEL_EXECUTE("EagerKernelExecute"),
    EXECUTOR_STATE_PROCESS("ExecutorState::Process"),
    EXECUTOR_DONE_CALLBACK("ExecutorDoneCallback"),
    PARTITIONED_CALL("PartitionedCall"),

    // Device launches
    KERNEL_LAUNCH("KernelLaunch"),
    KERNEL_EXECUTE("KernelExecute"),
    MEMCPY_H2D("MemcpyH2D"),
    MEMCPY_D2H("MemcpyD2H"),

    // Input pipeline
    ITERATOR_GET_NEXT_OP("IteratorGetNextOp::DoCompute"),
    ITERATOR_GET_NEXT_AS_OPTIONAL_OP("IteratorGetNextAsOptionalOp::DoCompute"),
    ITERATOR("Iterator"),
    PREFETCH_PRODUCE("Prefetch::Produce"),
    PREFETCH_CONSUME("Prefetch::Consume"),
    PARALLEL_MAP_PRODUCE("ParallelMap::Produce"),
    PARALLEL_MAP_CONSUME("ParallelMap::Consume"),

    // Serving
    BATCHING_SESSION_RUN("BatchingSessionRun"),
    PROCESS_BATCH("ProcessBatch"),
    SCHEDULE_WITH_SPLIT("ScheduleWithSplit");

    private static final Map<String, HostEventType> BY_EVENT_NAME = new HashMap<>();

    static {
        for (HostEventType type : values()) {
            if (type != UNKNOWN) {
                BY_EVENT_NAME.put(type.eventName, type);
            }
        }
    }

    private final String eventName;

    HostEventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Name of the event as emitted by the profiler.
     */
    public String eventName() {
        return eventName;
    }

    /**
     * Resolve an event name to its semantic type.
     */
    public static HostEventType fromName(String eventName) {
        if (eventName == null) {
            return UNKNOWN;
        }
        return BY_EVENT_NAME.getOrDefault(eventName, UNKNOWN);
    }

    /**
     * Resolve either a constant name ({@code SESSION_RUN}) or an event name ({@code SessionRun}).
     */
    public static HostEventType parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        for (HostEventType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return fromName(value);
    }
}
