package com.tracegroup.engine.logging;

import com.tracegroup.engine.pipeline.StageId;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * MDC helper so that every log line of a grouping run carries the trace and stage it belongs to.
 *
 * Usage:
 * <pre>
 * try (var ctx = GroupingLoggingContext.forTrace(trace.name())) {
 *     log.info("Grouping trace"); // includes traceName and runId
 * }
 * </pre>
 *
 * Contexts nest. Closing one restores the values its keys had when it was opened.
 */
public final class GroupingLoggingContext implements AutoCloseable {

    public static final String TRACE_NAME = "traceName";
    public static final String STAGE = "stage";
    public static final String RUN_ID = "runId";

    private final Map<String, String> previousValues = new LinkedHashMap<>();

    private GroupingLoggingContext() {
    }

    /**
     * Context for a whole grouping run over one trace.
     */
    public static GroupingLoggingContext forTrace(String traceName) {
        GroupingLoggingContext ctx = new GroupingLoggingContext();
        if (traceName != null) {
            ctx.put(TRACE_NAME, traceName);
        }
        if (MDC.get(RUN_ID) == null) {
            ctx.put(RUN_ID, UUID.randomUUID().toString().substring(0, 8));
        }
        return ctx;
    }

    /**
     * Context for a single pipeline stage.
     */
    public static GroupingLoggingContext forStage(StageId stage) {
        GroupingLoggingContext ctx = new GroupingLoggingContext();
        if (stage != null) {
            ctx.put(STAGE, stage.name());
        }
        return ctx;
    }

    public static String getTraceName() {
        return MDC.get(TRACE_NAME);
    }

    public static String getStage() {
        return MDC.get(STAGE);
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    private void put(String key, String value) {
        if (!previousValues.containsKey(key)) {
            previousValues.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        List<String> keys = new ArrayList<>(previousValues.keySet());
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(keys.get(i));
            if (previous == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), previous);
            }
        }
        previousValues.clear();
    }
}
