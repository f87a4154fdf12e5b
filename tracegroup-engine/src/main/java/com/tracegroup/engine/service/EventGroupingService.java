package com.tracegroup.engine.service;

import com.tracegroup.core.trace.Trace;
import com.tracegroup.engine.config.GroupingOptions;
import com.tracegroup.engine.connect.DataPipelineConnector;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.logging.GroupingLoggingContext;
import com.tracegroup.engine.metrics.GroupingMetrics;
import com.tracegroup.engine.pipeline.GroupingPipeline;
import com.tracegroup.engine.pipeline.StageId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Entry point for grouping traces.
 *
 * Each call builds a fresh forest over the given trace, so one service instance can be reused
 * for any number of traces. Stats written by the pipeline land on the trace's own events.
 */
public class EventGroupingService {

    private static final Logger log = LoggerFactory.getLogger(EventGroupingService.class);

    private final GroupingOptions options;
    private final GroupingMetrics metrics;
    private final GroupingPipeline pipeline;
    private final DataPipelineConnector dataPipelineConnector;

    public EventGroupingService(GroupingOptions options, GroupingMetrics metrics) {
        this(options, metrics, GroupingPipeline.defaults(options, metrics));
    }

    public EventGroupingService(GroupingOptions options, GroupingMetrics metrics, GroupingPipeline pipeline) {
        this.options = options;
        this.metrics = metrics;
        this.pipeline = pipeline;
        this.dataPipelineConnector = new DataPipelineConnector(options.dataPipelineContext());
    }

    public GroupingOptions options() {
        return options;
    }

    /**
     * Connect, group and annotate every event of the trace.
     *
     * @throws com.tracegroup.core.exception.InvalidTraceException if the trace is malformed
     */
    public GroupingResult group(Trace trace) {
        EventForest forest = new EventForest(trace);
        try (GroupingLoggingContext ctx = GroupingLoggingContext.forTrace(trace.name())) {
            log.info("Grouping trace {} with {} events", trace.name(), forest.nodes().size());

            GroupingResult result = new GroupingResult(forest, pipeline.run(forest));
            metrics.traceGrouped(forest.nodes().size(), result.groupCount(), result.ungroupedCount());

            log.info("Grouped trace {}: {} groups, {} events ungrouped",
                trace.name(), result.groupCount(), result.ungroupedCount());
            return result;
        }
    }

    /**
     * Group the trace, then link the producers and consumers of its input data pipeline.
     */
    public GroupingResult groupAndConnectDataPipeline(Trace trace) {
        GroupingResult result = group(trace);
        connectDataPipeline(result.forest());
        return result;
    }

    /**
     * Link data pipeline producers and consumers in a forest, grouped or not.
     *
     * @return number of edges added
     */
    public int connectDataPipeline(EventForest forest) {
        try (GroupingLoggingContext ctx = GroupingLoggingContext.forTrace(forest.trace().name());
             GroupingLoggingContext stageCtx = GroupingLoggingContext.forStage(StageId.CONNECT_DATA_PIPELINE)) {
            long startNanos = System.nanoTime();
            int edges = dataPipelineConnector.connect(forest);
            metrics.stageCompleted(StageId.CONNECT_DATA_PIPELINE,
                Duration.ofNanos(System.nanoTime() - startNanos), edges);
            return edges;
        }
    }
}
