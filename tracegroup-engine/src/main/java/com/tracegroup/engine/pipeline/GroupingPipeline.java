package com.tracegroup.engine.pipeline;

import com.tracegroup.core.exception.PipelineConfigurationException;
import com.tracegroup.engine.config.GroupingOptions;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.logging.GroupingLoggingContext;
import com.tracegroup.engine.metrics.GroupingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs grouping stages over a forest in a fixed order.
 *
 * The order is checked once, at construction: every prerequisite of a stage must appear
 * before it, every stage it runs after must appear before it if present at all, and no stage
 * may appear twice. Stages then run strictly one after another.
 */
public class GroupingPipeline {

    private static final Logger log = LoggerFactory.getLogger(GroupingPipeline.class);

    private final List<GroupingStage> stages;
    private final GroupingMetrics metrics;

    public GroupingPipeline(List<GroupingStage> stages, GroupingMetrics metrics) {
        validateOrder(stages);
        this.stages = List.copyOf(stages);
        this.metrics = metrics;
    }

    public static GroupingPipeline defaults(GroupingOptions options, GroupingMetrics metrics) {
        return new GroupingPipeline(GroupingStages.defaults(options), metrics);
    }

    private static void validateOrder(List<GroupingStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new PipelineConfigurationException("stages", "cannot be empty");
        }
        Set<StageId> present = EnumSet.noneOf(StageId.class);
        for (GroupingStage stage : stages) {
            if (!present.add(stage.id())) {
                throw new PipelineConfigurationException("stages", "duplicate stage " + stage.id());
            }
        }
        Set<StageId> completed = EnumSet.noneOf(StageId.class);
        for (GroupingStage stage : stages) {
            for (StageId prerequisite : stage.prerequisites()) {
                if (!completed.contains(prerequisite)) {
                    throw new PipelineConfigurationException("stages",
                        stage.id() + " requires " + prerequisite + " to run before it");
                }
            }
            for (StageId earlier : stage.runsAfter()) {
                if (present.contains(earlier) && !completed.contains(earlier)) {
                    throw new PipelineConfigurationException("stages",
                        stage.id() + " must run after " + earlier);
                }
            }
            completed.add(stage.id());
        }
    }

    public List<StageId> stageIds() {
        List<StageId> ids = new ArrayList<>(stages.size());
        for (GroupingStage stage : stages) {
            ids.add(stage.id());
        }
        return ids;
    }

    /**
     * Run every stage in order.
     *
     * @return per stage, the number of changes it made, in run order
     */
    public Map<StageId, Integer> run(EventForest forest) {
        Map<StageId, Integer> changes = new LinkedHashMap<>();
        try (GroupingLoggingContext traceContext = GroupingLoggingContext.forTrace(forest.trace().name())) {
            for (GroupingStage stage : stages) {
                try (GroupingLoggingContext stageContext = GroupingLoggingContext.forStage(stage.id())) {
                    long startNanos = System.nanoTime();
                    int changed = stage.apply(forest);
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    changes.put(stage.id(), changed);
                    metrics.stageCompleted(stage.id(), elapsed, changed);
                    log.debug("Stage {} finished in {} ms with {} changes",
                        stage.id(), elapsed.toMillis(), changed);
                }
            }
        }
        return Collections.unmodifiableMap(changes);
    }
}
