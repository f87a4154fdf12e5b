package com.tracegroup.engine.pipeline;

import com.tracegroup.engine.forest.EventForest;

import java.util.Set;

/**
 * One pass of the grouping pipeline.
 */
public interface GroupingStage {

    StageId id();

    /**
     * Stages that must have run before this one.
     */
    default Set<StageId> prerequisites() {
        return Set.of();
    }

    /**
     * Stages that, when present in the pipeline, must run before this one.
     */
    default Set<StageId> runsAfter() {
        return Set.of();
    }

    /**
     * Apply the pass to the forest.
     *
     * @return number of edges, assignments or annotations the pass produced
     */
    int apply(EventForest forest);
}
