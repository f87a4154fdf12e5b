package com.tracegroup.engine.pipeline;

import com.tracegroup.engine.config.GroupingOptions;
import com.tracegroup.engine.connect.ContextConnector;
import com.tracegroup.engine.connect.InterTimelineConnector;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.IntraTimelineNester;
import com.tracegroup.engine.group.GroupAssembler;
import com.tracegroup.engine.group.SelectedGroupAnnotator;
import com.tracegroup.engine.heuristic.EagerExecutionMarker;
import com.tracegroup.engine.heuristic.LoopIterationDetector;
import com.tracegroup.engine.heuristic.ModelIdTagger;
import com.tracegroup.engine.heuristic.WorkerGroupMerger;

import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Factory for the standard stages.
 */
public final class GroupingStages {

    private GroupingStages() {
    }

    /**
     * The full pipeline in its default order.
     */
    public static List<GroupingStage> defaults(GroupingOptions options) {
        return List.of(
            nest(),
            connectRules(options),
            connectContexts(options),
            detectLoops(options),
            markEagerGpu(options),
            markEagerCpu(options),
            assembleGroups(options),
            mergeWorkers(options),
            tagModelIds(options),
            selectGroupIds()
        );
    }

    public static GroupingStage nest() {
        IntraTimelineNester nester = new IntraTimelineNester();
        return stage(StageId.NEST, Set.of(), Set.of(), nester::nest);
    }

    public static GroupingStage connectRules(GroupingOptions options) {
        InterTimelineConnector connector = new InterTimelineConnector(options.connectRules());
        return stage(StageId.CONNECT_RULES, Set.of(StageId.NEST), Set.of(), connector::connect);
    }

    /**
     * Every context kind except the data pipeline, which has its own entry point.
     */
    public static GroupingStage connectContexts(GroupingOptions options) {
        ContextConnector connector = new ContextConnector();
        return stage(StageId.CONNECT_CONTEXTS, Set.of(StageId.NEST), Set.of(),
            forest -> connector.connectAllExcept(forest, options.dataPipelineContext()));
    }

    public static GroupingStage detectLoops(GroupingOptions options) {
        LoopIterationDetector detector = new LoopIterationDetector(
            options.loopExecutorType(), options.loopStepStat(), options.loopIterationStat());
        return stage(StageId.DETECT_LOOPS, Set.of(StageId.NEST),
            Set.of(StageId.CONNECT_RULES, StageId.CONNECT_CONTEXTS), detector::detect);
    }

    public static GroupingStage markEagerGpu(GroupingOptions options) {
        EagerExecutionMarker marker = eagerMarker(options);
        return stage(StageId.MARK_EAGER_GPU, Set.of(StageId.NEST),
            Set.of(StageId.CONNECT_RULES, StageId.CONNECT_CONTEXTS), marker::markGpuKernels);
    }

    public static GroupingStage markEagerCpu(GroupingOptions options) {
        EagerExecutionMarker marker = eagerMarker(options);
        return stage(StageId.MARK_EAGER_CPU, Set.of(StageId.NEST),
            Set.of(StageId.CONNECT_RULES, StageId.CONNECT_CONTEXTS), marker::markCpuOps);
    }

    public static GroupingStage assembleGroups(GroupingOptions options) {
        GroupAssembler assembler = new GroupAssembler(options.rootEventTypes());
        return stage(StageId.ASSEMBLE_GROUPS, Set.of(StageId.NEST),
            Set.of(StageId.CONNECT_RULES, StageId.CONNECT_CONTEXTS, StageId.DETECT_LOOPS), assembler::assemble);
    }

    public static GroupingStage mergeWorkers(GroupingOptions options) {
        WorkerGroupMerger merger = new WorkerGroupMerger(options.eagerExecuteType(), options.functionRunType());
        return stage(StageId.MERGE_WORKERS, Set.of(StageId.ASSEMBLE_GROUPS), Set.of(), merger::merge);
    }

    public static GroupingStage tagModelIds(GroupingOptions options) {
        ModelIdTagger tagger = new ModelIdTagger(options.modelIdStat());
        return stage(StageId.TAG_MODEL_IDS, Set.of(StageId.ASSEMBLE_GROUPS), Set.of(StageId.MERGE_WORKERS),
            tagger::tag);
    }

    public static GroupingStage selectGroupIds() {
        SelectedGroupAnnotator annotator = new SelectedGroupAnnotator();
        return stage(StageId.SELECT_GROUP_IDS, Set.of(StageId.ASSEMBLE_GROUPS), Set.of(StageId.MERGE_WORKERS),
            annotator::annotate);
    }

    private static EagerExecutionMarker eagerMarker(GroupingOptions options) {
        return new EagerExecutionMarker(
            options.executorType(), options.eagerExecuteType(), options.opType(), options.kernelLaunchType());
    }

    public static GroupingStage stage(StageId id, Set<StageId> prerequisites, Set<StageId> runsAfter,
                                      ToIntFunction<EventForest> pass) {
        return new FunctionalStage(id, prerequisites, runsAfter, pass);
    }

    private record FunctionalStage(
        StageId id,
        Set<StageId> prerequisites,
        Set<StageId> runsAfter,
        ToIntFunction<EventForest> pass
    ) implements GroupingStage {

        @Override
        public int apply(EventForest forest) {
            return pass.applyAsInt(forest);
        }
    }
}
