package com.tracegroup.engine.pipeline;

/**
 * Stages of the grouping pipeline. All but the last are listed in their default order;
 * the data pipeline connection runs separately, after grouping.
 */
public enum StageId {
    NEST,
    CONNECT_RULES,
    CONNECT_CONTEXTS,
    DETECT_LOOPS,
    MARK_EAGER_GPU,
    MARK_EAGER_CPU,
    ASSEMBLE_GROUPS,
    MERGE_WORKERS,
    TAG_MODEL_IDS,
    SELECT_GROUP_IDS,
    CONNECT_DATA_PIPELINE
}
