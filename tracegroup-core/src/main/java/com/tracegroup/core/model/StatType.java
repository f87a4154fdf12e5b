package com.tracegroup.core.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Semantic types of the stats (typed key-value annotations) attached to events.
 * Some are read by the grouping pipeline, the rest are written back by it.
 */
public enum StatType {
    UNKNOWN(""),

    // Step identification
    STEP_ID("step_id"),
    PARENT_STEP_ID("parent_step_id"),
    ITER_NUM("iter_num"),
    STEP_NUM("step_num"),
    GRAPH_TYPE("graph_type"),
    CORRELATION_ID("correlation_id"),

    // Context propagation
    PRODUCER_TYPE("_pt"),
    PRODUCER_ID("_p"),
    CONSUMER_TYPE("_ct"),
    CONSUMER_ID("_c"),
    IS_ROOT("_r"),
    IS_ASYNC("_a"),

    // Inference
    MODEL_ID("model_id"),

    // Written by the grouping pipeline
    GROUP_ID("group_id"),
    STEP_NAME("step_name"),
    IS_EAGER("is_eager"),
    SELECTED_GROUP_IDS("selected_group_ids");

    private static final Map<String, StatType> BY_STAT_NAME = new HashMap<>();

    static {
        for (StatType type : values()) {
            if (type != UNKNOWN) {
                BY_STAT_NAME.put(type.statName, type);
            }
        }
    }

    private final String statName;

    StatType(String statName) {
        this.statName = statName;
    }

    public String statName() {
        return statName;
    }

    public static StatType fromName(String statName) {
        if (statName == null) {
            return UNKNOWN;
        }
        return BY_STAT_NAME.getOrDefault(statName, UNKNOWN);
    }

    /**
     * Resolve either a constant name ({@code STEP_ID}) or a stat name ({@code step_id}).
     */
    public static StatType parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        for (StatType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return fromName(value);
    }
}
