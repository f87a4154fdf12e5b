package com.tracegroup.engine.config;

import com.tracegroup.core.model.ConnectRule;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;

import java.util.List;

/**
 * Default grouping configuration for TensorFlow profiles.
 */
public final class TensorFlowGrouping {

    private TensorFlowGrouping() {
    }

    /**
     * Executor iterations feed the iterator ops of the same step and iteration;
     * host kernel launches connect to device kernel executions by correlation id.
     */
    public static List<ConnectRule> defaultConnectRules() {
        return List.of(
            ConnectRule.of(HostEventType.EXECUTOR_STATE_PROCESS, HostEventType.ITERATOR_GET_NEXT_OP,
                StatType.STEP_ID, StatType.ITER_NUM),
            ConnectRule.of(HostEventType.EXECUTOR_STATE_PROCESS, HostEventType.ITERATOR_GET_NEXT_AS_OPTIONAL_OP,
                StatType.STEP_ID, StatType.ITER_NUM),
            ConnectRule.of(HostEventType.KERNEL_LAUNCH, HostEventType.KERNEL_EXECUTE,
                StatType.CORRELATION_ID)
        );
    }

    public static List<HostEventType> defaultRootEventTypes() {
        return List.of(
            HostEventType.TRACE_CONTEXT,
            HostEventType.FUNCTION_RUN,
            HostEventType.SESSION_RUN,
            HostEventType.RUN_GRAPH
        );
    }

    public static GroupingOptions defaultOptions() {
        return GroupingOptions.builder()
            .connectRules(defaultConnectRules())
            .rootEventTypes(defaultRootEventTypes())
            .build();
    }
}
