package com.tracegroup.engine.config;

import com.tracegroup.core.exception.PipelineConfigurationException;
import com.tracegroup.core.model.ConnectRule;
import com.tracegroup.core.model.ContextType;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;

import java.util.List;

/**
 * Configuration of one grouping run. Immutable and reusable across traces.
 *
 * Invariants:
 * - all fields are non-null
 * - loopStepStat != loopIterationStat
 */
public record GroupingOptions(
    // Connection
    List<ConnectRule> connectRules,
    ContextType dataPipelineContext,

    // Roots
    List<HostEventType> rootEventTypes,

    // Loop detection
    HostEventType loopExecutorType,
    StatType loopStepStat,
    StatType loopIterationStat,

    // Eager execution
    HostEventType executorType,
    HostEventType eagerExecuteType,
    HostEventType opType,
    HostEventType kernelLaunchType,

    // Worker merge and inference
    HostEventType functionRunType,
    StatType modelIdStat
) {
    public GroupingOptions {
        connectRules = List.copyOf(require(connectRules, "connectRules"));
        rootEventTypes = List.copyOf(require(rootEventTypes, "rootEventTypes"));
        require(dataPipelineContext, "dataPipelineContext");
        require(loopExecutorType, "loopExecutorType");
        require(loopStepStat, "loopStepStat");
        require(loopIterationStat, "loopIterationStat");
        require(executorType, "executorType");
        require(eagerExecuteType, "eagerExecuteType");
        require(opType, "opType");
        require(kernelLaunchType, "kernelLaunchType");
        require(functionRunType, "functionRunType");
        require(modelIdStat, "modelIdStat");
        if (loopStepStat == loopIterationStat) {
            throw new PipelineConfigurationException("loopIterationStat", "must differ from loopStepStat");
        }
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new PipelineConfigurationException(field, "cannot be null");
        }
        return value;
    }

    public Builder toBuilder() {
        return new Builder()
            .connectRules(connectRules)
            .dataPipelineContext(dataPipelineContext)
            .rootEventTypes(rootEventTypes)
            .loopExecutorType(loopExecutorType)
            .loopStepStat(loopStepStat)
            .loopIterationStat(loopIterationStat)
            .executorType(executorType)
            .eagerExecuteType(eagerExecuteType)
            .opType(opType)
            .kernelLaunchType(kernelLaunchType)
            .functionRunType(functionRunType)
            .modelIdStat(modelIdStat);
    }

    /**
     * Builder with the TensorFlow event and stat types preset, no rules and no root types.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<ConnectRule> connectRules = List.of();
        private ContextType dataPipelineContext = ContextType.DATA_PIPELINE;
        private List<HostEventType> rootEventTypes = List.of();
        private HostEventType loopExecutorType = HostEventType.EXECUTOR_STATE_PROCESS;
        private StatType loopStepStat = StatType.STEP_ID;
        private StatType loopIterationStat = StatType.ITER_NUM;
        private HostEventType executorType = HostEventType.EXECUTOR_STATE_PROCESS;
        private HostEventType eagerExecuteType = HostEventType.EAGER_KERNEL_EXECUTE;
        private HostEventType opType = HostEventType.TF_OP_RUN;
        private HostEventType kernelLaunchType = HostEventType.KERNEL_LAUNCH;
        private HostEventType functionRunType = HostEventType.FUNCTION_RUN;
        private StatType modelIdStat = StatType.MODEL_ID;

        public Builder connectRules(List<ConnectRule> connectRules) {
            this.connectRules = connectRules;
            return this;
        }

        public Builder dataPipelineContext(ContextType dataPipelineContext) {
            this.dataPipelineContext = dataPipelineContext;
            return this;
        }

        public Builder rootEventTypes(List<HostEventType> rootEventTypes) {
            this.rootEventTypes = rootEventTypes;
            return this;
        }

        public Builder rootEventTypes(HostEventType... rootEventTypes) {
            this.rootEventTypes = List.of(rootEventTypes);
            return this;
        }

        public Builder loopExecutorType(HostEventType loopExecutorType) {
            this.loopExecutorType = loopExecutorType;
            return this;
        }

        public Builder loopStepStat(StatType loopStepStat) {
            this.loopStepStat = loopStepStat;
            return this;
        }

        public Builder loopIterationStat(StatType loopIterationStat) {
            this.loopIterationStat = loopIterationStat;
            return this;
        }

        public Builder executorType(HostEventType executorType) {
            this.executorType = executorType;
            return this;
        }

        public Builder eagerExecuteType(HostEventType eagerExecuteType) {
            this.eagerExecuteType = eagerExecuteType;
            return this;
        }

        public Builder opType(HostEventType opType) {
            this.opType = opType;
            return this;
        }

        public Builder kernelLaunchType(HostEventType kernelLaunchType) {
            this.kernelLaunchType = kernelLaunchType;
            return this;
        }

        public Builder functionRunType(HostEventType functionRunType) {
            this.functionRunType = functionRunType;
            return this;
        }

        public Builder modelIdStat(StatType modelIdStat) {
            this.modelIdStat = modelIdStat;
            return this;
        }

        public GroupingOptions build() {
            return new GroupingOptions(
                connectRules, dataPipelineContext, rootEventTypes,
                loopExecutorType, loopStepStat, loopIterationStat,
                executorType, eagerExecuteType, opType, kernelLaunchType,
                functionRunType, modelIdStat
            );
        }
    }
}
