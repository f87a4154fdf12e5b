package com.tracegroup.core.model;

import java.util.Optional;

/**
 * Kinds of producer/consumer context used to correlate events across timelines.
 * The integer code is the value carried by the producer/consumer type stats.
 */
public enum ContextType {
    GENERIC(0),
    LEGACY(1),
    TF_EXECUTOR(2),
    TFRT_EXECUTOR(3),
    SHARED_BATCH_SCHEDULER(4),
    PJRT(5),
    ADAPTIVE_SHARED_BATCH_SCHEDULER(6),
    TFRT_TPU_RUNTIME(7),
    TPU_EMBEDDING_ENGINE(8),
    GPU_LAUNCH(9),
    BATCHER(10),
    DATA_PIPELINE(11);

    private final int code;

    ContextType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Look up a context kind by its stat code. Unknown codes yield empty.
     */
    public static Optional<ContextType> fromCode(long code) {
        for (ContextType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
