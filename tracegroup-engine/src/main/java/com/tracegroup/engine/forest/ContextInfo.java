package com.tracegroup.engine.forest;

import com.tracegroup.core.model.ContextType;

/**
 * A (kind, id) pair used to match a producer event to its consumers across timelines.
 */
public record ContextInfo(ContextType type, long id) {
}
