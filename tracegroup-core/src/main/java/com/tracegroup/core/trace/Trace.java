package com.tracegroup.core.trace;

import java.util.List;

/**
 * A complete captured execution record, composed of timelines.
 * The grouping pipeline reads it and writes stats back through {@link TraceEvent#setStat}.
 */
public interface Trace {

    /**
     * Human readable name, used for logging only.
     */
    String name();

    /**
     * All timelines in capture order.
     */
    List<? extends Timeline> timelines();
}
