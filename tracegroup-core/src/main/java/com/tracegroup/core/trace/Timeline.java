package com.tracegroup.core.trace;

import java.util.List;

/**
 * Events of one thread, device stream or other resource.
 */
public interface Timeline {

    long id();

    String name();

    /**
     * Events in capture order. Not necessarily sorted by start time.
     */
    List<? extends TraceEvent> events();
}
