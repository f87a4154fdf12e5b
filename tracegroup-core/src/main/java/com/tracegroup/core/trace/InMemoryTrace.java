package com.tracegroup.core.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory trace, used by fixtures, the JSON codec and the demo.
 * Not thread-safe.
 */
public class InMemoryTrace implements Trace {

    private final String name;
    private final List<InMemoryTimeline> timelines = new ArrayList<>();

    public InMemoryTrace(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<InMemoryTimeline> timelines() {
        return Collections.unmodifiableList(timelines);
    }

    public InMemoryTimeline addTimeline(long id, String timelineName) {
        InMemoryTimeline timeline = new InMemoryTimeline(id, timelineName);
        timelines.add(timeline);
        return timeline;
    }

    /**
     * Deep copy including all stats.
     */
    public InMemoryTrace copy() {
        InMemoryTrace copy = new InMemoryTrace(name);
        for (InMemoryTimeline timeline : timelines) {
            copy.timelines.add(timeline.copy());
        }
        return copy;
    }
}
