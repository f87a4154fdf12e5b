package com.tracegroup.core.trace;

import com.tracegroup.core.model.HostEventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable in-memory timeline. Events are kept in insertion order.
 */
public class InMemoryTimeline implements Timeline {

    private final long id;
    private final String name;
    private final List<InMemoryTraceEvent> events = new ArrayList<>();

    public InMemoryTimeline(long id, String name) {
        this.id = id;
        this.name = name;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<InMemoryTraceEvent> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Add an event whose type is derived from its name.
     */
    public InMemoryTraceEvent addEvent(String name, long startPs, long durationPs) {
        return addEvent(name, HostEventType.fromName(name), startPs, durationPs);
    }

    public InMemoryTraceEvent addEvent(HostEventType type, long startPs, long durationPs) {
        return addEvent(type.eventName(), type, startPs, durationPs);
    }

    public InMemoryTraceEvent addEvent(String name, HostEventType type, long startPs, long durationPs) {
        InMemoryTraceEvent event = new InMemoryTraceEvent(name, type, startPs, durationPs);
        events.add(event);
        return event;
    }

    InMemoryTimeline copy() {
        InMemoryTimeline copy = new InMemoryTimeline(id, name);
        for (InMemoryTraceEvent event : events) {
            copy.events.add(new InMemoryTraceEvent(event));
        }
        return copy;
    }
}
