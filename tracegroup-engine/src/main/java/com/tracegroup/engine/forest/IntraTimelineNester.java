package com.tracegroup.engine.forest;

import com.tracegroup.core.trace.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;

/**
 * Builds containment trees within each timeline: an event's nearest enclosing event on the
 * same timeline becomes its parent.
 *
 * A single stack scan over the nesting order. An open event that does not fully include the
 * current one is closed, so partially overlapping events never nest. Async events are left
 * out of nesting entirely. Each timeline is processed independently.
 */
public class IntraTimelineNester {

    private static final Logger log = LoggerFactory.getLogger(IntraTimelineNester.class);

    /**
     * Start ascending, then duration descending, so an enclosing event precedes the events it
     * contains even when they start at the same time. The sort is stable.
     */
    public static final Comparator<TraceEvent> NESTING_ORDER = Comparator
        .comparingLong(TraceEvent::startPs)
        .thenComparing(Comparator.<TraceEvent>comparingLong(TraceEvent::durationPs).reversed());

    /**
     * Nest every timeline of the forest.
     *
     * @return number of edges added
     */
    public int nest(EventForest forest) {
        int edges = 0;
        for (long timelineId : forest.timelineIds()) {
            edges += nestTimeline(forest, timelineId);
        }
        return edges;
    }

    public int nestTimeline(EventForest forest, long timelineId) {
        Deque<EventNode> open = new ArrayDeque<>();
        int edges = 0;
        for (EventNode node : forest.timelineNodes(timelineId)) {
            if (node.isAsync()) {
                continue;
            }
            while (!open.isEmpty() && !open.peek().event().includes(node.event())) {
                open.pop();
            }
            if (!open.isEmpty() && forest.addChild(open.peek(), node)) {
                edges++;
            }
            open.push(node);
        }
        log.trace("Timeline {}: {} nesting edges", timelineId, edges);
        return edges;
    }
}
