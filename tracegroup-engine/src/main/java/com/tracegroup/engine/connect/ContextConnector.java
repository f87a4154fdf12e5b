package com.tracegroup.engine.connect;

import com.tracegroup.core.model.ContextType;
import com.tracegroup.engine.forest.ContextInfo;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Connects producers to consumers that share a context (kind, id).
 *
 * Every producer of a context becomes a parent of every consumer of the same context.
 * The registry is rebuilt on each call and iterated in kind order, then first-seen id order.
 */
public class ContextConnector {

    private static final Logger log = LoggerFactory.getLogger(ContextConnector.class);

    /**
     * Connect every context kind except the given one.
     */
    public int connectAllExcept(EventForest forest, ContextType excluded) {
        return connect(forest, type -> type != excluded);
    }

    /**
     * Connect only contexts of the given kind.
     */
    public int connectOnly(EventForest forest, ContextType kind) {
        return connect(forest, type -> type == kind);
    }

    /**
     * @return number of edges added
     */
    public int connect(EventForest forest, Predicate<ContextType> kinds) {
        Map<ContextType, Map<Long, ContextGroup>> registry = new EnumMap<>(ContextType.class);
        for (EventNode node : forest.nodes()) {
            node.producerContext()
                .filter(context -> kinds.test(context.type()))
                .ifPresent(context -> group(registry, context).producers.add(node));
            node.consumerContext()
                .filter(context -> kinds.test(context.type()))
                .ifPresent(context -> group(registry, context).consumers.add(node));
        }

        int edges = 0;
        for (Map.Entry<ContextType, Map<Long, ContextGroup>> byType : registry.entrySet()) {
            int typeEdges = 0;
            for (ContextGroup group : byType.getValue().values()) {
                for (EventNode producer : group.producers) {
                    for (EventNode consumer : group.consumers) {
                        if (forest.addChild(producer, consumer)) {
                            typeEdges++;
                        }
                    }
                }
            }
            log.debug("Context {}: {} contexts, {} edges", byType.getKey(), byType.getValue().size(), typeEdges);
            edges += typeEdges;
        }
        return edges;
    }

    private static ContextGroup group(Map<ContextType, Map<Long, ContextGroup>> registry, ContextInfo context) {
        return registry
            .computeIfAbsent(context.type(), t -> new LinkedHashMap<>())
            .computeIfAbsent(context.id(), id -> new ContextGroup());
    }

    /**
     * Producers and consumers sharing one context.
     */
    private static final class ContextGroup {
        private final List<EventNode> producers = new ArrayList<>();
        private final List<EventNode> consumers = new ArrayList<>();
    }
}
