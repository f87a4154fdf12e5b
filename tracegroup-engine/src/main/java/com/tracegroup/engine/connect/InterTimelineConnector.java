package com.tracegroup.engine.connect;

import com.tracegroup.core.model.ConnectRule;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Connects events across timelines using declarative {@link ConnectRule}s.
 *
 * For each rule, every node of the parent type whose stat tuple equals a child's stat tuple
 * becomes a parent of that child. Stats are looked up on the node or its closest ancestor.
 * Nodes missing any of the stats are skipped. Rules run in list order and only add edges.
 */
public class InterTimelineConnector {

    private static final Logger log = LoggerFactory.getLogger(InterTimelineConnector.class);

    private final List<ConnectRule> rules;

    public InterTimelineConnector(List<ConnectRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @return number of edges added over all rules
     */
    public int connect(EventForest forest) {
        int edges = 0;
        for (ConnectRule rule : rules) {
            int added = apply(forest, rule);
            log.debug("Rule {} -> {} on {}: {} edges",
                rule.parentType(), rule.childType(), rule.parentStatTypes(), added);
            edges += added;
        }
        return edges;
    }

    private int apply(EventForest forest, ConnectRule rule) {
        Map<List<Object>, List<EventNode>> candidates = new HashMap<>();
        for (EventNode parent : forest.nodesOfType(rule.parentType())) {
            statKey(forest, parent, rule.parentStatTypes())
                .ifPresent(key -> candidates.computeIfAbsent(key, k -> new ArrayList<>()).add(parent));
        }
        if (candidates.isEmpty()) {
            return 0;
        }

        // Keys are resolved before linking so that new edges do not change later lookups.
        Map<EventNode, List<Object>> childKeys = new LinkedHashMap<>();
        for (EventNode child : forest.nodesOfType(rule.childType())) {
            statKey(forest, child, rule.effectiveChildStatTypes()).ifPresent(key -> childKeys.put(child, key));
        }

        int edges = 0;
        for (Map.Entry<EventNode, List<Object>> entry : childKeys.entrySet()) {
            for (EventNode parent : candidates.getOrDefault(entry.getValue(), List.of())) {
                if (forest.addChild(parent, entry.getKey())) {
                    edges++;
                }
            }
        }
        return edges;
    }

    private static Optional<List<Object>> statKey(EventForest forest, EventNode node, List<StatType> statTypes) {
        List<Object> key = new ArrayList<>(statTypes.size());
        for (StatType statType : statTypes) {
            Optional<StatValue> value = forest.contextStat(node, statType);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            key.add(value.get().matchKey());
        }
        return Optional.of(key);
    }
}
