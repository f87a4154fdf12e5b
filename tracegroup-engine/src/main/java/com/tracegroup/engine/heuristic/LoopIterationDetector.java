package com.tracegroup.engine.heuristic;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects loop iterations from executor events and registers one root per iteration.
 *
 * Executor events are keyed by their (step, iteration) context stats. The earliest event of
 * each iteration is its root and the other executor events of that iteration become its
 * children. A step whose only iteration is 0 is not a loop. Detected roots supersede the
 * root-type based roots when groups are assembled.
 */
public class LoopIterationDetector {

    private static final Logger log = LoggerFactory.getLogger(LoopIterationDetector.class);

    private final HostEventType executorType;
    private final StatType stepStat;
    private final StatType iterationStat;

    public LoopIterationDetector(HostEventType executorType, StatType stepStat, StatType iterationStat) {
        this.executorType = executorType;
        this.stepStat = stepStat;
        this.iterationStat = iterationStat;
    }

    /**
     * @return number of loop roots registered
     */
    public int detect(EventForest forest) {
        Map<Long, Map<Long, Iteration>> loops = new LinkedHashMap<>();
        for (EventNode node : forest.nodesOfType(executorType)) {
            Optional<Long> step = integralContextStat(forest, node, stepStat);
            Optional<Long> iteration = integralContextStat(forest, node, iterationStat);
            if (step.isEmpty() || iteration.isEmpty()) {
                continue;
            }
            loops.computeIfAbsent(step.get(), s -> new LinkedHashMap<>())
                .computeIfAbsent(iteration.get(), i -> new Iteration())
                .add(node);
        }

        int roots = 0;
        for (Map.Entry<Long, Map<Long, Iteration>> loop : loops.entrySet()) {
            Map<Long, Iteration> iterations = loop.getValue();
            if (iterations.size() == 1 && iterations.containsKey(0L)) {
                continue;
            }
            for (Iteration iteration : iterations.values()) {
                forest.addLoopRoot(iteration.first);
                for (EventNode event : iteration.events) {
                    if (event != iteration.first) {
                        forest.addChild(iteration.first, event);
                    }
                }
                roots++;
            }
            log.debug("Step {} runs a loop of {} iterations", loop.getKey(), iterations.size());
        }
        return roots;
    }

    private static Optional<Long> integralContextStat(EventForest forest, EventNode node, StatType statType) {
        return forest.contextStat(node, statType)
            .filter(StatValue::isIntegral)
            .map(StatValue::intOrUintValue);
    }

    private static final class Iteration {
        private EventNode first;
        private final List<EventNode> events = new ArrayList<>();

        void add(EventNode node) {
            if (first == null || node.startsBefore(first)) {
                first = node;
            }
            events.add(node);
        }
    }
}
