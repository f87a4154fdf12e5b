package com.tracegroup.engine.group;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Selects root nodes and assigns every node reachable from a root to that root's group.
 *
 * Roots are processed by start time; equal start times keep discovery order. Each root without
 * a group opens the next group id and claims every ungrouped node reachable through children.
 * A node already claimed by another group is left alone and the two groups are related instead.
 * Running the assembler again on the same forest creates no new group.
 */
public class GroupAssembler {

    private static final Logger log = LoggerFactory.getLogger(GroupAssembler.class);

    private static final Comparator<EventNode> BY_START = Comparator.comparingLong(EventNode::startPs);

    private final Set<HostEventType> rootEventTypes;

    public GroupAssembler(List<HostEventType> rootEventTypes) {
        this.rootEventTypes = rootEventTypes.isEmpty()
            ? EnumSet.noneOf(HostEventType.class)
            : EnumSet.copyOf(rootEventTypes);
    }

    /**
     * @return number of groups created
     */
    public int assemble(EventForest forest) {
        List<EventNode> roots = new ArrayList<>(selectRoots(forest));
        roots.sort(BY_START);

        int created = 0;
        for (EventNode root : roots) {
            if (root.hasGroup()) {
                continue;
            }
            long groupId = forest.allocateGroup(root);
            int members = propagateGroup(forest, root, groupId, node -> false);
            String name = groupName(root, groupId);
            forest.groupMetadata(groupId).setName(name);
            if (root.stepName().isEmpty()) {
                root.setStepName(name);
            }
            log.trace("Group {} '{}' rooted at {} with {} members", groupId, name, root, members);
            created++;
        }
        log.debug("Created {} groups from {} root candidates", created, roots.size());
        return created;
    }

    /**
     * Loop iteration roots when any were detected, otherwise nodes of a root type or flagged
     * as root, in discovery order.
     */
    public List<EventNode> selectRoots(EventForest forest) {
        if (!forest.loopRoots().isEmpty()) {
            return forest.loopRoots();
        }
        List<EventNode> roots = new ArrayList<>();
        for (EventNode node : forest.nodes()) {
            if (rootEventTypes.contains(node.type())) {
                node.setRoot(true);
            }
            if (node.isRoot()) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * Breadth-first assignment of groupId from start through children.
     *
     * A node in another group is taken over only if reassignable accepts it; otherwise the
     * groups are related and traversal stops there. Nodes already in groupId are not revisited.
     *
     * @return number of nodes assigned
     */
    public static int propagateGroup(EventForest forest, EventNode start, long groupId,
                                     Predicate<EventNode> reassignable) {
        Queue<EventNode> queue = new ArrayDeque<>();
        Set<Integer> seen = new HashSet<>();
        queue.add(start);
        seen.add(start.index());
        int assigned = 0;
        while (!queue.isEmpty()) {
            EventNode node = queue.poll();
            Optional<Long> current = node.groupId();
            if (current.isPresent()) {
                if (current.get() == groupId) {
                    continue;
                }
                if (!reassignable.test(node)) {
                    forest.relateGroups(groupId, current.get());
                    continue;
                }
            }
            node.setGroupId(groupId);
            assigned++;
            for (EventNode child : forest.childrenOf(node)) {
                if (seen.add(child.index())) {
                    queue.add(child);
                }
            }
        }
        return assigned;
    }

    /**
     * The root's step name if set; otherwise its graph type (or event name) followed by the
     * iteration number, step number or, failing both, the group id.
     */
    static String groupName(EventNode root, long groupId) {
        Optional<String> stepName = root.stepName();
        if (stepName.isPresent()) {
            return stepName.get();
        }
        String prefix = root.event().stat(StatType.GRAPH_TYPE)
            .map(StatValue::asString)
            .orElse(root.name());
        long stepNumber = integralStat(root, StatType.ITER_NUM)
            .or(() -> integralStat(root, StatType.STEP_NUM))
            .orElse(groupId);
        return prefix + " " + stepNumber;
    }

    private static Optional<Long> integralStat(EventNode node, StatType statType) {
        return node.event().stat(statType)
            .filter(StatValue::isIntegral)
            .map(StatValue::intOrUintValue);
    }
}
