package com.tracegroup.engine.heuristic;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import com.tracegroup.engine.forest.GroupMetadata;
import com.tracegroup.engine.group.GroupAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Folds the eager ops a worker thread runs after a function into the function's group,
 * so that a dispatcher invoking a function followed by callback ops reads as one unit.
 *
 * Per timeline, in time order: an eager execute event with a grouped function run child is
 * the anchor. Later eager execute events on the same timeline are linked under the anchor and
 * take its group when they are ungrouped or were the root of their own group. Any other root
 * event that is not nested in the anchor or a folded op ends the run of folded ops.
 */
public class WorkerGroupMerger {

    private static final Logger log = LoggerFactory.getLogger(WorkerGroupMerger.class);

    private final HostEventType eagerExecuteType;
    private final HostEventType functionRunType;

    public WorkerGroupMerger(HostEventType eagerExecuteType, HostEventType functionRunType) {
        this.eagerExecuteType = eagerExecuteType;
        this.functionRunType = functionRunType;
    }

    /**
     * @return number of eager ops folded into a function run's group
     */
    public int merge(EventForest forest) {
        if (forest.nodesOfType(eagerExecuteType).isEmpty() || forest.nodesOfType(functionRunType).isEmpty()) {
            return 0;
        }
        int folded = 0;
        for (long timelineId : forest.timelineIds()) {
            folded += mergeTimeline(forest, forest.timelineNodes(timelineId));
        }
        return folded;
    }

    private int mergeTimeline(EventForest forest, List<EventNode> timelineNodes) {
        EventNode anchor = null;
        EventNode current = null;
        long anchorGroup = -1;
        int folded = 0;
        for (EventNode node : timelineNodes) {
            if (current != null && current.event().includes(node.event())) {
                continue;
            }
            if (node.type() == eagerExecuteType) {
                Optional<Long> functionGroup = functionRunGroup(forest, node);
                if (functionGroup.isPresent()) {
                    anchor = node;
                    current = node;
                    anchorGroup = functionGroup.get();
                    if (!node.hasGroup()) {
                        GroupAssembler.propagateGroup(forest, node, anchorGroup, n -> false);
                    }
                    continue;
                }
                if (anchor != null) {
                    forest.addChild(anchor, node);
                    if (fold(forest, node, anchorGroup)) {
                        folded++;
                    }
                    current = node;
                }
                continue;
            }
            if (anchor != null && node.isRoot()) {
                anchor = null;
                current = null;
            }
        }
        return folded;
    }

    private Optional<Long> functionRunGroup(EventForest forest, EventNode eagerOp) {
        for (EventNode child : forest.childrenOf(eagerOp)) {
            if (child.type() == functionRunType && child.hasGroup()) {
                return child.groupId();
            }
        }
        return Optional.empty();
    }

    private static boolean isOwnGroupRoot(EventForest forest, EventNode node) {
        return node.groupId()
            .flatMap(forest::groupRoot)
            .filter(root -> root == node)
            .isPresent();
    }

    /**
     * Move node, and the part of its former group reachable from it, into groupId.
     * The former group's relationships carry over to groupId and the former group is detached;
     * its metadata entry is kept. The moved root takes groupId's name as its step name.
     */
    private boolean fold(EventForest forest, EventNode node, long groupId) {
        Optional<Long> former = node.groupId();
        if (former.isEmpty()) {
            GroupAssembler.propagateGroup(forest, node, groupId, n -> false);
            return true;
        }
        if (former.get() == groupId) {
            return false;
        }
        if (!isOwnGroupRoot(forest, node)) {
            forest.relateGroups(groupId, former.get());
            return false;
        }
        GroupAssembler.propagateGroup(forest, node, groupId, n -> n.groupId().equals(former));
        GroupMetadata formerMetadata = forest.groupMetadata(former.get());
        for (long parent : formerMetadata.parents()) {
            forest.relateGroups(parent, groupId);
        }
        for (long child : formerMetadata.children()) {
            forest.relateGroups(groupId, child);
        }
        forest.detachGroup(former.get());
        String groupName = forest.groupMetadata(groupId).name();
        if (groupName != null) {
            node.setStepName(groupName);
        }
        log.debug("Folded group {} rooted at {} into group {}", former.get(), node, groupId);
        return true;
    }
}
