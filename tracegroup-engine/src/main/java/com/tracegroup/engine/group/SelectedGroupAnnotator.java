package com.tracegroup.engine.group;

import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import com.tracegroup.engine.forest.GroupMetadata;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Annotates every grouped node with the ids of the groups connected to its own:
 * the group itself, its parent groups, and every group reachable through child relationships.
 * Re-running replaces the annotation with the same value.
 */
public class SelectedGroupAnnotator {

    /**
     * @return number of nodes annotated
     */
    public int annotate(EventForest forest) {
        Map<Long, SortedSet<Long>> byGroup = new HashMap<>();
        int annotated = 0;
        for (EventNode node : forest.nodes()) {
            if (!node.hasGroup()) {
                continue;
            }
            long groupId = node.groupId().orElseThrow();
            node.setSelectedGroupIds(byGroup.computeIfAbsent(groupId, id -> selectedGroups(forest, id)));
            annotated++;
        }
        return annotated;
    }

    static SortedSet<Long> selectedGroups(EventForest forest, long groupId) {
        GroupMetadata metadata = forest.groupMetadata(groupId);
        SortedSet<Long> selected = new TreeSet<>(metadata.parents());
        selected.add(groupId);

        Deque<Long> pending = new ArrayDeque<>(metadata.children());
        TreeSet<Long> reached = new TreeSet<>();
        while (!pending.isEmpty()) {
            long child = pending.pop();
            if (child == groupId || !reached.add(child)) {
                continue;
            }
            pending.addAll(forest.groupMetadata(child).children());
        }
        selected.addAll(reached);
        return selected;
    }
}
