package com.tracegroup.engine.forest;

import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Metadata of one group: its display name, the model id for inference traces,
 * and the groups it is related to.
 *
 * Invariants:
 * - a group never lists itself as parent or child
 * - relationships are kept symmetric by {@link EventForest#relateGroups}
 */
public class GroupMetadata {

    private final long groupId;
    private String name;
    private String modelId;
    private final SortedSet<Long> parents = new TreeSet<>();
    private final SortedSet<Long> children = new TreeSet<>();

    GroupMetadata(long groupId) {
        this.groupId = groupId;
    }

    public long groupId() {
        return groupId;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Optional<String> modelId() {
        return Optional.ofNullable(modelId);
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public SortedSet<Long> parents() {
        return Collections.unmodifiableSortedSet(parents);
    }

    public SortedSet<Long> children() {
        return Collections.unmodifiableSortedSet(children);
    }

    void addParent(long parentGroupId) {
        parents.add(parentGroupId);
    }

    void addChild(long childGroupId) {
        children.add(childGroupId);
    }

    void removeParent(long parentGroupId) {
        parents.remove(parentGroupId);
    }

    void removeChild(long childGroupId) {
        children.remove(childGroupId);
    }

    void clearRelationships() {
        parents.clear();
        children.clear();
    }

    @Override
    public String toString() {
        return "GroupMetadata{id=" + groupId + ", name='" + name + "'"
            + (modelId != null ? ", modelId='" + modelId + "'" : "")
            + ", parents=" + parents + ", children=" + children + "}";
    }
}
