package com.tracegroup.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declares that events of parentType connect as parents of events of childType
 * when the listed stats carry equal values on both sides.
 *
 * Invariants:
 * - parentStatTypes is non-empty
 * - childStatTypes is empty (reuse parentStatTypes) or has the same size as parentStatTypes
 */
public record ConnectRule(
    HostEventType parentType,
    HostEventType childType,
    List<StatType> parentStatTypes,
    List<StatType> childStatTypes
) {
    public ConnectRule {
        Objects.requireNonNull(parentType, "parentType");
        Objects.requireNonNull(childType, "childType");
        parentStatTypes = List.copyOf(parentStatTypes);
        childStatTypes = childStatTypes == null ? List.of() : List.copyOf(childStatTypes);
        if (parentStatTypes.isEmpty()) {
            throw new IllegalArgumentException("parentStatTypes must not be empty");
        }
        if (!childStatTypes.isEmpty() && childStatTypes.size() != parentStatTypes.size()) {
            throw new IllegalArgumentException(String.format(
                "childStatTypes has %d entries, parentStatTypes has %d",
                childStatTypes.size(), parentStatTypes.size()));
        }
    }

    /**
     * Rule matching the same stats on both sides.
     */
    public static ConnectRule of(HostEventType parentType, HostEventType childType, StatType... statTypes) {
        return new ConnectRule(parentType, childType, List.of(statTypes), List.of());
    }

    /**
     * Stat types looked up on the child side.
     */
    public List<StatType> effectiveChildStatTypes() {
        return childStatTypes.isEmpty() ? parentStatTypes : childStatTypes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HostEventType parentType;
        private HostEventType childType;
        private List<StatType> parentStatTypes = List.of();
        private List<StatType> childStatTypes = List.of();

        public Builder parentType(HostEventType parentType) {
            this.parentType = parentType;
            return this;
        }

        public Builder childType(HostEventType childType) {
            this.childType = childType;
            return this;
        }

        public Builder parentStatTypes(StatType... parentStatTypes) {
            this.parentStatTypes = List.of(parentStatTypes);
            return this;
        }

        public Builder childStatTypes(StatType... childStatTypes) {
            this.childStatTypes = List.of(childStatTypes);
            return this;
        }

        public ConnectRule build() {
            return new ConnectRule(parentType, childType, parentStatTypes, childStatTypes);
        }
    }
}
