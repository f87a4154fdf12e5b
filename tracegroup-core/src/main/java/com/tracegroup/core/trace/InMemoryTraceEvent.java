package com.tracegroup.core.trace;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable in-memory event.
 */
public class InMemoryTraceEvent implements TraceEvent {

    private final String name;
    private final HostEventType type;
    private final long startPs;
    private final long durationPs;
    private final Map<StatType, StatValue> stats = new EnumMap<>(StatType.class);

    public InMemoryTraceEvent(String name, HostEventType type, long startPs, long durationPs) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.startPs = startPs;
        this.durationPs = durationPs;
    }

    InMemoryTraceEvent(InMemoryTraceEvent other) {
        this(other.name, other.type, other.startPs, other.durationPs);
        this.stats.putAll(other.stats);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public HostEventType type() {
        return type;
    }

    @Override
    public long startPs() {
        return startPs;
    }

    @Override
    public long durationPs() {
        return durationPs;
    }

    @Override
    public Optional<StatValue> stat(StatType statType) {
        return Optional.ofNullable(stats.get(statType));
    }

    @Override
    public Map<StatType, StatValue> stats() {
        return Collections.unmodifiableMap(stats);
    }

    @Override
    public void setStat(StatType statType, StatValue value) {
        stats.put(Objects.requireNonNull(statType, "statType"), Objects.requireNonNull(value, "value"));
    }

    /**
     * Fluent variant of {@link #setStat} for building fixtures.
     */
    public InMemoryTraceEvent withStat(StatType statType, StatValue value) {
        setStat(statType, value);
        return this;
    }

    public InMemoryTraceEvent withStat(StatType statType, long value) {
        return withStat(statType, StatValue.ofInt(value));
    }

    public InMemoryTraceEvent withStat(StatType statType, String value) {
        return withStat(statType, StatValue.ofString(value));
    }

    @Override
    public String toString() {
        return name + "[" + startPs + ", " + endPs() + "]";
    }
}
