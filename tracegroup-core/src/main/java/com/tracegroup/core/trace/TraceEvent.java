package com.tracegroup.core.trace;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;

import java.util.Map;
import java.util.Optional;

/**
 * One time-ranged occurrence on a timeline. Times are in picoseconds.
 */
public interface TraceEvent {

    String name();

    HostEventType type();

    long startPs();

    long durationPs();

    default long endPs() {
        return startPs() + durationPs();
    }

    /**
     * Whether this event's time span fully contains the other's.
     */
    default boolean includes(TraceEvent other) {
        return startPs() <= other.startPs() && other.endPs() <= endPs();
    }

    Optional<StatValue> stat(StatType statType);

    /**
     * Read-only view of all stats.
     */
    Map<StatType, StatValue> stats();

    /**
     * Add or replace a stat.
     */
    void setStat(StatType statType, StatValue value);
}
