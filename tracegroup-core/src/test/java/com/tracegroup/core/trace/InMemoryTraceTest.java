package com.tracegroup.core.trace;

import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTraceTest {

    @Test
    void addEvent_shouldDeriveTypeFromName() {
        InMemoryTrace trace = new InMemoryTrace("t");
        InMemoryTimeline host = trace.addTimeline(1, "host");

        InMemoryTraceEvent run = host.addEvent("SessionRun", 0, 100);
        InMemoryTraceEvent matmul = host.addEvent("MatMul", 10, 5);

        assertThat(run.type()).isEqualTo(HostEventType.SESSION_RUN);
        assertThat(matmul.type()).isEqualTo(HostEventType.UNKNOWN);
        assertThat(run.endPs()).isEqualTo(100);
        assertThat(run.includes(matmul)).isTrue();
        assertThat(matmul.includes(run)).isFalse();
    }

    @Test
    void includes_shouldAcceptSharedBoundaries() {
        InMemoryTimeline host = new InMemoryTrace("t").addTimeline(1, "host");
        InMemoryTraceEvent outer = host.addEvent("outer", 0, 100);

        assertThat(outer.includes(host.addEvent("same", 0, 100))).isTrue();
        assertThat(outer.includes(host.addEvent("point", 100, 0))).isTrue();
        assertThat(outer.includes(host.addEvent("overlap", 50, 60))).isFalse();
    }

    @Test
    void copy_shouldBeIndependentOfOriginal() {
        InMemoryTrace trace = new InMemoryTrace("t");
        InMemoryTraceEvent original = trace.addTimeline(1, "host")
            .addEvent(HostEventType.SESSION_RUN, 0, 100)
            .withStat(StatType.STEP_ID, 3);

        InMemoryTrace copy = trace.copy();
        TraceEvent copied = copy.timelines().get(0).events().get(0);
        copied.setStat(StatType.GROUP_ID, StatValue.ofInt(0));

        assertThat(copied.stat(StatType.STEP_ID)).contains(StatValue.ofInt(3));
        assertThat(original.stat(StatType.GROUP_ID)).isEmpty();
        assertThat(copy.name()).isEqualTo("t");
    }
}
