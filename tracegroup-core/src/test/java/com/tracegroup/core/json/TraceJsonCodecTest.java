package com.tracegroup.core.json;

import com.tracegroup.core.exception.TraceFormatException;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.core.trace.InMemoryTrace;
import com.tracegroup.core.trace.Timeline;
import com.tracegroup.core.trace.TraceEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Trace JSON codec")
class TraceJsonCodecTest {

    private final TraceJsonCodec codec = new TraceJsonCodec();

    @Test
    @DisplayName("Reads timelines, event types and typed stats")
    void readResource_shouldBuildTrace() {
        InMemoryTrace trace = codec.readResource("traces/session_run.json");

        assertThat(trace.name()).isEqualTo("session-run");
        assertThat(trace.timelines()).extracting(Timeline::id).containsExactly(1L, 2L);

        TraceEvent sessionRun = trace.timelines().get(0).events().get(0);
        assertThat(sessionRun.type()).isEqualTo(HostEventType.SESSION_RUN);
        assertThat(sessionRun.stat(StatType.STEP_ID)).contains(StatValue.ofInt(3));
        assertThat(sessionRun.stat(StatType.GRAPH_TYPE)).contains(StatValue.ofString("train"));

        TraceEvent executor = trace.timelines().get(0).events().get(1);
        assertThat(executor.type()).isEqualTo(HostEventType.EXECUTOR_STATE_PROCESS);
        assertThat(executor.stat(StatType.ITER_NUM)).contains(StatValue.ofInt(0));
    }

    @Test
    @DisplayName("Booleans become integer flags, large integers unsigned, unknown stats are dropped")
    void readResource_shouldConvertStatKinds() {
        InMemoryTrace trace = codec.readResource("traces/session_run.json");

        TraceEvent matmul = trace.timelines().get(0).events().get(2);
        assertThat(matmul.type()).isEqualTo(HostEventType.TF_OP_RUN);
        assertThat(matmul.stat(StatType.IS_ASYNC)).contains(StatValue.ofInt(0));
        assertThat(matmul.stat(StatType.CORRELATION_ID)).contains(StatValue.ofUint(-1L));
        assertThat(matmul.stats()).hasSize(2);
    }

    @Test
    @DisplayName("Written traces read back with the same events and stats")
    void write_shouldPreserveStats() {
        InMemoryTrace trace = codec.readResource("traces/session_run.json");
        trace.timelines().get(1).events().get(0).setStat(StatType.GROUP_ID, StatValue.ofInt(4));

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        codec.write(trace, output);
        InMemoryTrace reread = codec.read(new ByteArrayInputStream(output.toByteArray()));

        TraceEvent kernel = reread.timelines().get(1).events().get(0);
        assertThat(kernel.type()).isEqualTo(HostEventType.KERNEL_EXECUTE);
        assertThat(kernel.stat(StatType.GROUP_ID)).contains(StatValue.ofInt(4));
        assertThat(kernel.stat(StatType.CORRELATION_ID)).contains(StatValue.ofInt(42));
        assertThat(reread.timelines().get(0).events().get(2).stat(StatType.CORRELATION_ID))
            .contains(StatValue.ofUint(-1L));
        assertThat(codec.writeAsString(reread)).isEqualTo(codec.writeAsString(trace));
    }

    @Test
    @DisplayName("Malformed documents raise a trace format error")
    void read_shouldRejectMalformedInput() {
        assertThatThrownBy(() -> read("{\"timelines\": ["))
            .isInstanceOf(TraceFormatException.class)
            .hasMessageContaining("Failed to parse");
        assertThatThrownBy(() -> read("{\"name\": \"empty\"}"))
            .isInstanceOf(TraceFormatException.class)
            .hasMessageContaining("no timelines");
        assertThatThrownBy(() -> read("{\"timelines\": [{\"id\": 1, \"events\": [{\"startPs\": 0}]}]}"))
            .isInstanceOf(TraceFormatException.class)
            .hasMessageContaining("without name");
        assertThatThrownBy(() -> read(
            "{\"timelines\": [{\"id\": 1, \"events\": [{\"name\": \"a\", \"stats\": {\"step_id\": [1]}}]}]}"))
            .isInstanceOf(TraceFormatException.class)
            .hasMessageContaining("step_id");
    }

    @Test
    void readResource_missing_shouldThrow() {
        assertThatThrownBy(() -> codec.readResource("traces/missing.json"))
            .isInstanceOf(TraceFormatException.class)
            .hasMessageContaining("not found");
    }

    private InMemoryTrace read(String json) {
        return codec.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
