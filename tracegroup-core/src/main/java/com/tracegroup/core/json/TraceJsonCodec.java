package com.tracegroup.core.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.tracegroup.core.exception.TraceFormatException;
import com.tracegroup.core.model.HostEventType;
import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.core.trace.InMemoryTimeline;
import com.tracegroup.core.trace.InMemoryTrace;
import com.tracegroup.core.trace.InMemoryTraceEvent;
import com.tracegroup.core.trace.Timeline;
import com.tracegroup.core.trace.Trace;
import com.tracegroup.core.trace.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes traces as JSON documents.
 *
 * Document shape:
 * <pre>
 * {"name": "...", "timelines": [
 *   {"id": 1, "name": "thread-1", "events": [
 *     {"name": "SessionRun", "type": "SESSION_RUN", "startPs": 0, "durationPs": 100,
 *      "stats": {"STEP_ID": 3, "graph_type": "train"}}]}]}
 * </pre>
 * The event type is optional and derived from the event name when absent.
 * Stat keys may be constant names or stat names.
 */
public class TraceJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(TraceJsonCodec.class);

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final ObjectMapper objectMapper;

    public TraceJsonCodec() {
        this(new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true));
    }

    public TraceJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ========== Reading ==========

    public InMemoryTrace read(InputStream input) {
        TraceDocument document;
        try {
            document = objectMapper.readValue(input, TraceDocument.class);
        } catch (IOException e) {
            throw new TraceFormatException("Failed to parse trace document: " + e.getMessage(), e);
        }
        return toTrace(document);
    }

    /**
     * Read a trace from a classpath resource.
     */
    public InMemoryTrace readResource(String resourcePath) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TraceJsonCodec.class.getClassLoader();
        }
        try (InputStream input = loader.getResourceAsStream(resourcePath)) {
            if (input == null) {
                throw new TraceFormatException("Trace resource not found: " + resourcePath);
            }
            return read(input);
        } catch (IOException e) {
            throw new TraceFormatException("Failed to read trace resource: " + resourcePath, e);
        }
    }

    private InMemoryTrace toTrace(TraceDocument document) {
        if (document == null || document.timelines() == null) {
            throw new TraceFormatException("Trace document has no timelines");
        }
        InMemoryTrace trace = new InMemoryTrace(document.name() != null ? document.name() : "trace");
        for (TimelineDocument timelineDocument : document.timelines()) {
            InMemoryTimeline timeline = trace.addTimeline(timelineDocument.id(), timelineDocument.name());
            if (timelineDocument.events() == null) {
                continue;
            }
            for (EventDocument eventDocument : timelineDocument.events()) {
                if (eventDocument.name() == null) {
                    throw new TraceFormatException("Event without name on timeline " + timelineDocument.id());
                }
                HostEventType type = eventDocument.type() != null
                    ? HostEventType.parse(eventDocument.type())
                    : HostEventType.fromName(eventDocument.name());
                InMemoryTraceEvent event = timeline.addEvent(
                    eventDocument.name(), type, eventDocument.startPs(), eventDocument.durationPs());
                if (eventDocument.stats() != null) {
                    eventDocument.stats().forEach((key, value) -> addStat(event, key, value));
                }
            }
        }
        return trace;
    }

    private void addStat(InMemoryTraceEvent event, String key, JsonNode value) {
        StatType statType = StatType.parse(key);
        if (statType == StatType.UNKNOWN) {
            log.debug("Dropping unknown stat {} on event {}", key, event.name());
            return;
        }
        event.setStat(statType, toStatValue(key, value));
    }

    private StatValue toStatValue(String key, JsonNode value) {
        if (value == null || value.isNull()) {
            throw new TraceFormatException("Stat " + key + " has no value");
        }
        if (value.isBoolean()) {
            return StatValue.ofBoolean(value.booleanValue());
        }
        if (value.isIntegralNumber()) {
            if (value.canConvertToLong()) {
                return StatValue.ofInt(value.longValue());
            }
            BigInteger big = value.bigIntegerValue();
            if (big.signum() > 0 && big.compareTo(MAX_UINT64) <= 0) {
                return StatValue.ofUint(big.longValue());
            }
            throw new TraceFormatException("Stat " + key + " is out of 64-bit range: " + big);
        }
        if (value.isNumber()) {
            return StatValue.ofDouble(value.doubleValue());
        }
        if (value.isTextual()) {
            return StatValue.ofString(value.textValue());
        }
        throw new TraceFormatException("Unsupported value for stat " + key + ": " + value.getNodeType());
    }

    // ========== Writing ==========

    /**
     * Write any trace, including the stats added by the grouping pipeline.
     */
    public void write(Trace trace, OutputStream output) {
        try {
            objectMapper.writeValue(output, toDocument(trace));
        } catch (IOException e) {
            throw new TraceFormatException("Failed to write trace " + trace.name(), e);
        }
    }

    public String writeAsString(Trace trace) {
        try {
            return objectMapper.writeValueAsString(toDocument(trace));
        } catch (IOException e) {
            throw new TraceFormatException("Failed to write trace " + trace.name(), e);
        }
    }

    private TraceDocument toDocument(Trace trace) {
        List<TimelineDocument> timelines = new ArrayList<>();
        for (Timeline timeline : trace.timelines()) {
            List<EventDocument> events = new ArrayList<>();
            for (TraceEvent event : timeline.events()) {
                Map<String, JsonNode> stats = new LinkedHashMap<>();
                event.stats().forEach((statType, value) -> stats.put(statType.name(), toJson(value)));
                events.add(new EventDocument(
                    event.name(),
                    event.type() == HostEventType.UNKNOWN ? null : event.type().name(),
                    event.startPs(),
                    event.durationPs(),
                    stats.isEmpty() ? null : stats));
            }
            timelines.add(new TimelineDocument(timeline.id(), timeline.name(), events));
        }
        return new TraceDocument(trace.name(), timelines);
    }

    private JsonNode toJson(StatValue value) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        return switch (value.kind()) {
            case INT -> nodes.numberNode(value.longValue());
            case UINT -> value.longValue() >= 0
                ? nodes.numberNode(value.longValue())
                : nodes.numberNode(new BigInteger(Long.toUnsignedString(value.longValue())));
            case DOUBLE -> nodes.numberNode(value.doubleValue());
            case STRING -> nodes.textNode(value.stringValue());
        };
    }

    // ========== Document model ==========

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TraceDocument(String name, List<TimelineDocument> timelines) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TimelineDocument(long id, String name, List<EventDocument> events) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EventDocument(String name, String type, long startPs, long durationPs, Map<String, JsonNode> stats) {
    }
}
