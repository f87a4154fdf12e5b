package com.tracegroup.examples.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracegroup.core.json.TraceJsonCodec;
import com.tracegroup.core.trace.InMemoryTrace;
import com.tracegroup.engine.config.GroupingConfiguration;
import com.tracegroup.engine.service.EventGroupingService;
import com.tracegroup.engine.service.GroupingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Groups a captured inference trace and prints the resulting groups.
 *
 * The sample trace holds two serving requests batched into one session run on a batch thread,
 * a GPU kernel launched from that run, and an input pipeline producer feeding its iterator.
 * Pass a classpath resource path to group a different trace.
 */
public class InferenceTraceDemo {

    private static final Logger log = LoggerFactory.getLogger(InferenceTraceDemo.class);

    public static final String SAMPLE_TRACE = "traces/inference_batch.json";

    private final EventGroupingService service;
    private final TraceJsonCodec codec = new TraceJsonCodec();
    private final GroupReport report = new GroupReport(new ObjectMapper());

    public InferenceTraceDemo(EventGroupingService service) {
        this.service = service;
    }

    public static void main(String[] args) {
        String resource = args.length > 0 ? args[0] : SAMPLE_TRACE;
        try (AnnotationConfigApplicationContext context =
                 new AnnotationConfigApplicationContext(GroupingConfiguration.class)) {
            InferenceTraceDemo demo = new InferenceTraceDemo(context.getBean(EventGroupingService.class));
            System.out.println(demo.report.renderAsString(demo.group(resource)));
        }
    }

    /**
     * Load, group and connect the input pipeline of a trace resource.
     */
    public GroupingResult group(String resource) {
        InMemoryTrace trace = codec.readResource(resource);
        log.info("Loaded trace {} with {} timelines", trace.name(), trace.timelines().size());

        GroupingResult result = service.groupAndConnectDataPipeline(trace);
        result.groups().values().forEach(group ->
            log.info("Group {} '{}' model={} parents={} children={}",
                group.groupId(), group.name(), group.modelId().orElse("-"), group.parents(), group.children()));
        return result;
    }

    public ObjectNode run(String resource) {
        return report.render(group(resource));
    }
}
