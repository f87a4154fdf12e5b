package com.tracegroup.examples.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracegroup.engine.forest.EventNode;
import com.tracegroup.engine.forest.GroupMetadata;
import com.tracegroup.engine.service.GroupingResult;

import java.io.IOException;

/**
 * Renders a grouping result as a JSON summary: one entry per group with its name,
 * model id, related groups and member events.
 */
public final class GroupReport {

    private final ObjectMapper mapper;

    public GroupReport(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode render(GroupingResult result) {
        ObjectNode report = mapper.createObjectNode();
        report.put("trace", result.forest().trace().name());
        report.put("events", result.forest().nodes().size());
        report.put("ungrouped", result.ungroupedCount());

        ArrayNode groups = report.putArray("groups");
        for (GroupMetadata metadata : result.groups().values()) {
            ObjectNode group = groups.addObject();
            group.put("id", metadata.groupId());
            group.put("name", metadata.name());
            metadata.modelId().ifPresent(modelId -> group.put("modelId", modelId));
            ArrayNode parents = group.putArray("parents");
            metadata.parents().forEach(parents::add);
            ArrayNode children = group.putArray("children");
            metadata.children().forEach(children::add);
            ArrayNode members = group.putArray("members");
            for (EventNode member : result.members(metadata.groupId())) {
                members.add(member.name());
            }
        }
        return report;
    }

    public String renderAsString(GroupingResult result) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(render(result));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render group report", e);
        }
    }
}
