package com.deliverable.deliverable_parser.engine;

import com.deliverable.deliverable_parser.config.ParserProperties;
import com.deliverable.deliverable_parser.model.domain.NodeType;
import com.deliverable.deliverable_parser.model.domain.WorkflowEdge;
import com.deliverable.deliverable_parser.model.domain.WorkflowFormat;
import com.deliverable.deliverable_parser.model.domain.WorkflowNode;
import com.deliverable.deliverable_parser.model.parse.StructuredInput;
import com.deliverable.deliverable_parser.model.parse.TextDerived;
import com.deliverable.deliverable_parser.model.parse.WorkflowSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fast path for responses where the model already emitted a graph as JSON:
 * <pre>
 * { "nodes": [ { "id": "a", "type": "start", "label": "..." }, ... ],
 *   "edges": [ { "source": "a", "target": "b" }, ... ],
 *   "layout": "decision-tree" }
 * </pre>
 * Anything that is not an object with "nodes" and "edges" arrays comes back as {@link TextDerived}.
 * Parse failures are logged at debug and never reach the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredWorkflowReader {

    private final ObjectMapper mapper;
    private final ParserProperties properties;

    public WorkflowSource read(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) return new TextDerived(normalizedText);
        String candidate = normalizedText.trim();
        if (!candidate.startsWith("{")) return new TextDerived(normalizedText);

        JsonNode root;
        try {
            root = mapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            log.debug("Structured workflow parse failed, falling back to text: {}", e.getOriginalMessage());
            return new TextDerived(normalizedText);
        }
        if (root == null || !root.isObject()
                || !root.path("nodes").isArray() || !root.path("edges").isArray()) {
            return new TextDerived(normalizedText);
        }
        return toStructuredInput(root);
    }

    private StructuredInput toStructuredInput(JsonNode root) {
        Set<String> nodeIds = new LinkedHashSet<>();
        List<WorkflowNode> nodes = new ArrayList<>();
        int index = 0;
        for (JsonNode raw : root.get("nodes")) {
            if (raw.isObject()) {
                nodes.add(toNode(raw, index, nodeIds));
            }
            index++;
        }

        Set<String> edgeIds = new HashSet<>();
        List<WorkflowEdge> edges = new ArrayList<>();
        int dropped = 0;
        index = 0;
        for (JsonNode raw : root.get("edges")) {
            String source = text(raw, "source");
            String target = text(raw, "target");
            if (source == null || target == null || !nodeIds.contains(source) || !nodeIds.contains(target)) {
                dropped++;
            } else {
                String id = unique(firstNonBlank(text(raw, "id"), "edge-" + index), edgeIds);
                edges.add(new WorkflowEdge(id, source, target, text(raw, "label")));
            }
            index++;
        }
        if (dropped > 0) {
            log.warn("Dropped {} structured edge(s) referencing unknown node ids", dropped);
        }

        anchorStart(nodes, nodeIds, edges, edgeIds);
        closeOpenPaths(nodes, nodeIds, edges, edgeIds);

        String layout = firstNonBlank(text(root, "layout"), WorkflowFormat.LINEAR_PROCESS.getLayout());
        return new StructuredInput(nodes, edges, layout);
    }

    private WorkflowNode toNode(JsonNode raw, int index, Set<String> nodeIds) {
        String id = unique(firstNonBlank(text(raw, "id"), "node-" + index), nodeIds);
        String label = firstNonBlank(text(raw, "label"), firstNonBlank(text(raw, "title"), "Step " + (index + 1)));
        List<String> substeps = new ArrayList<>();
        for (JsonNode s : raw.path("substeps")) {
            if (substeps.size() >= properties.effectiveMaxSubsteps()) break;
            if (s.isTextual() && !s.asText().isBlank()) substeps.add(s.asText().trim());
        }
        return new WorkflowNode(id, NodeType.fromValue(text(raw, "type")),
                properties.truncateLabel(label), text(raw, "description"), substeps);
    }

    /**
     * Leaves exactly one start node, first in the list. The first node typed start is moved to the
     * front and any later ones become plain steps. Without one, a start node is synthesized and
     * linked to every non-end node that no edge points at.
     */
    private void anchorStart(List<WorkflowNode> nodes, Set<String> nodeIds,
                             List<WorkflowEdge> edges, Set<String> edgeIds) {
        WorkflowNode start = null;
        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            if (node.type() != NodeType.START) continue;
            if (start == null) {
                start = node;
            } else {
                nodes.set(i, node.withType(NodeType.STEP));
            }
        }
        if (start != null) {
            nodes.remove(start);
            nodes.add(0, start);
            return;
        }

        start = WorkflowNode.of(unique(NodeClassifier.START_ID, nodeIds), NodeType.START, NodeClassifier.START_LABEL);
        Set<String> targets = new HashSet<>();
        edges.forEach(e -> targets.add(e.target()));
        int counter = 0;
        for (WorkflowNode node : nodes) {
            if (node.type() != NodeType.END && !targets.contains(node.id())) {
                edges.add(WorkflowEdge.of(unique("edge-start-" + counter++, edgeIds), start.id(), node.id()));
            }
        }
        nodes.add(0, start);
        // no root found: closeOpenPaths links start straight to the end node
    }

    /** Makes sure an end node exists and every non-end node leads somewhere. */
    private void closeOpenPaths(List<WorkflowNode> nodes, Set<String> nodeIds,
                                List<WorkflowEdge> edges, Set<String> edgeIds) {
        WorkflowNode end = nodes.stream()
                .filter(n -> n.type() == NodeType.END)
                .findFirst()
                .orElse(null);
        if (end == null) {
            end = WorkflowNode.of(unique(NodeClassifier.END_ID, nodeIds), NodeType.END, NodeClassifier.END_LABEL);
            nodes.add(end);
        }
        Set<String> sources = new HashSet<>();
        edges.forEach(e -> sources.add(e.source()));
        int counter = 0;
        for (WorkflowNode node : new ArrayList<>(nodes)) {
            if (node.type() != NodeType.END && !sources.contains(node.id())) {
                edges.add(WorkflowEdge.of(unique("edge-end-" + counter++, edgeIds), node.id(), end.id()));
            }
        }
    }

    private static String unique(String candidate, Set<String> taken) {
        String id = candidate;
        int suffix = 2;
        while (!taken.add(id)) {
            id = candidate + "-" + suffix++;
        }
        return id;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        String s = value.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static String firstNonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
