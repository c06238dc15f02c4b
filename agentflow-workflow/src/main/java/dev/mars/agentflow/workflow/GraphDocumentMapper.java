/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.agentflow.workflow;

import dev.mars.agentflow.graph.ConnectionType;
import dev.mars.agentflow.graph.NodeConnection;
import dev.mars.agentflow.graph.NodePort;
import dev.mars.agentflow.graph.NodeRole;
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a generic document tree (as loaded from YAML or JSON) to a
 * {@link WorkflowGraph}.
 *
 * <p>An orchestration type that is not recognised is kept as "none
 * declared", which runs under custom orchestration. Unknown connection
 * types, step types and roles are rejected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class GraphDocumentMapper {

    private static final Logger logger = LoggerFactory.getLogger(GraphDocumentMapper.class);

    public WorkflowGraph toGraph(Map<String, Object> document) throws WorkflowParseException {
        if (document == null || document.isEmpty()) {
            throw new WorkflowParseException("Empty workflow document");
        }

        String id = getStringValue(document, "id");
        if (id == null || id.isBlank()) {
            throw new WorkflowParseException("id", "Workflow id is required");
        }

        WorkflowGraph.Builder builder = WorkflowGraph.builder()
                .id(id)
                .name(getStringValue(document, "name"))
                .description(getStringValue(document, "description"));

        String declaredType = getStringValue(document, "orchestrationType");
        if (declaredType != null) {
            OrchestrationType type = OrchestrationType.fromName(declaredType).orElse(null);
            if (type == null) {
                logger.warn("Workflow {} declares unknown orchestration type '{}'", id, declaredType);
            }
            builder.orchestrationType(type);
        }

        List<Map<String, Object>> nodes = getListValue(document, "nodes", "nodes");
        for (int i = 0; i < nodes.size(); i++) {
            builder.node(parseNode(nodes.get(i), "nodes[" + i + "]"));
        }

        List<Map<String, Object>> connections = getListValue(document, "connections", "connections");
        for (int i = 0; i < connections.size(); i++) {
            builder.connection(parseConnection(connections.get(i), "connections[" + i + "]"));
        }

        builder.orchestrationSteps(parseSteps(document, "orchestrationSteps", "orchestrationSteps"));
        return builder.build();
    }

    private WorkflowNode parseNode(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = requireString(data, "id", path);
        WorkflowNode.Builder builder = WorkflowNode.builder()
                .id(id)
                .name(getStringValue(data, "name"))
                .type(requireString(data, "type", path))
                .properties(getMapValue(data, "properties", path));

        Map<String, Object> position = getMapValue(data, "position", path);
        builder.position(getDoubleValue(position, "x", 0), getDoubleValue(position, "y", 0));

        for (Map<String, Object> port : getListValue(data, "inputPorts", path + ".inputPorts")) {
            builder.inputPort(parsePort(port, path + ".inputPorts"));
        }
        for (Map<String, Object> port : getListValue(data, "outputPorts", path + ".outputPorts")) {
            builder.outputPort(parsePort(port, path + ".outputPorts"));
        }

        Map<String, Object> orchestration = getMapValue(data, "orchestration", path);
        builder.participating(getBooleanValue(orchestration, "participates", true))
                .parallelEligible(getBooleanValue(orchestration, "parallelEligible", true))
                .priority(getIntValue(orchestration, "priority", 0));
        Object roles = orchestration.get("roles");
        if (roles instanceof List) {
            for (Object role : (List<?>) roles) {
                builder.role(NodeRole.fromName(String.valueOf(role))
                        .orElseThrow(() -> new WorkflowParseException(path + ".orchestration.roles",
                                "Unknown role '" + role + "'")));
            }
        }
        return builder.build();
    }

    private NodePort parsePort(Map<String, Object> data, String path) throws WorkflowParseException {
        return new NodePort(requireString(data, "id", path), getStringValue(data, "name"),
                getStringValue(data, "dataType"), getBooleanValue(data, "required", false));
    }

    private NodeConnection parseConnection(Map<String, Object> data, String path) throws WorkflowParseException {
        String declaredType = getStringValue(data, "type");
        ConnectionType type = ConnectionType.DATA_FLOW;
        if (declaredType != null) {
            type = ConnectionType.fromName(declaredType)
                    .orElseThrow(() -> new WorkflowParseException(path + ".type",
                            "Unknown connection type '" + declaredType + "'"));
        }
        return new NodeConnection(getStringValue(data, "id"),
                requireString(data, "from", path), getStringValue(data, "fromPort"),
                requireString(data, "to", path), getStringValue(data, "toPort"),
                type, getStringValue(data, "condition"));
    }

    private List<OrchestrationStep> parseSteps(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        List<Map<String, Object>> steps = getListValue(data, key, path);
        List<OrchestrationStep> result = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            result.add(parseStep(steps.get(i), path + "[" + i + "]", i));
        }
        return result;
    }

    private OrchestrationStep parseStep(Map<String, Object> data, String path, int index)
            throws WorkflowParseException {
        String declaredType = requireString(data, "type", path);
        OrchestrationStepType type = OrchestrationStepType.fromName(declaredType)
                .orElseThrow(() -> new WorkflowParseException(path + ".type",
                        "Unknown step type '" + declaredType + "'"));

        return OrchestrationStep.builder()
                .id(requireString(data, "id", path))
                .name(getStringValue(data, "name"))
                .order(getIntValue(data, "order", index))
                .enabled(getBooleanValue(data, "enabled", true))
                .type(type)
                .nodeIds(getStringList(data, "nodeIds"))
                .sourceStepIds(getStringList(data, "sourceStepIds"))
                .condition(getStringValue(data, "condition"))
                .parameters(getMapValue(data, "parameters", path))
                .children(parseSteps(data, "children", path + ".children"))
                .alternates(parseSteps(data, "alternates", path + ".alternates"))
                .continueOnError(getBooleanValue(data, "continueOnError", false))
                .build();
    }

    private String requireString(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        String value = getStringValue(data, key);
        if (value == null || value.isBlank()) {
            throw new WorkflowParseException(path + "." + key, "Required field '" + key + "' is missing");
        }
        return value;
    }

    private String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path + "." + key, "Expected a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Expected a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            if (!(item instanceof Map)) {
                throw new WorkflowParseException(path, "Expected a list of mappings");
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            ((Map<Object, Object>) item).forEach((k, v) -> entry.put(String.valueOf(k), v));
            result.add(entry);
        }
        return result;
    }

    private List<String> getStringList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer for '{}': {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleValue(Map<String, Object> data, String key, double defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid number for '{}': {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }
}
