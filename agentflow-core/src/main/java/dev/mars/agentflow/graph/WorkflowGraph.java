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

package dev.mars.agentflow.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a workflow: its nodes, the connections between
 * them, the declared orchestration type and, for custom orchestration,
 * the step script.
 *
 * <p>Building a graph never fails on structural problems so that parsed
 * documents can be inspected; call {@link #validate()} before executing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkflowGraph {

    private final String id;
    private final String name;
    private final String description;
    private final OrchestrationType orchestrationType;
    private final List<WorkflowNode> nodes;
    private final Map<String, WorkflowNode> nodesById;
    private final List<NodeConnection> connections;
    private final List<OrchestrationStep> orchestrationSteps;

    private WorkflowGraph(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.orchestrationType = builder.orchestrationType;
        this.nodes = List.copyOf(builder.nodes);
        Map<String, WorkflowNode> index = new LinkedHashMap<>();
        for (WorkflowNode node : nodes) {
            index.putIfAbsent(node.getId(), node);
        }
        this.nodesById = index;
        this.connections = List.copyOf(builder.connections);
        this.orchestrationSteps = List.copyOf(builder.orchestrationSteps);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    /**
     * The declared orchestration type, or null when none was declared or it
     * was not recognised.
     */
    public OrchestrationType getOrchestrationType() {
        return orchestrationType;
    }

    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodesById.containsKey(nodeId);
    }

    public List<NodeConnection> getConnections() {
        return connections;
    }

    public List<NodeConnection> getOutgoingConnections(String nodeId) {
        return connections.stream()
                .filter(connection -> connection.getFromNodeId().equals(nodeId))
                .collect(Collectors.toList());
    }

    public List<NodeConnection> getIncomingConnections(String nodeId) {
        return connections.stream()
                .filter(connection -> connection.getToNodeId().equals(nodeId))
                .collect(Collectors.toList());
    }

    public List<OrchestrationStep> getOrchestrationSteps() {
        return orchestrationSteps;
    }

    /**
     * Declaration index of a node, used as the final ordering tie-breaker.
     */
    public int indexOf(String nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getId().equals(nodeId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Checks the graph's structure: unique node ids, known connection
     * endpoints and ports, and step scripts that only reference known nodes
     * and steps.
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        if (id.isBlank()) {
            result.addError("id", "Workflow ID cannot be blank");
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            String path = "nodes[" + i + "]";
            if (node.getId().isBlank()) {
                result.addError(path + ".id", "Node ID cannot be blank");
            }
            if (node.getType().isBlank()) {
                result.addError(path + ".type", "Node type cannot be blank for node '" + node.getId() + "'");
            }
            if (!seen.add(node.getId())) {
                result.addError(path + ".id", "Duplicate node ID '" + node.getId() + "'");
            }
        }

        for (int i = 0; i < connections.size(); i++) {
            validateConnection(connections.get(i), "connections[" + i + "]", result);
        }

        Set<String> stepIds = new HashSet<>();
        validateSteps(orchestrationSteps, "orchestrationSteps", stepIds, result);
        collectReferencedSteps(orchestrationSteps).forEach(reference -> {
            if (!stepIds.contains(reference)) {
                result.addError("orchestrationSteps", "Merge references unknown step '" + reference + "'");
            }
        });

        if (nodes.isEmpty()) {
            result.addWarning("nodes", "Workflow has no nodes");
        }
        return result;
    }

    private void validateConnection(NodeConnection connection, String path, ValidationResult result) {
        Optional<WorkflowNode> from = getNode(connection.getFromNodeId());
        Optional<WorkflowNode> to = getNode(connection.getToNodeId());
        if (from.isEmpty()) {
            result.addError(path + ".from", "Connection source node '" + connection.getFromNodeId() + "' not found");
        }
        if (to.isEmpty()) {
            result.addError(path + ".to", "Connection target node '" + connection.getToNodeId() + "' not found");
        }
        from.ifPresent(node -> {
            if (!node.getOutputPorts().isEmpty() && node.getOutputPorts().stream()
                    .noneMatch(port -> port.getId().equals(connection.getFromPort()))) {
                result.addError(path + ".fromPort", "Node '" + node.getId() + "' has no output port '"
                        + connection.getFromPort() + "'");
            }
        });
        to.ifPresent(node -> {
            if (!node.getInputPorts().isEmpty() && node.getInputPorts().stream()
                    .noneMatch(port -> port.getId().equals(connection.getToPort()))) {
                result.addError(path + ".toPort", "Node '" + node.getId() + "' has no input port '"
                        + connection.getToPort() + "'");
            }
        });
        if (connection.getFromNodeId().equals(connection.getToNodeId())) {
            result.addWarning(path, "Connection '" + connection.getId() + "' loops back to its own node");
        }
    }

    private void validateSteps(List<OrchestrationStep> steps, String path, Set<String> stepIds,
                               ValidationResult result) {
        for (int i = 0; i < steps.size(); i++) {
            OrchestrationStep step = steps.get(i);
            String stepPath = path + "[" + i + "]";
            if (!stepIds.add(step.getId())) {
                result.addError(stepPath + ".id", "Duplicate orchestration step ID '" + step.getId() + "'");
            }
            for (String nodeId : step.getNodeIds()) {
                if (!containsNode(nodeId)) {
                    result.addError(stepPath + ".nodeIds", "Step '" + step.getId()
                            + "' references unknown node '" + nodeId + "'");
                }
            }
            if (step.getType() == OrchestrationStepType.AGENT_EXECUTION && step.getNodeIds().isEmpty()) {
                result.addWarning(stepPath + ".nodeIds", "Step '" + step.getId() + "' names no nodes");
            }
            if ((step.getType() == OrchestrationStepType.WAIT_CONDITION
                    || step.getType() == OrchestrationStepType.BRANCH) && step.getCondition().isEmpty()) {
                result.addError(stepPath + ".condition", "Step '" + step.getId() + "' requires a condition");
            }
            validateSteps(step.getChildren(), stepPath + ".children", stepIds, result);
            validateSteps(step.getAlternates(), stepPath + ".alternates", stepIds, result);
        }
    }

    private static List<String> collectReferencedSteps(List<OrchestrationStep> steps) {
        List<String> references = new ArrayList<>();
        for (OrchestrationStep step : steps) {
            references.addAll(step.getSourceStepIds());
            references.addAll(collectReferencedSteps(step.getChildren()));
            references.addAll(collectReferencedSteps(step.getAlternates()));
        }
        return references;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowGraph that = (WorkflowGraph) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
                "id='" + id + '\'' +
                ", orchestrationType=" + orchestrationType +
                ", nodes=" + nodes.size() +
                ", connections=" + connections.size() +
                '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private OrchestrationType orchestrationType;
        private final List<WorkflowNode> nodes = new ArrayList<>();
        private final List<NodeConnection> connections = new ArrayList<>();
        private final List<OrchestrationStep> orchestrationSteps = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder orchestrationType(OrchestrationType orchestrationType) {
            this.orchestrationType = orchestrationType;
            return this;
        }

        public Builder node(WorkflowNode node) {
            this.nodes.add(Objects.requireNonNull(node, "Node cannot be null"));
            return this;
        }

        public Builder nodes(List<WorkflowNode> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        public Builder connection(NodeConnection connection) {
            this.connections.add(Objects.requireNonNull(connection, "Connection cannot be null"));
            return this;
        }

        public Builder connect(String fromNodeId, String toNodeId) {
            return connection(NodeConnection.of(fromNodeId, toNodeId));
        }

        public Builder connections(List<NodeConnection> connections) {
            connections.forEach(this::connection);
            return this;
        }

        public Builder orchestrationStep(OrchestrationStep step) {
            this.orchestrationSteps.add(Objects.requireNonNull(step, "Orchestration step cannot be null"));
            return this;
        }

        public Builder orchestrationSteps(List<OrchestrationStep> steps) {
            steps.forEach(this::orchestrationStep);
            return this;
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(this);
        }
    }
}
