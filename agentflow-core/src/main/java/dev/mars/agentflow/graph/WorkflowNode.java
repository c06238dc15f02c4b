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

import dev.mars.agentflow.execution.DataMaps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A typed unit of work in a workflow graph.
 *
 * <p>Position is used only to break ties when ordering nodes. The
 * orchestration settings control whether and how the node takes part in
 * the concurrent, magentic and group chat policies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkflowNode {

    private final String id;
    private final String name;
    private final String type;
    private final Map<String, Object> properties;
    private final List<NodePort> inputPorts;
    private final List<NodePort> outputPorts;
    private final double x;
    private final double y;
    private final boolean participating;
    private final boolean parallelEligible;
    private final Set<NodeRole> roles;
    private final int priority;

    private WorkflowNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID cannot be null");
        this.type = Objects.requireNonNull(builder.type, "Node type cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.properties = DataMaps.immutableCopy(builder.properties);
        this.inputPorts = List.copyOf(builder.inputPorts);
        this.outputPorts = List.copyOf(builder.outputPorts);
        this.x = builder.x;
        this.y = builder.y;
        this.participating = builder.participating;
        this.parallelEligible = builder.parallelEligible;
        this.roles = builder.roles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.roles));
        this.priority = builder.priority;
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

    public String getType() {
        return type;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public Optional<Object> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public Optional<String> getStringProperty(String key) {
        Object value = properties.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public List<NodePort> getInputPorts() {
        return inputPorts;
    }

    public List<NodePort> getOutputPorts() {
        return outputPorts;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public boolean isParticipating() {
        return participating;
    }

    public boolean isParallelEligible() {
        return parallelEligible;
    }

    public Set<NodeRole> getRoles() {
        return roles;
    }

    public boolean hasRole(NodeRole role) {
        return roles.contains(role);
    }

    public int getPriority() {
        return priority;
    }

    public boolean isStartNode() {
        return NodeTypes.isStart(type);
    }

    public boolean isEndNode() {
        return NodeTypes.isEnd(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String type;
        private Map<String, Object> properties = Map.of();
        private final List<NodePort> inputPorts = new ArrayList<>();
        private final List<NodePort> outputPorts = new ArrayList<>();
        private double x;
        private double y;
        private boolean participating = true;
        private boolean parallelEligible = true;
        private final Set<NodeRole> roles = EnumSet.noneOf(NodeRole.class);
        private int priority;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties != null ? properties : Map.of();
            return this;
        }

        public Builder inputPort(NodePort port) {
            this.inputPorts.add(Objects.requireNonNull(port, "Port cannot be null"));
            return this;
        }

        public Builder outputPort(NodePort port) {
            this.outputPorts.add(Objects.requireNonNull(port, "Port cannot be null"));
            return this;
        }

        public Builder position(double x, double y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder participating(boolean participating) {
            this.participating = participating;
            return this;
        }

        public Builder parallelEligible(boolean parallelEligible) {
            this.parallelEligible = parallelEligible;
            return this;
        }

        public Builder role(NodeRole role) {
            this.roles.add(Objects.requireNonNull(role, "Role cannot be null"));
            return this;
        }

        public Builder roles(Set<NodeRole> roles) {
            this.roles.clear();
            if (roles != null) {
                this.roles.addAll(roles);
            }
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(this);
        }
    }
}
