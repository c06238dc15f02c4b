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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One step of a custom orchestration script.
 *
 * <p>Branch steps run their children when the condition holds and their
 * alternates otherwise; loop steps repeat their children. Merge steps read
 * the outputs of the steps named in {@link #getSourceStepIds()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class OrchestrationStep {

    public static final String PARAM_TIMEOUT_MS = "timeoutMs";
    public static final String PARAM_MAX_ITERATIONS = "maxIterations";

    private final String id;
    private final String name;
    private final int order;
    private final boolean enabled;
    private final OrchestrationStepType type;
    private final List<String> nodeIds;
    private final List<String> sourceStepIds;
    private final String condition;
    private final Map<String, Object> parameters;
    private final List<OrchestrationStep> children;
    private final List<OrchestrationStep> alternates;
    private final boolean continueOnError;

    private OrchestrationStep(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step ID cannot be null");
        this.type = Objects.requireNonNull(builder.type, "Step type cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.order = builder.order;
        this.enabled = builder.enabled;
        this.nodeIds = List.copyOf(builder.nodeIds);
        this.sourceStepIds = List.copyOf(builder.sourceStepIds);
        this.condition = builder.condition;
        this.parameters = DataMaps.immutableCopy(builder.parameters);
        this.children = List.copyOf(builder.children);
        this.alternates = List.copyOf(builder.alternates);
        this.continueOnError = builder.continueOnError;
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

    public int getOrder() {
        return order;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public OrchestrationStepType getType() {
        return type;
    }

    public List<String> getNodeIds() {
        return nodeIds;
    }

    public List<String> getSourceStepIds() {
        return sourceStepIds;
    }

    public Optional<String> getCondition() {
        return condition == null || condition.isBlank() ? Optional.empty() : Optional.of(condition);
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Optional<Long> getLongParameter(String key) {
        Object value = parameters.get(key);
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Optional.of(Long.parseLong(((String) value).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public List<OrchestrationStep> getChildren() {
        return children;
    }

    public List<OrchestrationStep> getAlternates() {
        return alternates;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrchestrationStep that = (OrchestrationStep) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OrchestrationStep{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", order=" + order +
                ", enabled=" + enabled +
                '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private int order;
        private boolean enabled = true;
        private OrchestrationStepType type;
        private final List<String> nodeIds = new ArrayList<>();
        private final List<String> sourceStepIds = new ArrayList<>();
        private String condition;
        private Map<String, Object> parameters = Map.of();
        private final List<OrchestrationStep> children = new ArrayList<>();
        private final List<OrchestrationStep> alternates = new ArrayList<>();
        private boolean continueOnError;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder type(OrchestrationStepType type) {
            this.type = type;
            return this;
        }

        public Builder nodeIds(List<String> nodeIds) {
            this.nodeIds.clear();
            if (nodeIds != null) {
                this.nodeIds.addAll(nodeIds);
            }
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeIds.add(Objects.requireNonNull(nodeId, "Node ID cannot be null"));
            return this;
        }

        public Builder sourceStepIds(List<String> sourceStepIds) {
            this.sourceStepIds.clear();
            if (sourceStepIds != null) {
                this.sourceStepIds.addAll(sourceStepIds);
            }
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters != null ? parameters : Map.of();
            return this;
        }

        public Builder child(OrchestrationStep child) {
            this.children.add(Objects.requireNonNull(child, "Child step cannot be null"));
            return this;
        }

        public Builder children(List<OrchestrationStep> children) {
            this.children.clear();
            if (children != null) {
                this.children.addAll(children);
            }
            return this;
        }

        public Builder alternate(OrchestrationStep alternate) {
            this.alternates.add(Objects.requireNonNull(alternate, "Alternate step cannot be null"));
            return this;
        }

        public Builder alternates(List<OrchestrationStep> alternates) {
            this.alternates.clear();
            if (alternates != null) {
                this.alternates.addAll(alternates);
            }
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public OrchestrationStep build() {
            return new OrchestrationStep(this);
        }
    }
}
