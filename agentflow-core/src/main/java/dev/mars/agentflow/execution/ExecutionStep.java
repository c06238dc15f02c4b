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

package dev.mars.agentflow.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one node invocation within an execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class ExecutionStep {

    private final String id;
    private final String nodeId;
    private final String nodeName;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Map<String, Object> inputData;
    private final Map<String, Object> outputData;
    private final List<ExecutionError> errors;

    public ExecutionStep(String id, String nodeId, String nodeName, ExecutionStatus status,
                         Instant startedAt, Instant completedAt,
                         Map<String, Object> inputData, Map<String, Object> outputData,
                         List<ExecutionError> errors) {
        this.id = Objects.requireNonNull(id, "Step ID cannot be null");
        this.nodeId = Objects.requireNonNull(nodeId, "Node ID cannot be null");
        this.nodeName = nodeName;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.completedAt = completedAt;
        this.inputData = DataMaps.immutableCopy(inputData);
        this.outputData = DataMaps.immutableCopy(outputData);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeName() {
        return nodeName;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Duration> getDuration() {
        return completedAt != null ? Optional.of(Duration.between(startedAt, completedAt)) : Optional.empty();
    }

    public Map<String, Object> getInputData() {
        return inputData;
    }

    public Map<String, Object> getOutputData() {
        return outputData;
    }

    public List<ExecutionError> getErrors() {
        return errors;
    }

    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "ExecutionStep{" +
                "id='" + id + '\'' +
                ", nodeId='" + nodeId + '\'' +
                ", status=" + status +
                ", startedAt=" + startedAt +
                '}';
    }
}
