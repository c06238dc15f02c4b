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

import dev.mars.agentflow.graph.OrchestrationType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a workflow execution: its status, step history and
 * error trail at the moment it was taken.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class WorkflowExecution {

    private final String executionId;
    private final String workflowId;
    private final OrchestrationType orchestrationType;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Map<String, Object> inputData;
    private final Map<String, Object> outputData;
    private final List<ExecutionStep> steps;
    private final List<ExecutionError> errors;

    public WorkflowExecution(String executionId, String workflowId, OrchestrationType orchestrationType,
                             ExecutionStatus status, Instant startedAt, Instant completedAt,
                             Map<String, Object> inputData, Map<String, Object> outputData,
                             List<ExecutionStep> steps, List<ExecutionError> errors) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.orchestrationType = orchestrationType;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.completedAt = completedAt;
        this.inputData = DataMaps.immutableCopy(inputData);
        this.outputData = DataMaps.immutableCopy(outputData);
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public OrchestrationType getOrchestrationType() {
        return orchestrationType;
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

    public List<ExecutionStep> getSteps() {
        return steps;
    }

    public List<ExecutionError> getErrors() {
        return errors;
    }

    public boolean isRunning() {
        return status.isActive();
    }

    public boolean isCompleted() {
        return status.isTerminal();
    }

    public long getSuccessfulStepCount() {
        return steps.stream().filter(ExecutionStep::isSuccessful).count();
    }

    public long getFailedStepCount() {
        return steps.stream().filter(step -> step.getStatus() == ExecutionStatus.FAILED).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowExecution that = (WorkflowExecution) o;
        return Objects.equals(executionId, that.executionId) && status == that.status
                && steps.size() == that.steps.size() && errors.size() == that.errors.size();
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, status, steps.size(), errors.size());
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
                "executionId='" + executionId + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", orchestrationType=" + orchestrationType +
                ", status=" + status +
                ", steps=" + steps.size() +
                ", errors=" + errors.size() +
                '}';
    }
}
