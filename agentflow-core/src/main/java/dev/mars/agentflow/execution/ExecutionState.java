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

import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import dev.mars.agentflow.graph.OrchestrationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Live, thread-safe aggregate of one execution. Strategies append steps and
 * errors while the engine drives status transitions; readers take immutable
 * {@link WorkflowExecution} snapshots.
 *
 * <p>Step start times are issued under the aggregate's lock and are strictly
 * increasing. Once the status is terminal no new step or error is accepted,
 * although a step that was already in flight may still be closed out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ExecutionState {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionState.class);

    private final String executionId;
    private final String workflowId;
    private final OrchestrationType orchestrationType;
    private final Map<String, Object> inputData;
    private final Instant startedAt;
    private final Clock clock;

    private final Map<String, StepRecord> steps = new LinkedHashMap<>();
    private final List<ExecutionError> errors = new ArrayList<>();
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private Instant completedAt;
    private Map<String, Object> outputData = Map.of();
    private Instant lastStepStart;

    public ExecutionState(String executionId, String workflowId, OrchestrationType orchestrationType,
                          Map<String, Object> inputData, Clock clock) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.orchestrationType = orchestrationType;
        this.inputData = DataMaps.immutableCopy(inputData);
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.startedAt = clock.instant();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Map<String, Object> getInputData() {
        return inputData;
    }

    public Instant now() {
        return clock.instant();
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves the execution to the target status.
     *
     * @return the status before the transition
     * @throws InvalidTransitionException if the transition is not allowed from the current status
     */
    public synchronized ExecutionStatus transitionTo(ExecutionStatus target) throws InvalidTransitionException {
        Objects.requireNonNull(target, "Target status cannot be null");
        ExecutionStatus previous = status;
        if (!previous.canTransitionTo(target)) {
            throw new InvalidTransitionException(executionId, previous, target, previous.getValidTransitions());
        }
        status = target;
        if (target.isTerminal()) {
            completedAt = clock.instant();
        }
        logger.debug("Execution {} status {} -> {}", executionId, previous, target);
        return previous;
    }

    /**
     * Opens a new running step for the node.
     *
     * @return the new step id, or empty if the execution is already terminal
     */
    public synchronized Optional<String> beginStep(String nodeId, String nodeName, Map<String, Object> input) {
        Objects.requireNonNull(nodeId, "Node ID cannot be null");
        if (status.isTerminal()) {
            logger.debug("Execution {} is {}; not starting step for node {}", executionId, status, nodeId);
            return Optional.empty();
        }
        Instant start = clock.instant();
        if (lastStepStart != null && !start.isAfter(lastStepStart)) {
            start = lastStepStart.plusNanos(1);
        }
        lastStepStart = start;
        String stepId = UUID.randomUUID().toString();
        steps.put(stepId, new StepRecord(stepId, nodeId, nodeName, start, DataMaps.immutableCopy(input)));
        return Optional.of(stepId);
    }

    public synchronized void completeStep(String stepId, Map<String, Object> output) {
        StepRecord step = requireOpenStep(stepId);
        step.status = ExecutionStatus.COMPLETED;
        step.completedAt = clock.instant();
        step.outputData = DataMaps.immutableCopy(output);
    }

    /**
     * Closes the step as failed. The error is attached to the step and, unless
     * the execution is already terminal, appended to the execution's error trail.
     *
     * @return the error as recorded, attributed to the step
     */
    public synchronized ExecutionError failStep(String stepId, ExecutionError error) {
        StepRecord step = requireOpenStep(stepId);
        ExecutionError attributed = error.withStep(step.nodeId, stepId);
        step.status = ExecutionStatus.FAILED;
        step.completedAt = clock.instant();
        step.errors.add(attributed);
        addError(attributed);
        return attributed;
    }

    /**
     * Appends an error to the execution.
     *
     * @return false if the execution is terminal and the error was rejected
     */
    public synchronized boolean addError(ExecutionError error) {
        Objects.requireNonNull(error, "Error cannot be null");
        if (status.isTerminal()) {
            logger.warn("Execution {} is {}; rejecting error: {}", executionId, status, error.getMessage());
            return false;
        }
        errors.add(error);
        return true;
    }

    public synchronized void setOutputData(Map<String, Object> output) {
        if (status.isTerminal()) {
            logger.debug("Execution {} is {}; output left unchanged", executionId, status);
            return;
        }
        this.outputData = DataMaps.immutableCopy(output);
    }

    public synchronized Map<String, Object> getOutputData() {
        return outputData;
    }

    public synchronized int getStepCount() {
        return steps.size();
    }

    public synchronized List<ExecutionStep> getSteps() {
        List<ExecutionStep> result = new ArrayList<>(steps.size());
        for (StepRecord step : steps.values()) {
            result.add(step.toStep());
        }
        return result;
    }

    public synchronized WorkflowExecution snapshot() {
        return new WorkflowExecution(executionId, workflowId, orchestrationType, status, startedAt,
                completedAt, inputData, outputData, getSteps(), new ArrayList<>(errors));
    }

    private StepRecord requireOpenStep(String stepId) {
        StepRecord step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        if (step.status != ExecutionStatus.RUNNING) {
            throw new IllegalStateException("Step " + stepId + " is already " + step.status);
        }
        return step;
    }

    private static final class StepRecord {
        private final String id;
        private final String nodeId;
        private final String nodeName;
        private final Instant startedAt;
        private final Map<String, Object> inputData;
        private final List<ExecutionError> errors = new ArrayList<>();
        private ExecutionStatus status = ExecutionStatus.RUNNING;
        private Instant completedAt;
        private Map<String, Object> outputData = Map.of();

        private StepRecord(String id, String nodeId, String nodeName, Instant startedAt,
                           Map<String, Object> inputData) {
            this.id = id;
            this.nodeId = nodeId;
            this.nodeName = nodeName;
            this.startedAt = startedAt;
            this.inputData = inputData;
        }

        private ExecutionStep toStep() {
            return new ExecutionStep(id, nodeId, nodeName, status, startedAt, completedAt,
                    inputData, outputData, errors);
        }
    }
}
