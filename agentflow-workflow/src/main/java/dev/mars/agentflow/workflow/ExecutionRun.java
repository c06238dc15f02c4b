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

import dev.mars.agentflow.config.AgentflowConfiguration;
import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.execution.ExecutionError;
import dev.mars.agentflow.execution.ExecutionState;
import dev.mars.agentflow.execution.WorkflowExecution;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.NodeExecutionContext;
import dev.mars.agentflow.node.NodeExecutorRegistry;
import dev.mars.agentflow.workflow.observability.ExecutionMetrics;
import dev.mars.agentflow.workflow.orchestration.NodeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Everything one execution needs while its strategy walks the graph: the
 * graph snapshot captured at start, the live state, the control flags and
 * the node dispatch. Step and error recording go through here so that
 * every record is mirrored to listeners and metrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ExecutionRun {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionRun.class);

    /**
     * Work recorded as a step. Usually a node dispatch; group chat records a
     * whole collaborative session this way.
     */
    @FunctionalInterface
    public interface StepBody {
        Map<String, Object> run() throws AgentflowException;
    }

    private final WorkflowGraph graph;
    private final ExecutionState state;
    private final ExecutionControl control;
    private final NodeExecutionContext nodeContext;
    private final NodeExecutorRegistry nodeExecutors;
    private final ExecutionEventPublisher publisher;
    private final ExecutionMetrics metrics;
    private final AgentflowConfiguration configuration;
    private final CompletableFuture<WorkflowExecution> completion = new CompletableFuture<>();

    public ExecutionRun(WorkflowGraph graph, ExecutionState state, NodeExecutorRegistry nodeExecutors,
                        ExecutionEventPublisher publisher, ExecutionMetrics metrics,
                        AgentflowConfiguration configuration) {
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.nodeExecutors = Objects.requireNonNull(nodeExecutors, "Node executors cannot be null");
        this.publisher = Objects.requireNonNull(publisher, "Publisher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.control = new ExecutionControl();
        this.nodeContext = new NodeExecutionContext(state.getExecutionId(), state.getWorkflowId());
    }

    public String getExecutionId() {
        return state.getExecutionId();
    }

    public WorkflowGraph getGraph() {
        return graph;
    }

    public ExecutionState getState() {
        return state;
    }

    public ExecutionControl getControl() {
        return control;
    }

    public NodeExecutionContext getNodeContext() {
        return nodeContext;
    }

    public NodeExecutorRegistry getNodeExecutors() {
        return nodeExecutors;
    }

    public AgentflowConfiguration getConfiguration() {
        return configuration;
    }

    public Map<String, Object> getInputData() {
        return state.getInputData();
    }

    CompletableFuture<WorkflowExecution> getCompletion() {
        return completion;
    }

    public boolean isCancelled() {
        return control.isCancelled();
    }

    /**
     * Node boundary: blocks while paused.
     *
     * @return true if the walk may start another node
     */
    public boolean awaitBoundary() {
        return control.awaitBoundary() && !state.isTerminal();
    }

    /**
     * Dispatches the node and records the invocation as a step.
     */
    public NodeOutcome executeNode(WorkflowNode node, Map<String, Object> input) {
        return executeStep(node, input, () -> nodeExecutors.execute(node, input, nodeContext));
    }

    /**
     * Records the body's work as a step against the node. Failures are
     * attached to the step and the execution; they never escape.
     */
    public NodeOutcome executeStep(WorkflowNode node, Map<String, Object> input, StepBody body) {
        Optional<String> started = state.beginStep(node.getId(), node.getName(), input);
        if (started.isEmpty()) {
            return NodeOutcome.skipped();
        }
        String stepId = started.get();

        try {
            Map<String, Object> output = body.run();
            state.completeStep(stepId, output);
            metrics.recordStepCompleted(node.getType());
            logger.debug("Node {} completed in execution {}", node.getId(), getExecutionId());
            publisher.stepCompleted(new StepCompletedEvent(getExecutionId(), stepId, node.getId(),
                    node.getName(), output, state.now()));
            return NodeOutcome.completed(stepId, output);
        } catch (AgentflowException | RuntimeException e) {
            ExecutionError error = state.failStep(stepId, ExecutionError.from(e, node.getId(), stepId, state.now()));
            metrics.recordStepFailed(node.getType(), error.getKind().name());
            logger.warn("Node {} failed in execution {}: {}", node.getId(), getExecutionId(), e.getMessage());
            if (!state.isTerminal()) {
                publisher.executionError(new ExecutionErrorEvent(getExecutionId(), error));
            }
            return NodeOutcome.failed(stepId, error);
        }
    }

    /**
     * Appends an error that belongs to the execution rather than to a step.
     */
    public Optional<ExecutionError> recordError(AgentflowException failure, String nodeId) {
        return record(ExecutionError.from(failure, nodeId, null, state.now()));
    }

    public Optional<ExecutionError> recordError(ErrorKind kind, String message, String nodeId) {
        return record(ExecutionError.of(kind, message, nodeId, state.now()));
    }

    private Optional<ExecutionError> record(ExecutionError error) {
        if (!state.addError(error)) {
            return Optional.empty();
        }
        logger.warn("Execution {} recorded {} error: {}", getExecutionId(), error.getKind(), error.getMessage());
        publisher.executionError(new ExecutionErrorEvent(getExecutionId(), error));
        return Optional.of(error);
    }
}
