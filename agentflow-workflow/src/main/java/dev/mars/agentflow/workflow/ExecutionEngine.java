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

import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.execution.ExecutionError;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.execution.WorkflowExecution;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs workflow graphs and tracks their executions.
 *
 * <p>Executions run asynchronously; {@link #startExecution} returns as soon as
 * the execution is registered. Lifecycle operations return false when the
 * execution is unknown, no longer active or cannot make the transition.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ExecutionEngine {

    /**
     * Starts an execution of the stored workflow.
     *
     * @param workflowId the workflow to run
     * @param inputData initial data handed to the first node, may be null
     * @return the new execution's id
     * @throws WorkflowValidationException if the workflow is unknown or its graph is malformed;
     *         no execution is recorded in that case
     */
    String startExecution(String workflowId, Map<String, Object> inputData) throws WorkflowValidationException;

    boolean pauseExecution(String executionId);

    boolean resumeExecution(String executionId);

    boolean stopExecution(String executionId);

    Optional<WorkflowExecution> getExecutionStatus(String executionId);

    /**
     * @return the workflow's executions, newest first
     */
    List<WorkflowExecution> listWorkflowExecutions(String workflowId);

    List<ExecutionStep> listExecutionSteps(String executionId);

    List<ExecutionError> listExecutionErrors(String executionId);

    /**
     * Completes with the terminal snapshot of the execution. Fails with a
     * {@link WorkflowValidationException} for an unknown execution id.
     */
    CompletableFuture<WorkflowExecution> awaitCompletion(String executionId);

    List<WorkflowExecution> getActiveExecutions();

    void addListener(ExecutionListener listener);

    boolean removeListener(ExecutionListener listener);

    /**
     * Cancels every active execution and releases the engine's threads.
     */
    void shutdown();
}
