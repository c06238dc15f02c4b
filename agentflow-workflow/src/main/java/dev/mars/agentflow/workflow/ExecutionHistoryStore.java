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

import dev.mars.agentflow.execution.WorkflowExecution;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of execution snapshots, consulted once an execution has
 * left the engine's active registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ExecutionHistoryStore {

    /**
     * Stores the snapshot, replacing any earlier snapshot of the same execution.
     */
    void save(WorkflowExecution execution);

    Optional<WorkflowExecution> findById(String executionId);

    /**
     * Drops the execution's snapshot, if present.
     *
     * @return true if a snapshot was removed
     */
    boolean remove(String executionId);

    /**
     * @return the workflow's executions, newest first
     */
    List<WorkflowExecution> findByWorkflowId(String workflowId);
}
