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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory {@link ExecutionHistoryStore}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class InMemoryExecutionHistoryStore implements ExecutionHistoryStore {

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowExecution execution) {
        Objects.requireNonNull(execution, "Execution cannot be null");
        executions.put(execution.getExecutionId(), execution);
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        return executionId == null ? Optional.empty() : Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public boolean remove(String executionId) {
        return executionId != null && executions.remove(executionId) != null;
    }

    @Override
    public List<WorkflowExecution> findByWorkflowId(String workflowId) {
        return executions.values().stream()
                .filter(execution -> execution.getWorkflowId().equals(workflowId))
                .sorted(Comparator.comparing(WorkflowExecution::getStartedAt).reversed())
                .collect(Collectors.toList());
    }
}
