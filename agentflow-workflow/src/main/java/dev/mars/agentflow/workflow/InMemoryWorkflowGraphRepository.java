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

import dev.mars.agentflow.graph.WorkflowGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps workflow graphs in memory, keyed by id. Saving a graph with an
 * existing id replaces it; running executions keep the graph they started with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class InMemoryWorkflowGraphRepository implements WorkflowGraphRepository {

    private final Map<String, WorkflowGraph> graphs = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "Workflow graph cannot be null");
        graphs.put(graph.getId(), graph);
    }

    @Override
    public Optional<WorkflowGraph> findById(String workflowId) {
        return workflowId == null ? Optional.empty() : Optional.ofNullable(graphs.get(workflowId));
    }

    @Override
    public List<WorkflowGraph> findAll() {
        return new ArrayList<>(graphs.values());
    }

    @Override
    public boolean delete(String workflowId) {
        return graphs.remove(workflowId) != null;
    }
}
