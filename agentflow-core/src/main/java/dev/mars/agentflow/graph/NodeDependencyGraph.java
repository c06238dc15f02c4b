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

import dev.mars.agentflow.core.exceptions.OrchestrationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Dependency view of a workflow graph built from its ordering connections.
 * Provides pipeline ordering and cycle detection.
 *
 * <p>When several nodes become ready at the same time they are taken by
 * position: smaller x first, then smaller y, then declaration order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class NodeDependencyGraph {

    private final WorkflowGraph graph;
    private final Map<String, Set<String>> successors;
    private final Comparator<WorkflowNode> positionOrder;

    public NodeDependencyGraph(WorkflowGraph graph) {
        this.graph = Objects.requireNonNull(graph, "Workflow graph cannot be null");
        this.successors = new LinkedHashMap<>();
        for (WorkflowNode node : graph.getNodes()) {
            successors.putIfAbsent(node.getId(), new LinkedHashSet<>());
        }
        for (NodeConnection connection : graph.getConnections()) {
            if (connection.getType().isOrdering()
                    && successors.containsKey(connection.getFromNodeId())
                    && successors.containsKey(connection.getToNodeId())) {
                successors.get(connection.getFromNodeId()).add(connection.getToNodeId());
            }
        }
        this.positionOrder = Comparator.comparingDouble(WorkflowNode::getX)
                .thenComparingDouble(WorkflowNode::getY)
                .thenComparingInt(node -> graph.indexOf(node.getId()));
    }

    /**
     * Gets the nodes that directly depend on the given node.
     */
    public Set<String> getSuccessors(String nodeId) {
        return Set.copyOf(successors.getOrDefault(nodeId, Set.of()));
    }

    /**
     * Orders the nodes so that every node comes after the nodes it depends on.
     *
     * @return nodes in pipeline order
     * @throws OrchestrationException if the connections form a cycle
     */
    public List<WorkflowNode> pipelineOrder() throws OrchestrationException {
        // Kahn's algorithm, ready set ordered by position
        Map<String, Integer> inDegree = calculateInDegree();
        PriorityQueue<WorkflowNode> ready = new PriorityQueue<>(positionOrder);
        List<WorkflowNode> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                graph.getNode(entry.getKey()).ifPresent(ready::offer);
            }
        }

        while (!ready.isEmpty()) {
            WorkflowNode current = ready.poll();
            result.add(current);

            for (String dependent : successors.get(current.getId())) {
                int remaining = inDegree.get(dependent) - 1;
                inDegree.put(dependent, remaining);
                if (remaining == 0) {
                    graph.getNode(dependent).ifPresent(ready::offer);
                }
            }
        }

        if (result.size() != successors.size()) {
            List<String> remaining = new ArrayList<>();
            for (String nodeId : successors.keySet()) {
                if (result.stream().noneMatch(node -> node.getId().equals(nodeId))) {
                    remaining.add(nodeId);
                }
            }
            throw new OrchestrationException("Cycle detected among nodes: " + remaining);
        }

        return result;
    }

    public boolean hasCycles() {
        try {
            pipelineOrder();
            return false;
        } catch (OrchestrationException e) {
            return true;
        }
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String nodeId : successors.keySet()) {
            inDegree.put(nodeId, 0);
        }
        for (Set<String> targets : successors.values()) {
            for (String target : targets) {
                inDegree.put(target, inDegree.get(target) + 1);
            }
        }
        return inDegree;
    }

    @Override
    public String toString() {
        return "NodeDependencyGraph{" +
               "workflow=" + graph.getId() +
               ", successors=" + successors +
               '}';
    }
}
