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

package dev.mars.agentflow.workflow.orchestration;

import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.graph.WorkflowNode;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the highest-priority candidate that has not run yet in this
 * execution; declaration order breaks ties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class PriorityNodeSelector implements NodeSelector {

    @Override
    public Optional<WorkflowNode> selectNext(List<WorkflowNode> candidates, Map<String, Object> currentData,
                                             List<ExecutionStep> priorSteps) {
        Set<String> executed = priorSteps.stream()
                .map(ExecutionStep::getNodeId)
                .collect(Collectors.toSet());
        // lower declaration index wins ties
        return candidates.stream()
                .filter(node -> !executed.contains(node.getId()))
                .max(Comparator.comparingInt(WorkflowNode::getPriority)
                        .thenComparing(Comparator.<WorkflowNode>comparingInt(candidates::indexOf).reversed()));
    }
}
