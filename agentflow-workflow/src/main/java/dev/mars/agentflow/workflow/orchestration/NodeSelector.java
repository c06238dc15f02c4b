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

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.graph.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the next node in a magentic orchestration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@FunctionalInterface
public interface NodeSelector {

    /**
     * @param candidates  the participating nodes, in declaration order
     * @param currentData the data produced so far
     * @param priorSteps  the steps recorded so far in this execution
     * @return the node to run next, or empty to finish
     * @throws AgentflowException if selection fails
     */
    Optional<WorkflowNode> selectNext(List<WorkflowNode> candidates, Map<String, Object> currentData,
                                      List<ExecutionStep> priorSteps) throws AgentflowException;
}
