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
import dev.mars.agentflow.graph.NodeConnection;
import dev.mars.agentflow.graph.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses where control goes after a node in a handoff orchestration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@FunctionalInterface
public interface HandoffConditionEvaluator {

    /**
     * @param current  the node that just ran
     * @param outgoing the node's outgoing connections, in declaration order
     * @param output   the node's output
     * @return the connection to follow, or empty to end the handoff chain
     * @throws AgentflowException if the choice cannot be made
     */
    Optional<NodeConnection> selectHandoff(WorkflowNode current, List<NodeConnection> outgoing,
                                           Map<String, Object> output) throws AgentflowException;
}
