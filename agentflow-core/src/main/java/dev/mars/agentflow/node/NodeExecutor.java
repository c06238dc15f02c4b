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

package dev.mars.agentflow.node;

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;

import java.util.Map;

/**
 * Executes nodes of one type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface NodeExecutor {

    /**
     * The node type tag this executor handles.
     */
    String getNodeType();

    /**
     * Runs the node against its input.
     *
     * @param node    the node to run
     * @param input   the current data flowing into the node
     * @param context the execution the node runs in
     * @return the node's output
     * @throws AgentflowException if the node or one of its collaborators fails
     */
    Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws AgentflowException;

    /**
     * Checks the node's shape (ports, required properties) before execution.
     */
    default ValidationResult validate(WorkflowNode node) {
        return new ValidationResult();
    }
}
