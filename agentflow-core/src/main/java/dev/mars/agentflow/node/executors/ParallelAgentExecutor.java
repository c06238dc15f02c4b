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

package dev.mars.agentflow.node.executors;

import dev.mars.agentflow.graph.NodePort;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.AbstractNodeExecutor;
import dev.mars.agentflow.node.NodeExecutionContext;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Marks a fan-out point. Passes its input through and lists the output
 * ports the data fans out to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ParallelAgentExecutor extends AbstractNodeExecutor {

    public ParallelAgentExecutor() {
        super(NodeTypes.PARALLEL_AGENT);
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context) {
        Map<String, Object> output = baseOutput(node, input);
        output.put("parallel_branches", node.getOutputPorts().stream()
                .map(NodePort::getId)
                .collect(Collectors.toList()));
        return output;
    }

    @Override
    public ValidationResult validate(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        requireOutputPorts(node, 2, result);
        return result;
    }
}
