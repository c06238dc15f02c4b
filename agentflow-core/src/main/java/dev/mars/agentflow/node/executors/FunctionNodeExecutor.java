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

import dev.mars.agentflow.core.exceptions.NodeExecutionException;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.AbstractNodeExecutor;
import dev.mars.agentflow.node.NodeExecutionContext;
import dev.mars.agentflow.node.NodeFunction;

import java.util.Map;

/**
 * Runs the Java function named by the node's {@code function} property.
 * The function's result is merged over the node's input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FunctionNodeExecutor extends AbstractNodeExecutor {

    private final Map<String, NodeFunction> functions;

    public FunctionNodeExecutor(Map<String, NodeFunction> functions) {
        super(NodeTypes.FUNCTION_NODE);
        this.functions = Map.copyOf(functions);
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws NodeExecutionException {
        String name = node.getStringProperty("function").orElse("");
        NodeFunction function = functions.get(name);
        if (function == null) {
            throw new NodeExecutionException(node.getId(), getNodeType(), "Unknown function '" + name + "'");
        }

        Map<String, Object> result;
        try {
            result = function.apply(input);
        } catch (Exception e) {
            throw new NodeExecutionException(node.getId(), getNodeType(),
                    "Function '" + name + "' failed: " + e.getMessage(), e);
        }

        Map<String, Object> output = baseOutput(node, input);
        if (result != null) {
            output.putAll(result);
        }
        return output;
    }

    @Override
    public ValidationResult validate(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        requireProperty(node, "function", result);
        node.getStringProperty("function")
                .filter(name -> !name.isBlank() && !functions.containsKey(name))
                .ifPresent(name -> result.addError("nodes." + node.getId() + ".properties.function",
                        "Function '" + name + "' is not registered"));
        return result;
    }
}
