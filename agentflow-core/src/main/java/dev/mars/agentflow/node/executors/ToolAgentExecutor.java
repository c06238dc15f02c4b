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

import dev.mars.agentflow.collaborator.ToolInvocationProvider;
import dev.mars.agentflow.core.exceptions.CollaboratorException;
import dev.mars.agentflow.execution.DataMaps;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.AbstractNodeExecutor;
import dev.mars.agentflow.node.NodeExecutionContext;

import java.util.Map;
import java.util.Objects;

/**
 * Invokes the tool named by the node's {@code toolName} property. The tool's
 * arguments are the node input overlaid with the node's {@code arguments}
 * property.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ToolAgentExecutor extends AbstractNodeExecutor {

    public static final String RESULT_KEY = "tool_result";

    private final ToolInvocationProvider provider;

    public ToolAgentExecutor(ToolInvocationProvider provider) {
        super(NodeTypes.TOOL_AGENT);
        this.provider = Objects.requireNonNull(provider, "Tool provider cannot be null");
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws CollaboratorException {
        String toolName = node.getStringProperty("toolName")
                .orElseThrow(() -> new CollaboratorException(getNodeType(),
                        "Tool agent '" + node.getId() + "' has no toolName"));

        Map<String, Object> arguments = DataMaps.mutableCopy(input);
        Object configured = node.getProperties().get("arguments");
        if (configured instanceof Map) {
            ((Map<?, ?>) configured).forEach((key, value) -> arguments.put(String.valueOf(key), value));
        }

        Map<String, Object> result = provider.invoke(toolName, arguments);

        Map<String, Object> output = baseOutput(node, input);
        output.put("tool_name", toolName);
        output.put(RESULT_KEY, result != null ? result : Map.of());
        return output;
    }

    @Override
    public ValidationResult validate(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        requireProperty(node, "toolName", result);
        return result;
    }
}
