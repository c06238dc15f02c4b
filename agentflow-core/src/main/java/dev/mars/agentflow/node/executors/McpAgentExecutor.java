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

import dev.mars.agentflow.collaborator.ProtocolClient;
import dev.mars.agentflow.collaborator.ProtocolConnectionStatus;
import dev.mars.agentflow.core.exceptions.CollaboratorException;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.AbstractNodeExecutor;
import dev.mars.agentflow.node.NodeExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Calls a tool on a protocol server. The connection to each server is opened
 * once per execution, on first use, and closed when the execution ends.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class McpAgentExecutor extends AbstractNodeExecutor {

    private static final Logger logger = LoggerFactory.getLogger(McpAgentExecutor.class);

    public static final String RESULT_KEY = "mcp_result";
    static final String CONNECTION_HANDLE_PREFIX = "mcp.connection.";

    private final ProtocolClient client;

    public McpAgentExecutor(ProtocolClient client) {
        super(NodeTypes.MCP_AGENT);
        this.client = Objects.requireNonNull(client, "Protocol client cannot be null");
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws CollaboratorException {
        String serverId = node.getStringProperty("serverId")
                .orElseThrow(() -> new CollaboratorException(getNodeType(),
                        "MCP agent '" + node.getId() + "' has no serverId"));
        String toolName = node.getStringProperty("toolName")
                .orElseThrow(() -> new CollaboratorException(getNodeType(),
                        "MCP agent '" + node.getId() + "' has no toolName"));

        ensureConnected(serverId, context);
        Map<String, Object> result = client.callTool(serverId, toolName, input);

        Map<String, Object> output = baseOutput(node, input);
        output.put("mcp_server", serverId);
        output.put("mcp_tool", toolName);
        output.put(RESULT_KEY, result != null ? result : Map.of());
        return output;
    }

    @Override
    public ValidationResult validate(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        requireProperty(node, "serverId", result);
        requireProperty(node, "toolName", result);
        return result;
    }

    private void ensureConnected(String serverId, NodeExecutionContext context) throws CollaboratorException {
        String key = CONNECTION_HANDLE_PREFIX + serverId;
        synchronized (context) {
            if (context.getHandle(key, String.class).isPresent()) {
                return;
            }
            client.connect(serverId);
            ProtocolConnectionStatus status = client.getStatus(serverId);
            if (!status.isUsable()) {
                throw new CollaboratorException(getNodeType(),
                        "Protocol server '" + serverId + "' is " + status + " after connect");
            }
            logger.info("Connected to protocol server {} for execution {}", serverId, context.getExecutionId());
            context.putHandle(key, serverId);
            context.onClose(() -> client.disconnect(serverId));
        }
    }
}
