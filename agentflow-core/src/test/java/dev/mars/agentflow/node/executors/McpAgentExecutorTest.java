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
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.NodeExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for McpAgentExecutor connection reuse.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class McpAgentExecutorTest {

    @Mock
    private ProtocolClient client;

    private McpAgentExecutor executor;
    private NodeExecutionContext context;
    private WorkflowNode node;

    @BeforeEach
    void setUp() throws CollaboratorException {
        MockitoAnnotations.openMocks(this);
        when(client.getStatus("files")).thenReturn(ProtocolConnectionStatus.CONNECTED);
        when(client.callTool(eq("files"), eq("list"), anyMap())).thenReturn(Map.of("count", 3));

        executor = new McpAgentExecutor(client);
        context = new NodeExecutionContext("exec-1", "wf-1");
        node = WorkflowNode.builder()
                .id("lister")
                .type(NodeTypes.MCP_AGENT)
                .properties(Map.of("serverId", "files", "toolName", "list"))
                .build();
    }

    @Test
    void testConnectsOncePerExecution() throws CollaboratorException {
        Map<String, Object> first = executor.execute(node, Map.of("dir", "/tmp"), context);
        executor.execute(node, Map.of("dir", "/var"), context);

        verify(client, times(1)).connect("files");
        verify(client, times(2)).callTool(eq("files"), eq("list"), anyMap());
        assertEquals(Map.of("count", 3), first.get(McpAgentExecutor.RESULT_KEY));
        assertEquals("files", first.get("mcp_server"));
        assertEquals("list", first.get("mcp_tool"));

        context.close();
        verify(client).disconnect("files");
    }

    @Test
    void testSeparateExecutionsGetSeparateConnections() throws CollaboratorException {
        NodeExecutionContext other = new NodeExecutionContext("exec-2", "wf-1");

        executor.execute(node, Map.of(), context);
        executor.execute(node, Map.of(), other);

        verify(client, times(2)).connect("files");
    }

    @Test
    void testUnusableConnectionFails() throws CollaboratorException {
        when(client.getStatus("files")).thenReturn(ProtocolConnectionStatus.ERROR);

        assertThrows(CollaboratorException.class, () -> executor.execute(node, Map.of(), context));
        verify(client, never()).callTool(anyString(), anyString(), any());
        assertEquals(0, context.getHandleCount());
    }

    @Test
    void testValidateRequiresServerAndTool() {
        WorkflowNode incomplete = WorkflowNode.builder()
                .id("incomplete")
                .type(NodeTypes.MCP_AGENT)
                .properties(Map.of("serverId", "files"))
                .build();

        assertTrue(executor.validate(node).isValid());
        assertEquals(1, executor.validate(incomplete).getErrorCount());
    }
}
