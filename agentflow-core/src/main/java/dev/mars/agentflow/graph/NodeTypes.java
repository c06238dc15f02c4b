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

/**
 * Type tags of the built-in node kinds.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class NodeTypes {

    public static final String START_NODE = "StartNode";
    public static final String END_NODE = "EndNode";
    public static final String LLM_AGENT = "LLMAgent";
    public static final String TOOL_AGENT = "ToolAgent";
    public static final String MCP_AGENT = "MCPAgent";
    public static final String FUNCTION_NODE = "FunctionNode";
    public static final String CONDITIONAL_AGENT = "ConditionalAgent";
    public static final String PARALLEL_AGENT = "ParallelAgent";
    public static final String CHECKPOINT_AGENT = "CheckpointAgent";

    private NodeTypes() {
    }

    public static boolean isStart(String type) {
        return START_NODE.equals(type);
    }

    public static boolean isEnd(String type) {
        return END_NODE.equals(type);
    }
}
