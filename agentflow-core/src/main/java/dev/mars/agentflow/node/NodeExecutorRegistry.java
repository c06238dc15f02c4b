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

import dev.mars.agentflow.collaborator.LlmCompletionProvider;
import dev.mars.agentflow.collaborator.ProtocolClient;
import dev.mars.agentflow.collaborator.ToolInvocationProvider;
import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.core.exceptions.NodeExecutionException;
import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.expression.ConditionEvaluator;
import dev.mars.agentflow.expression.SpelConditionEvaluator;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.executors.CheckpointAgentExecutor;
import dev.mars.agentflow.node.executors.ConditionalAgentExecutor;
import dev.mars.agentflow.node.executors.EndNodeExecutor;
import dev.mars.agentflow.node.executors.FunctionNodeExecutor;
import dev.mars.agentflow.node.executors.LlmAgentExecutor;
import dev.mars.agentflow.node.executors.McpAgentExecutor;
import dev.mars.agentflow.node.executors.ParallelAgentExecutor;
import dev.mars.agentflow.node.executors.StartNodeExecutor;
import dev.mars.agentflow.node.executors.ToolAgentExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a node's type tag to its {@link NodeExecutor} and runs it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class NodeExecutorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(NodeExecutorRegistry.class);

    private final Map<String, NodeExecutor> executors = new ConcurrentHashMap<>();

    public NodeExecutorRegistry() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers an executor, replacing any executor already registered for its type.
     *
     * @return this registry
     */
    public NodeExecutorRegistry register(NodeExecutor executor) {
        Objects.requireNonNull(executor, "Executor cannot be null");
        String type = Objects.requireNonNull(executor.getNodeType(), "Executor node type cannot be null");
        NodeExecutor previous = executors.put(type, executor);
        if (previous != null) {
            logger.info("Replaced executor for node type {}", type);
        }
        return this;
    }

    public Optional<NodeExecutor> getExecutor(String nodeType) {
        return nodeType == null ? Optional.empty() : Optional.ofNullable(executors.get(nodeType));
    }

    public boolean supports(String nodeType) {
        return getExecutor(nodeType).isPresent();
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(executors.keySet());
    }

    /**
     * Runs the node with the executor registered for its type. Unchecked
     * exceptions escaping an executor are reported as node failures.
     *
     * @throws WorkflowValidationException if no executor handles the node's type
     * @throws AgentflowException          if the executor fails
     */
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws AgentflowException {
        Objects.requireNonNull(node, "Node cannot be null");
        NodeExecutor executor = getExecutor(node.getType()).orElseThrow(() -> new WorkflowValidationException(
                context.getWorkflowId(),
                "No executor registered for node type '" + node.getType() + "' (node '" + node.getId() + "')"));

        logger.debug("Executing node {} ({})", node.getId(), node.getType());
        try {
            Map<String, Object> output = executor.execute(node, input != null ? input : Map.of(), context);
            return output != null ? output : Map.of();
        } catch (RuntimeException e) {
            throw new NodeExecutionException(node.getId(), node.getType(),
                    "Node '" + node.getId() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Checks that every node has an executor and that each executor accepts
     * the shape of its nodes.
     */
    public ValidationResult validate(WorkflowGraph graph) {
        ValidationResult result = new ValidationResult();
        for (WorkflowNode node : graph.getNodes()) {
            Optional<NodeExecutor> executor = getExecutor(node.getType());
            if (executor.isEmpty()) {
                result.addError("nodes." + node.getId() + ".type",
                        "No executor registered for node type '" + node.getType() + "'");
            } else {
                result.merge(executor.get().validate(node));
            }
        }
        return result;
    }

    /**
     * Builds a registry holding the built-in executors. Executors whose
     * collaborator was not supplied are left out, so nodes of that type fail
     * validation.
     */
    public static class Builder {
        private ConditionEvaluator conditionEvaluator = new SpelConditionEvaluator();
        private LlmCompletionProvider llmProvider;
        private ToolInvocationProvider toolProvider;
        private ProtocolClient protocolClient;
        private final Map<String, NodeFunction> functions = new LinkedHashMap<>();
        private final Map<String, NodeExecutor> customExecutors = new LinkedHashMap<>();

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
            return this;
        }

        public Builder llmProvider(LlmCompletionProvider llmProvider) {
            this.llmProvider = llmProvider;
            return this;
        }

        public Builder toolProvider(ToolInvocationProvider toolProvider) {
            this.toolProvider = toolProvider;
            return this;
        }

        public Builder protocolClient(ProtocolClient protocolClient) {
            this.protocolClient = protocolClient;
            return this;
        }

        public Builder function(String name, NodeFunction function) {
            this.functions.put(Objects.requireNonNull(name, "Function name cannot be null"),
                    Objects.requireNonNull(function, "Function cannot be null"));
            return this;
        }

        public Builder executor(NodeExecutor executor) {
            this.customExecutors.put(executor.getNodeType(), executor);
            return this;
        }

        public NodeExecutorRegistry build() {
            NodeExecutorRegistry registry = new NodeExecutorRegistry();
            registry.register(new StartNodeExecutor());
            registry.register(new EndNodeExecutor());
            registry.register(new ConditionalAgentExecutor(conditionEvaluator));
            registry.register(new ParallelAgentExecutor());
            registry.register(new CheckpointAgentExecutor());
            registry.register(new FunctionNodeExecutor(functions));
            if (llmProvider != null) {
                registry.register(new LlmAgentExecutor(llmProvider));
            }
            if (toolProvider != null) {
                registry.register(new ToolAgentExecutor(toolProvider));
            }
            if (protocolClient != null) {
                registry.register(new McpAgentExecutor(protocolClient));
            }
            customExecutors.values().forEach(registry::register);
            return registry;
        }
    }
}
