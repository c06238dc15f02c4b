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

import dev.mars.agentflow.collaborator.LlmCompletionProvider;
import dev.mars.agentflow.collaborator.LlmRequest;
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
import java.util.Optional;

/**
 * Sends a prompt built from the node's prompts and its input data to the
 * LLM completion provider.
 *
 * <p>Recognised properties: {@code systemPrompt}, {@code userPrompt},
 * {@code assistantPrompt}, {@code agentRole}, {@code model},
 * {@code temperature} and {@code maxTokens}. One chat session is opened
 * per node per execution and closed when the execution ends.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class LlmAgentExecutor extends AbstractNodeExecutor {

    private static final Logger logger = LoggerFactory.getLogger(LlmAgentExecutor.class);

    public static final String RESPONSE_KEY = "llm_response";
    static final String SESSION_HANDLE_PREFIX = "llm.session.";

    private final LlmCompletionProvider provider;

    public LlmAgentExecutor(LlmCompletionProvider provider) {
        super(NodeTypes.LLM_AGENT);
        this.provider = Objects.requireNonNull(provider, "LLM provider cannot be null");
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws CollaboratorException {
        String sessionId = session(node, context);

        LlmRequest request = LlmRequest.builder()
                .sessionId(sessionId)
                .model(node.getStringProperty("model").orElse(null))
                .systemPrompt(node.getStringProperty("systemPrompt").orElse(null))
                .prompt(buildPrompt(node, input))
                .temperature(numberProperty(node, "temperature").map(Number::doubleValue).orElse(null))
                .maxTokens(numberProperty(node, "maxTokens").map(Number::intValue).orElse(null))
                .context(input)
                .build();

        String response = provider.complete(request);
        logger.debug("Node {} received {} characters from LLM", node.getId(), response != null ? response.length() : 0);

        Map<String, Object> output = baseOutput(node, input);
        output.put(RESPONSE_KEY, response);
        output.put("session_id", sessionId);
        node.getStringProperty("agentRole").ifPresent(role -> output.put("agent_role", role));
        return output;
    }

    @Override
    public ValidationResult validate(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        if (node.getStringProperty("userPrompt").isEmpty() && node.getStringProperty("systemPrompt").isEmpty()) {
            result.addWarning("nodes." + node.getId() + ".properties",
                    "LLM agent '" + node.getId() + "' has no prompt; its input data alone will be sent");
        }
        return result;
    }

    private String session(WorkflowNode node, NodeExecutionContext context) throws CollaboratorException {
        String key = SESSION_HANDLE_PREFIX + node.getId();
        Optional<String> existing = context.getHandle(key, String.class);
        if (existing.isPresent()) {
            return existing.get();
        }
        String sessionId = provider.openSession(context.getExecutionId(), node.getId());
        context.putHandle(key, sessionId);
        context.onClose(() -> provider.closeSession(sessionId));
        return sessionId;
    }

    private String buildPrompt(WorkflowNode node, Map<String, Object> input) {
        StringBuilder prompt = new StringBuilder();
        node.getStringProperty("agentRole").ifPresent(role ->
                prompt.append("Role: ").append(role).append("\n\n"));
        node.getStringProperty("userPrompt").ifPresent(user -> prompt.append(user).append("\n\n"));
        if (!input.isEmpty()) {
            prompt.append("Input data:\n");
            input.forEach((key, value) -> prompt.append(key).append(": ").append(value).append('\n'));
            prompt.append('\n');
        }
        node.getStringProperty("assistantPrompt").ifPresent(assistant -> prompt.append(assistant));
        return prompt.toString().trim();
    }

    private Optional<Number> numberProperty(WorkflowNode node, String key) {
        Object value = node.getProperties().get(key);
        if (value instanceof Number) {
            return Optional.of((Number) value);
        }
        if (value instanceof String) {
            try {
                return Optional.of(Double.parseDouble(((String) value).trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric {} on node {}: {}", key, node.getId(), value);
            }
        }
        return Optional.empty();
    }
}
