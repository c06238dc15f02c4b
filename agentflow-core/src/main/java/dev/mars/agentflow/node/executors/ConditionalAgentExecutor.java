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

import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.expression.ConditionEvaluator;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.AbstractNodeExecutor;
import dev.mars.agentflow.node.NodeExecutionContext;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates the node's {@code condition} against its input and emits the
 * result as {@code branch}, for conditional connections downstream to test.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ConditionalAgentExecutor extends AbstractNodeExecutor {

    public static final String BRANCH_KEY = "branch";

    private final ConditionEvaluator evaluator;

    public ConditionalAgentExecutor(ConditionEvaluator evaluator) {
        super(NodeTypes.CONDITIONAL_AGENT);
        this.evaluator = Objects.requireNonNull(evaluator, "Condition evaluator cannot be null");
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context)
            throws WorkflowValidationException {
        String condition = node.getStringProperty("condition")
                .orElseThrow(() -> new WorkflowValidationException(context.getWorkflowId(),
                        "Conditional agent '" + node.getId() + "' has no condition"));
        boolean branch = evaluator.evaluate(condition, input);

        Map<String, Object> output = baseOutput(node, input);
        output.put(BRANCH_KEY, branch);
        return output;
    }

    @Override
    public ValidationResult validate(WorkflowNode node) {
        ValidationResult result = new ValidationResult();
        requireProperty(node, "condition", result);
        requireOutputPorts(node, 2, result);
        return result;
    }
}
