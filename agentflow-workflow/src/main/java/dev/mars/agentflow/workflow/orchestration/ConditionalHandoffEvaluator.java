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

package dev.mars.agentflow.workflow.orchestration;

import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.expression.ConditionEvaluator;
import dev.mars.agentflow.graph.NodeConnection;
import dev.mars.agentflow.graph.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Follows the first outgoing connection that has no condition or whose
 * condition holds for the node's output.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ConditionalHandoffEvaluator implements HandoffConditionEvaluator {

    private final ConditionEvaluator conditionEvaluator;

    public ConditionalHandoffEvaluator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
    }

    @Override
    public Optional<NodeConnection> selectHandoff(WorkflowNode current, List<NodeConnection> outgoing,
                                                  Map<String, Object> output) throws WorkflowValidationException {
        for (NodeConnection connection : outgoing) {
            if (!connection.getType().isOrdering()) {
                continue;
            }
            Optional<String> condition = connection.getCondition();
            if (condition.isEmpty() || conditionEvaluator.evaluate(condition.get(), output)) {
                return Optional.of(connection);
            }
        }
        return Optional.empty();
    }
}
