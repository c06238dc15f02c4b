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

package dev.mars.agentflow.workflow.orchestration.custom;

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import dev.mars.agentflow.workflow.orchestration.NodeOutcome;

import java.util.Map;

/**
 * Runs the step's nodes in order, each receiving the previous node's output.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AgentExecutionStepHandler implements StepHandler {

    @Override
    public OrchestrationStepType getStepType() {
        return OrchestrationStepType.AGENT_EXECUTION;
    }

    @Override
    public Map<String, Object> handle(OrchestrationStep step, ScriptContext context) throws AgentflowException {
        ExecutionRun run = context.getRun();
        Map<String, Object> data = context.getCurrentData();

        for (int i = 0; i < step.getNodeIds().size(); i++) {
            String nodeId = step.getNodeIds().get(i);
            WorkflowNode node = run.getGraph().getNode(nodeId)
                    .orElseThrow(() -> new WorkflowValidationException(run.getGraph().getId(),
                            "Step '" + step.getId() + "' references unknown node '" + nodeId + "'"));

            if (i > 0 && !context.checkpoint()) {
                return data;
            }
            NodeOutcome outcome = run.executeNode(node, data);
            if (outcome.isSkipped()) {
                context.markStopped();
                return data;
            }
            if (outcome.isFailed()) {
                throw new StepFailedException(step.getId(), outcome.getError().orElseThrow());
            }
            data = outcome.getOutput();
        }
        return data;
    }
}
