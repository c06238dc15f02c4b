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
import dev.mars.agentflow.core.exceptions.OrchestrationException;
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;

import java.util.Map;

/**
 * Runs the child steps when the condition holds, the alternate steps otherwise.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class BranchStepHandler implements StepHandler {

    @Override
    public OrchestrationStepType getStepType() {
        return OrchestrationStepType.BRANCH;
    }

    @Override
    public Map<String, Object> handle(OrchestrationStep step, ScriptContext context) throws AgentflowException {
        String condition = step.getCondition()
                .orElseThrow(() -> new OrchestrationException("Branch step '" + step.getId() + "' has no condition"));
        boolean taken = context.evaluate(condition, context.getCurrentData());
        context.runSteps(taken ? step.getChildren() : step.getAlternates());
        return context.getCurrentData();
    }
}
