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
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Repeats the child steps while the optional condition holds, at most
 * {@code maxIterations} times.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class LoopStepHandler implements StepHandler {

    private static final Logger logger = LoggerFactory.getLogger(LoopStepHandler.class);

    private final int defaultMaxIterations;

    public LoopStepHandler(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    @Override
    public OrchestrationStepType getStepType() {
        return OrchestrationStepType.LOOP;
    }

    @Override
    public Map<String, Object> handle(OrchestrationStep step, ScriptContext context) throws AgentflowException {
        long maxIterations = step.getLongParameter(OrchestrationStep.PARAM_MAX_ITERATIONS)
                .orElse((long) defaultMaxIterations);
        Optional<String> condition = step.getCondition();

        int iteration = 0;
        while (iteration < maxIterations) {
            if (condition.isPresent() && !context.evaluate(condition.get(), context.getCurrentData())) {
                break;
            }
            if (!context.runSteps(step.getChildren())) {
                break;
            }
            iteration++;
        }
        logger.debug("Loop step {} ran {} iterations", step.getId(), iteration);
        return context.getCurrentData();
    }
}
