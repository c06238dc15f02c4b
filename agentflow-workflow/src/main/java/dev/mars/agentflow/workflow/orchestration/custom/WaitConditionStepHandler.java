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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Polls the step's condition against the current data until it holds or
 * the step's {@code timeoutMs} elapses. Cancelling the run ends the wait.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WaitConditionStepHandler implements StepHandler {

    private static final Logger logger = LoggerFactory.getLogger(WaitConditionStepHandler.class);

    private final long defaultTimeoutMs;
    private final long pollIntervalMs;

    public WaitConditionStepHandler(long defaultTimeoutMs, long pollIntervalMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.pollIntervalMs = Math.max(1, pollIntervalMs);
    }

    @Override
    public OrchestrationStepType getStepType() {
        return OrchestrationStepType.WAIT_CONDITION;
    }

    @Override
    public Map<String, Object> handle(OrchestrationStep step, ScriptContext context) throws AgentflowException {
        String condition = step.getCondition()
                .orElseThrow(() -> new OrchestrationException("Wait step '" + step.getId() + "' has no condition"));
        long timeoutMs = step.getLongParameter(OrchestrationStep.PARAM_TIMEOUT_MS).orElse(defaultTimeoutMs);
        Map<String, Object> data = context.getCurrentData();

        long deadline = System.nanoTime() + timeoutMs * 1_000_000;
        while (true) {
            if (context.evaluate(condition, data)) {
                logger.debug("Wait step {} satisfied", step.getId());
                return data;
            }
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                throw new OrchestrationException("Wait step '" + step.getId() + "' timed out after "
                        + timeoutMs + "ms waiting for: " + condition);
            }
            if (!context.getRun().getControl().sleep(Math.min(pollIntervalMs, remainingMs))) {
                context.markStopped();
                return data;
            }
        }
    }
}
