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
import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.expression.ConditionEvaluator;
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Interpreter state for one custom script run: the current data, the
 * outputs of finished steps and whether the script has been halted by a
 * failure or a cancellation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ScriptContext {

    private static final Logger logger = LoggerFactory.getLogger(ScriptContext.class);

    private final ExecutionRun run;
    private final Map<OrchestrationStepType, StepHandler> handlers;
    private final ConditionEvaluator conditionEvaluator;
    private final Map<String, Map<String, Object>> stepOutputs = new LinkedHashMap<>();
    private Map<String, Object> currentData;
    private boolean failed;
    private boolean stopped;

    public ScriptContext(ExecutionRun run, List<StepHandler> handlers, ConditionEvaluator conditionEvaluator) {
        this.run = Objects.requireNonNull(run, "Execution run cannot be null");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
        this.handlers = new EnumMap<>(OrchestrationStepType.class);
        for (StepHandler handler : handlers) {
            this.handlers.put(handler.getStepType(), handler);
        }
        this.currentData = run.getInputData();
    }

    /**
     * Runs the enabled steps in order.
     *
     * @return false if the script was halted
     */
    public boolean runSteps(List<OrchestrationStep> steps) {
        List<OrchestrationStep> ordered = steps.stream()
                .sorted(Comparator.comparingInt(OrchestrationStep::getOrder))
                .collect(Collectors.toList());

        for (OrchestrationStep step : ordered) {
            if (isHalted()) {
                return false;
            }
            if (!step.isEnabled()) {
                logger.debug("Skipping disabled step {}", step.getId());
                continue;
            }
            if (!checkpoint()) {
                return false;
            }

            try {
                Map<String, Object> output = handlerFor(step).handle(step, this);
                if (isHalted()) {
                    return false;
                }
                stepOutputs.put(step.getId(), output);
                currentData = output;
            } catch (StepFailedException e) {
                if (!continueAfterFailure(step)) {
                    return false;
                }
            } catch (AgentflowException e) {
                run.recordError(e, null);
                if (!continueAfterFailure(step)) {
                    return false;
                }
            }
        }
        return !isHalted();
    }

    /**
     * Node boundary check. Marks the script stopped when the run may not go on.
     */
    public boolean checkpoint() {
        if (!run.awaitBoundary()) {
            stopped = true;
            return false;
        }
        return true;
    }

    public boolean evaluate(String condition, Map<String, Object> data) throws WorkflowValidationException {
        return conditionEvaluator.evaluate(condition, data);
    }

    public ExecutionRun getRun() {
        return run;
    }

    public Map<String, Object> getCurrentData() {
        return currentData;
    }

    public Map<String, Map<String, Object>> getStepOutputs() {
        return Collections.unmodifiableMap(stepOutputs);
    }

    public void markStopped() {
        stopped = true;
    }

    public boolean isFailed() {
        return failed;
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isHalted() {
        return failed || stopped;
    }

    private boolean continueAfterFailure(OrchestrationStep step) {
        if (step.isContinueOnError()) {
            logger.info("Step {} failed; continuing as it allows errors", step.getId());
            return true;
        }
        logger.info("Step {} failed; aborting script", step.getId());
        failed = true;
        return false;
    }

    private StepHandler handlerFor(OrchestrationStep step) throws OrchestrationException {
        StepHandler handler = handlers.get(step.getType());
        if (handler == null) {
            throw new OrchestrationException("No handler for step type " + step.getType());
        }
        return handler;
    }
}
