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

import dev.mars.agentflow.core.exceptions.OrchestrationException;
import dev.mars.agentflow.expression.ConditionEvaluator;
import dev.mars.agentflow.graph.NodeDependencyGraph;
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import dev.mars.agentflow.workflow.orchestration.custom.AgentExecutionStepHandler;
import dev.mars.agentflow.workflow.orchestration.custom.BranchStepHandler;
import dev.mars.agentflow.workflow.orchestration.custom.LoopStepHandler;
import dev.mars.agentflow.workflow.orchestration.custom.MergeResultsStepHandler;
import dev.mars.agentflow.workflow.orchestration.custom.ScriptContext;
import dev.mars.agentflow.workflow.orchestration.custom.StepHandler;
import dev.mars.agentflow.workflow.orchestration.custom.WaitConditionStepHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Interprets the graph's orchestration step script. A graph without a
 * script runs as one agent-execution step over all nodes in pipeline order.
 *
 * <p>Step failures are recorded and never retried. A failed step ends the
 * run as failed unless it is marked continue-on-error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CustomOrchestrationStrategy extends AbstractOrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(CustomOrchestrationStrategy.class);

    static final String IMPLICIT_STEP_ID = "implicit-pipeline";

    private final ConditionEvaluator conditionEvaluator;
    private final List<StepHandler> handlers;

    public CustomOrchestrationStrategy(ConditionEvaluator conditionEvaluator, long waitTimeoutMs,
                                       long waitPollIntervalMs, int loopMaxIterations) {
        super(OrchestrationType.CUSTOM);
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
        this.handlers = List.of(
                new AgentExecutionStepHandler(),
                new WaitConditionStepHandler(waitTimeoutMs, waitPollIntervalMs),
                new MergeResultsStepHandler(),
                new BranchStepHandler(),
                new LoopStepHandler(loopMaxIterations));
    }

    @Override
    public OrchestrationResult execute(ExecutionRun run) throws OrchestrationException {
        List<OrchestrationStep> script = run.getGraph().getOrchestrationSteps();
        if (script.isEmpty()) {
            script = List.of(implicitPipeline(run.getGraph()));
            logger.info("Custom execution {} has no script; running nodes in pipeline order", run.getExecutionId());
        } else {
            logger.info("Custom execution {} running {} script steps", run.getExecutionId(), script.size());
        }

        ScriptContext context = new ScriptContext(run, handlers, conditionEvaluator);
        context.runSteps(script);

        if (context.isStopped()) {
            return stopped(run, context.getCurrentData());
        }
        if (context.isFailed()) {
            return OrchestrationResult.failed(context.getCurrentData());
        }
        return OrchestrationResult.completed(context.getCurrentData());
    }

    private OrchestrationStep implicitPipeline(WorkflowGraph graph) throws OrchestrationException {
        List<String> nodeIds = new NodeDependencyGraph(graph).pipelineOrder().stream()
                .map(WorkflowNode::getId)
                .collect(Collectors.toList());
        return OrchestrationStep.builder()
                .id(IMPLICIT_STEP_ID)
                .type(OrchestrationStepType.AGENT_EXECUTION)
                .nodeIds(nodeIds)
                .build();
    }
}
