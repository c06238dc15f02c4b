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

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.core.exceptions.OrchestrationException;
import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Repeatedly asks a {@link NodeSelector} which participating node to run
 * next, chaining data through the chosen nodes. Stops when nothing is
 * selected or the iteration bound is reached; reaching the bound records an
 * orchestration error but the run still completes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class MagenticOrchestrationStrategy extends AbstractOrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(MagenticOrchestrationStrategy.class);

    private final NodeSelector selector;
    private final int maxIterations;

    public MagenticOrchestrationStrategy(NodeSelector selector, int maxIterations) {
        super(OrchestrationType.MAGENTIC);
        this.selector = Objects.requireNonNull(selector, "Node selector cannot be null");
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public OrchestrationResult execute(ExecutionRun run) throws AgentflowException {
        List<WorkflowNode> candidates = run.getGraph().getNodes().stream()
                .filter(WorkflowNode::isParticipating)
                .collect(Collectors.toList());
        Map<String, Object> data = run.getInputData();

        for (int iteration = 0; ; iteration++) {
            if (!run.awaitBoundary()) {
                return stopped(run, data);
            }
            Optional<WorkflowNode> next = selector.selectNext(candidates, data, run.getState().getSteps());
            if (next.isEmpty()) {
                logger.info("Magentic execution {} finished after {} iterations", run.getExecutionId(), iteration);
                break;
            }
            if (iteration >= maxIterations) {
                run.recordError(ErrorKind.ORCHESTRATION,
                        "Magentic orchestration stopped after reaching " + maxIterations + " iterations", null);
                break;
            }

            WorkflowNode node = next.get();
            if (!candidates.contains(node)) {
                throw new OrchestrationException("Selector chose node '" + node.getId()
                        + "' which is not a participating node");
            }

            NodeOutcome outcome = run.executeNode(node, data);
            if (outcome.isSkipped()) {
                return stopped(run, data);
            }
            if (outcome.isFailed()) {
                return OrchestrationResult.failed(data);
            }
            data = outcome.getOutput();
        }
        return OrchestrationResult.completed(data);
    }
}
