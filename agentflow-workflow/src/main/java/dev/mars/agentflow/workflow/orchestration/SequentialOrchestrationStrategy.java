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
import dev.mars.agentflow.graph.NodeDependencyGraph;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs every node once in pipeline order, feeding each node's output to the
 * next. The first node failure ends the run as failed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class SequentialOrchestrationStrategy extends AbstractOrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SequentialOrchestrationStrategy.class);

    public SequentialOrchestrationStrategy() {
        super(OrchestrationType.SEQUENTIAL);
    }

    @Override
    public OrchestrationResult execute(ExecutionRun run) throws OrchestrationException {
        List<WorkflowNode> pipeline = new NodeDependencyGraph(run.getGraph()).pipelineOrder();
        logger.info("Sequential execution {} over {} nodes", run.getExecutionId(), pipeline.size());

        Map<String, Object> current = run.getInputData();
        for (WorkflowNode node : pipeline) {
            if (!run.awaitBoundary()) {
                return stopped(run, current);
            }
            NodeOutcome outcome = run.executeNode(node, current);
            if (outcome.isSkipped()) {
                return stopped(run, current);
            }
            if (outcome.isFailed()) {
                logger.info("Sequential execution {} aborted at node {}", run.getExecutionId(), node.getId());
                return OrchestrationResult.failed(current);
            }
            current = outcome.getOutput();
        }
        return OrchestrationResult.completed(current);
    }
}
