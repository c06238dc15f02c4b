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
import dev.mars.agentflow.graph.NodeConnection;
import dev.mars.agentflow.graph.NodeRole;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Starts at the start node (or the first coordinator) and hands control
 * along one outgoing connection at a time. The chain ends when no handoff
 * is chosen or a node would run a second time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class HandoffOrchestrationStrategy extends AbstractOrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(HandoffOrchestrationStrategy.class);

    private final HandoffConditionEvaluator handoffEvaluator;

    public HandoffOrchestrationStrategy(HandoffConditionEvaluator handoffEvaluator) {
        super(OrchestrationType.HANDOFF);
        this.handoffEvaluator = Objects.requireNonNull(handoffEvaluator, "Handoff evaluator cannot be null");
    }

    @Override
    public OrchestrationResult execute(ExecutionRun run) throws AgentflowException {
        WorkflowGraph graph = run.getGraph();
        WorkflowNode current = findStartNode(graph);
        Set<String> visited = new HashSet<>();
        Map<String, Object> data = run.getInputData();

        while (current != null) {
            if (!visited.add(current.getId())) {
                logger.info("Handoff execution {} ends at revisit of node {}", run.getExecutionId(), current.getId());
                break;
            }
            if (!run.awaitBoundary()) {
                return stopped(run, data);
            }

            NodeOutcome outcome = run.executeNode(current, data);
            if (outcome.isSkipped()) {
                return stopped(run, data);
            }
            if (outcome.isFailed()) {
                return OrchestrationResult.failed(data);
            }
            data = outcome.getOutput();

            Optional<NodeConnection> handoff = handoffEvaluator.selectHandoff(current,
                    graph.getOutgoingConnections(current.getId()), data);
            String from = current.getId();
            current = handoff.flatMap(connection -> graph.getNode(connection.getToNodeId())).orElse(null);
            if (current != null) {
                logger.debug("Handoff {} -> {}", from, current.getId());
            }
        }
        return OrchestrationResult.completed(data);
    }

    private WorkflowNode findStartNode(WorkflowGraph graph) throws OrchestrationException {
        return graph.getNodes().stream()
                .filter(WorkflowNode::isStartNode)
                .findFirst()
                .or(() -> graph.getNodes().stream()
                        .filter(node -> node.hasRole(NodeRole.COORDINATOR))
                        .findFirst())
                .orElseThrow(() -> new OrchestrationException("Handoff workflow '" + graph.getId()
                        + "' has no start node or coordinator"));
    }
}
