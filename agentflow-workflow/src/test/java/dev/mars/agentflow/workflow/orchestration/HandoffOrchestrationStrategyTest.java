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
import dev.mars.agentflow.execution.ExecutionStatus;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.expression.SpelConditionEvaluator;
import dev.mars.agentflow.graph.NodeConnection;
import dev.mars.agentflow.graph.NodeRole;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import dev.mars.agentflow.workflow.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static dev.mars.agentflow.workflow.GraphFixtures.FAILING;
import static dev.mars.agentflow.workflow.GraphFixtures.IDENTITY;
import static dev.mars.agentflow.workflow.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HandoffOrchestrationStrategy with the conditional handoff evaluator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class HandoffOrchestrationStrategyTest {

    private HandoffOrchestrationStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new HandoffOrchestrationStrategy(new ConditionalHandoffEvaluator(new SpelConditionEvaluator()));
    }

    private WorkflowGraph triage() {
        return WorkflowGraph.builder()
                .id("triage")
                .orchestrationType(OrchestrationType.HANDOFF)
                .node(node("intake", NodeTypes.START_NODE))
                .node(node("billing", IDENTITY))
                .node(node("support", IDENTITY))
                .connection(NodeConnection.conditional("intake", "billing", "['topic'] == 'invoice'"))
                .connection(NodeConnection.conditional("intake", "support", "['topic'] == 'outage'"))
                .build();
    }

    @Test
    void testFollowsFirstMatchingCondition() throws Exception {
        ExecutionRun run = GraphFixtures.run(triage(), GraphFixtures.registry(), Map.of("topic", "outage"));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertThat(run.getState().getSteps()).extracting(ExecutionStep::getNodeId)
                .containsExactly("intake", "support");
    }

    @Test
    void testStopsWhenNoConditionHolds() throws Exception {
        ExecutionRun run = GraphFixtures.run(triage(), GraphFixtures.registry(), Map.of("topic", "other"));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertThat(run.getState().getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("intake");
    }

    @Test
    void testStartsAtCoordinatorWithoutStartNode() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("coordinated")
                .orchestrationType(OrchestrationType.HANDOFF)
                .node(node("worker", IDENTITY))
                .node(WorkflowNode.builder().id("lead").type(IDENTITY).role(NodeRole.COORDINATOR).build())
                .connect("lead", "worker")
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of());

        strategy.execute(run);

        assertThat(run.getState().getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("lead", "worker");
    }

    @Test
    void testNoEntryPointThrows() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("headless")
                .orchestrationType(OrchestrationType.HANDOFF)
                .node(node("a", IDENTITY))
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of());

        assertThrows(OrchestrationException.class, () -> strategy.execute(run));
    }

    @Test
    void testFailedNodeEndsChain() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("broken-chain")
                .orchestrationType(OrchestrationType.HANDOFF)
                .node(node("start", NodeTypes.START_NODE))
                .node(node("broken", FAILING))
                .node(node("unreached", IDENTITY))
                .connect("start", "broken")
                .connect("broken", "unreached")
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of());

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertEquals(2, run.getState().getSteps().size());
    }
}
