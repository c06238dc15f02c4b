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
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import dev.mars.agentflow.workflow.GraphFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static dev.mars.agentflow.workflow.GraphFixtures.FAILING;
import static dev.mars.agentflow.workflow.GraphFixtures.IDENTITY;
import static dev.mars.agentflow.workflow.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConcurrentOrchestrationStrategy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class ConcurrentOrchestrationStrategyTest {

    private ExecutorService branchExecutor;
    private ConcurrentOrchestrationStrategy strategy;

    @BeforeEach
    void setUp() {
        branchExecutor = Executors.newFixedThreadPool(4);
        strategy = new ConcurrentOrchestrationStrategy(branchExecutor);
    }

    @AfterEach
    void tearDown() {
        branchExecutor.shutdownNow();
    }

    @Test
    void testBranchesReceiveSameInputAndMergeByNodeId() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("fan-out")
                .orchestrationType(OrchestrationType.CONCURRENT)
                .node(node("left", IDENTITY))
                .node(node("right", IDENTITY))
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of("query", "status"));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(Map.of("query", "status"), result.getOutputData().get("left"));
        assertEquals(Map.of("query", "status"), result.getOutputData().get("right"));
        assertThat(run.getState().getSteps()).extracting(ExecutionStep::getInputData)
                .containsOnly(Map.of("query", "status"));
    }

    @Test
    void testStartEndAndIneligibleNodesAreExcluded() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("filtered")
                .orchestrationType(OrchestrationType.CONCURRENT)
                .node(node("start", NodeTypes.START_NODE))
                .node(node("worker", IDENTITY))
                .node(WorkflowNode.builder().id("serial").type(IDENTITY).parallelEligible(false).build())
                .node(WorkflowNode.builder().id("bystander").type(IDENTITY).participating(false).build())
                .node(node("end", NodeTypes.END_NODE))
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of());

        OrchestrationResult result = strategy.execute(run);

        assertThat(result.getOutputData()).containsOnlyKeys("worker");
        assertThat(run.getState().getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("worker");
    }

    @Test
    void testFailedBranchRecordedWhileOthersComplete() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("partial")
                .orchestrationType(OrchestrationType.CONCURRENT)
                .node(node("ok", IDENTITY))
                .node(node("broken", FAILING))
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of("a", 1));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertThat(result.getOutputData()).containsOnlyKeys("ok");
        assertEquals(2, run.getState().getSteps().size());
        assertEquals(1, run.getState().snapshot().getErrors().size());
        assertEquals(1, run.getState().snapshot().getFailedStepCount());
    }

    @Test
    void testNoEligibleBranchesThrows() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("empty")
                .orchestrationType(OrchestrationType.CONCURRENT)
                .node(node("start", NodeTypes.START_NODE))
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of());

        OrchestrationException exception = assertThrows(OrchestrationException.class, () -> strategy.execute(run));
        assertTrue(exception.getMessage().contains("empty"));
        assertTrue(run.getState().getSteps().isEmpty());
    }

    @Test
    void testCancelledRunStartsNoBranches() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("cancelled")
                .orchestrationType(OrchestrationType.CONCURRENT)
                .node(node("a", IDENTITY))
                .node(node("b", IDENTITY))
                .build();
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of());
        run.getControl().cancel();

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.CANCELLED, result.getStatus());
        assertTrue(run.getState().getSteps().isEmpty());
    }
}
