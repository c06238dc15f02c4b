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
import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.execution.ExecutionStatus;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.execution.WorkflowExecution;
import dev.mars.agentflow.graph.NodeRole;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import dev.mars.agentflow.workflow.GraphFixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static dev.mars.agentflow.workflow.GraphFixtures.participant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MagenticOrchestrationStrategy and the priority selector.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class MagenticOrchestrationStrategyTest {

    private WorkflowGraph team() {
        return WorkflowGraph.builder()
                .id("team")
                .orchestrationType(OrchestrationType.MAGENTIC)
                .node(participant("drafter", NodeRole.PRIMARY_EXECUTOR, 5))
                .node(participant("reviewer", NodeRole.VALIDATOR, 1))
                .node(participant("planner", NodeRole.COORDINATOR, 10))
                .node(WorkflowNode.builder().id("idle").type(GraphFixtures.SPEAKER).participating(false).build())
                .build();
    }

    @Test
    void testRunsParticipantsByPriority() throws Exception {
        MagenticOrchestrationStrategy strategy = new MagenticOrchestrationStrategy(new PriorityNodeSelector(), 10);
        ExecutionRun run = GraphFixtures.run(team(), GraphFixtures.registry(), Map.of("topic", "release notes"));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertThat(run.getState().getSteps()).extracting(ExecutionStep::getNodeId)
                .containsExactly("planner", "drafter", "reviewer");
        assertEquals("reviewer@0", result.getOutputData().get("message"));
        assertTrue(run.getState().snapshot().getErrors().isEmpty());
    }

    @Test
    void testIterationBoundRecordsErrorButCompletes() throws Exception {
        MagenticOrchestrationStrategy strategy = new MagenticOrchestrationStrategy(new PriorityNodeSelector(), 2);
        ExecutionRun run = GraphFixtures.run(team(), GraphFixtures.registry(), Map.of());

        OrchestrationResult result = strategy.execute(run);
        WorkflowExecution snapshot = run.getState().snapshot();

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(2, snapshot.getSteps().size());
        assertEquals(1, snapshot.getErrors().size());
        assertEquals(ErrorKind.ORCHESTRATION, snapshot.getErrors().get(0).getKind());
    }

    @Test
    void testNodeFailureAbortsLoop() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("faulty-team")
                .orchestrationType(OrchestrationType.MAGENTIC)
                .node(participant("planner", NodeRole.COORDINATOR, 10))
                .node(WorkflowNode.builder().id("broken").type(GraphFixtures.FAILING)
                        .role(NodeRole.PRIMARY_EXECUTOR).priority(5).build())
                .node(participant("reviewer", NodeRole.VALIDATOR, 1))
                .build();
        MagenticOrchestrationStrategy strategy = new MagenticOrchestrationStrategy(new PriorityNodeSelector(), 10);
        ExecutionRun run = GraphFixtures.run(graph, GraphFixtures.registry(), Map.of("topic", "outage"));

        OrchestrationResult result = strategy.execute(run);
        WorkflowExecution snapshot = run.getState().snapshot();

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertThat(snapshot.getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("planner", "broken");
        assertEquals(1, snapshot.getErrors().size());
        assertEquals(ErrorKind.NODE_EXECUTION, snapshot.getErrors().get(0).getKind());
        assertEquals("broken", snapshot.getErrors().get(0).getNodeId().orElseThrow());
    }

    @Test
    void testSelectorChoosingForeignNodeThrows() {
        WorkflowNode stranger = WorkflowNode.builder().id("stranger").type(GraphFixtures.SPEAKER).build();
        MagenticOrchestrationStrategy strategy = new MagenticOrchestrationStrategy(
                (candidates, data, steps) -> Optional.of(stranger), 5);
        ExecutionRun run = GraphFixtures.run(team(), GraphFixtures.registry(), Map.of());

        OrchestrationException exception = assertThrows(OrchestrationException.class, () -> strategy.execute(run));
        assertTrue(exception.getMessage().contains("stranger"));
    }

    @Test
    void testCustomSelectorCanFinishImmediately() throws Exception {
        MagenticOrchestrationStrategy strategy = new MagenticOrchestrationStrategy(
                (candidates, data, steps) -> Optional.empty(), 5);
        ExecutionRun run = GraphFixtures.run(team(), GraphFixtures.registry(), Map.of("k", "v"));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(Map.of("k", "v"), result.getOutputData());
        assertTrue(run.getState().getSteps().isEmpty());
    }

    @Test
    void testNonPositiveBoundRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new MagenticOrchestrationStrategy(new PriorityNodeSelector(), 0));
    }
}
