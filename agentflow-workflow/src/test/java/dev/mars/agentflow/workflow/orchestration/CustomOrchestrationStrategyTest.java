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

import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.execution.ExecutionStatus;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.execution.WorkflowExecution;
import dev.mars.agentflow.expression.SpelConditionEvaluator;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import dev.mars.agentflow.workflow.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static dev.mars.agentflow.workflow.GraphFixtures.FAILING;
import static dev.mars.agentflow.workflow.GraphFixtures.IDENTITY;
import static dev.mars.agentflow.workflow.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CustomOrchestrationStrategy and its step handlers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class CustomOrchestrationStrategyTest {

    private CustomOrchestrationStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new CustomOrchestrationStrategy(new SpelConditionEvaluator(), 2000, 10, 10);
    }

    private static OrchestrationStep agents(String id, String... nodeIds) {
        return OrchestrationStep.builder()
                .id(id)
                .type(OrchestrationStepType.AGENT_EXECUTION)
                .nodeIds(List.of(nodeIds))
                .build();
    }

    private static WorkflowGraph.Builder scripted(String id) {
        return WorkflowGraph.builder()
                .id(id)
                .orchestrationType(OrchestrationType.CUSTOM)
                .node(node("a", IDENTITY))
                .node(node("b", IDENTITY))
                .node(node("broken", FAILING))
                .node(WorkflowNode.builder().id("inc").type(NodeTypes.FUNCTION_NODE)
                        .properties(Map.of("function", "increment")).build());
    }

    private ExecutionRun run(WorkflowGraph graph, Map<String, Object> input) {
        return GraphFixtures.run(graph, GraphFixtures.registry(), input);
    }

    private static List<String> nodeIds(ExecutionRun run) {
        return run.getState().getSteps().stream()
                .map(ExecutionStep::getNodeId)
                .collect(Collectors.toList());
    }

    @Test
    void testWithoutScriptRunsPipelineOrder() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .id("unscripted")
                .node(node("third", IDENTITY))
                .node(node("first", IDENTITY))
                .node(node("second", IDENTITY))
                .connect("first", "second")
                .connect("second", "third")
                .build();
        ExecutionRun run = run(graph, Map.of("doc", "v1"));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(Map.of("doc", "v1"), result.getOutputData());
        assertEquals(List.of("first", "second", "third"), nodeIds(run));
        assertEquals("implicit-pipeline", CustomOrchestrationStrategy.IMPLICIT_STEP_ID);
    }

    @Test
    void testFailedStepAbortsScript() throws Exception {
        WorkflowGraph graph = scripted("abort")
                .orchestrationStep(agents("s1", "broken"))
                .orchestrationStep(agents("s2", "a"))
                .build();
        ExecutionRun run = run(graph, Map.of());

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertEquals(List.of("broken"), nodeIds(run));
        assertEquals(ErrorKind.NODE_EXECUTION, run.getState().snapshot().getErrors().get(0).getKind());
    }

    @Test
    void testContinueOnErrorKeepsGoing() throws Exception {
        WorkflowGraph graph = scripted("tolerant")
                .orchestrationStep(OrchestrationStep.builder()
                        .id("s1")
                        .type(OrchestrationStepType.AGENT_EXECUTION)
                        .nodeId("broken")
                        .continueOnError(true)
                        .build())
                .orchestrationStep(agents("s2", "a"))
                .build();
        ExecutionRun run = run(graph, Map.of("x", 1));

        OrchestrationResult result = strategy.execute(run);

        assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
        assertEquals(Map.of("x", 1), result.getOutputData());
        assertEquals(List.of("broken", "a"), nodeIds(run));
        assertEquals(1, run.getState().snapshot().getErrors().size());
    }

    @Test
    void testStepsRunByOrderAndDisabledStepsSkipped() throws Exception {
        WorkflowGraph graph = scripted("ordered")
                .orchestrationStep(OrchestrationStep.builder().id("late").order(3)
                        .type(OrchestrationStepType.AGENT_EXECUTION).nodeId("a").build())
                .orchestrationStep(OrchestrationStep.builder().id("off").order(1).enabled(false)
                        .type(OrchestrationStepType.AGENT_EXECUTION).nodeId("broken").build())
                .orchestrationStep(OrchestrationStep.builder().id("early").order(2)
                        .type(OrchestrationStepType.AGENT_EXECUTION).nodeId("b").build())
                .build();
        ExecutionRun run = run(graph, Map.of());

        strategy.execute(run);

        assertEquals(List.of("b", "a"), nodeIds(run));
    }

    @Test
    void testUnknownNodeRecordedAsValidationError() throws Exception {
        WorkflowGraph graph = scripted("ghostly")
                .orchestrationStep(agents("s1", "ghost"))
                .build();
        ExecutionRun run = run(graph, Map.of());

        OrchestrationResult result = strategy.execute(run);
        WorkflowExecution snapshot = run.getState().snapshot();

        assertEquals(ExecutionStatus.FAILED, result.getStatus());
        assertTrue(snapshot.getSteps().isEmpty());
        assertEquals(ErrorKind.VALIDATION, snapshot.getErrors().get(0).getKind());
        assertThat(snapshot.getErrors().get(0).getMessage()).contains("ghost");
    }

    @Nested
    class WaitCondition {

        @Test
        void testTimesOutWithOrchestrationError() throws Exception {
            WorkflowGraph graph = scripted("impatient")
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("wait")
                            .type(OrchestrationStepType.WAIT_CONDITION)
                            .condition("['ready'] == true")
                            .parameters(Map.of(OrchestrationStep.PARAM_TIMEOUT_MS, 50))
                            .build())
                    .orchestrationStep(agents("after", "a"))
                    .build();
            ExecutionRun run = run(graph, Map.of("ready", false));

            OrchestrationResult result = strategy.execute(run);
            WorkflowExecution snapshot = run.getState().snapshot();

            assertEquals(ExecutionStatus.FAILED, result.getStatus());
            assertTrue(snapshot.getSteps().isEmpty());
            assertEquals(ErrorKind.ORCHESTRATION, snapshot.getErrors().get(0).getKind());
            assertThat(snapshot.getErrors().get(0).getMessage()).contains("timed out");
        }

        @Test
        void testProceedsOnceConditionHolds() throws Exception {
            AtomicBoolean gate = new AtomicBoolean(false);
            WorkflowGraph graph = scripted("gated")
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("wait")
                            .type(OrchestrationStepType.WAIT_CONDITION)
                            .condition("['gate'].get()")
                            .build())
                    .orchestrationStep(agents("after", "a"))
                    .build();
            ExecutionRun run = run(graph, Map.of("gate", gate));

            CompletableFuture<OrchestrationResult> pending = CompletableFuture.supplyAsync(() -> {
                try {
                    return strategy.execute(run);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            Thread.sleep(50);
            assertTrue(run.getState().getSteps().isEmpty());
            gate.set(true);

            OrchestrationResult result = pending.get(5, TimeUnit.SECONDS);
            assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
            assertEquals(List.of("a"), nodeIds(run));
        }

        @Test
        void testCancelEndsWait() throws Exception {
            WorkflowGraph graph = scripted("abandoned")
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("wait")
                            .type(OrchestrationStepType.WAIT_CONDITION)
                            .condition("['never'] == true")
                            .build())
                    .build();
            ExecutionRun run = run(graph, Map.of());

            CompletableFuture<OrchestrationResult> pending = CompletableFuture.supplyAsync(() -> {
                try {
                    return strategy.execute(run);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            Thread.sleep(50);
            run.getControl().cancel();

            assertEquals(ExecutionStatus.CANCELLED, pending.get(5, TimeUnit.SECONDS).getStatus());
        }
    }

    @Nested
    class Loop {

        @Test
        void testRepeatsWhileConditionHolds() throws Exception {
            WorkflowGraph graph = scripted("counting")
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("loop")
                            .type(OrchestrationStepType.LOOP)
                            .condition("['count'] < 3")
                            .child(agents("tick", "inc"))
                            .build())
                    .build();
            ExecutionRun run = run(graph, Map.of("count", 0));

            OrchestrationResult result = strategy.execute(run);

            assertEquals(ExecutionStatus.COMPLETED, result.getStatus());
            assertEquals(3, result.getOutputData().get("count"));
            assertEquals(3, run.getState().getSteps().size());
        }

        @Test
        void testStopsAtIterationBound() throws Exception {
            WorkflowGraph graph = scripted("bounded")
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("loop")
                            .type(OrchestrationStepType.LOOP)
                            .parameters(Map.of(OrchestrationStep.PARAM_MAX_ITERATIONS, 4))
                            .child(agents("tick", "inc"))
                            .build())
                    .build();
            ExecutionRun run = run(graph, Map.of("count", 0));

            OrchestrationResult result = strategy.execute(run);

            assertEquals(4, result.getOutputData().get("count"));
            assertEquals(4, run.getState().getSteps().size());
        }
    }

    @Nested
    class BranchAndMerge {

        private WorkflowGraph routed() {
            return scripted("routed")
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("route")
                            .type(OrchestrationStepType.BRANCH)
                            .condition("#priority == 'high'")
                            .child(agents("fast", "a"))
                            .alternate(agents("slow", "b"))
                            .build())
                    .build();
        }

        @Test
        void testBranchTakesChildrenWhenConditionHolds() throws Exception {
            ExecutionRun run = run(routed(), Map.of("priority", "high"));

            strategy.execute(run);

            assertEquals(List.of("a"), nodeIds(run));
        }

        @Test
        void testBranchTakesAlternatesOtherwise() throws Exception {
            ExecutionRun run = run(routed(), Map.of("priority", "low"));

            strategy.execute(run);

            assertEquals(List.of("b"), nodeIds(run));
        }

        @Test
        void testMergeCollectsNamedStepOutputs() throws Exception {
            WorkflowGraph graph = scripted("merged")
                    .orchestrationStep(agents("first", "a"))
                    .orchestrationStep(agents("counted", "inc"))
                    .orchestrationStep(OrchestrationStep.builder()
                            .id("merge")
                            .type(OrchestrationStepType.MERGE_RESULTS)
                            .sourceStepIds(List.of("first", "counted"))
                            .build())
                    .build();
            ExecutionRun run = run(graph, Map.of("count", 1));

            OrchestrationResult result = strategy.execute(run);

            assertThat(result.getOutputData()).containsOnlyKeys("first", "counted");
            assertEquals(Map.of("count", 1), result.getOutputData().get("first"));
            assertEquals(2, ((Map<?, ?>) result.getOutputData().get("counted")).get("count"));
            assertEquals(2, run.getState().getSteps().size());
        }
    }
}
