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

package dev.mars.agentflow.workflow;

import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.execution.ExecutionError;
import dev.mars.agentflow.execution.ExecutionStatus;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.execution.WorkflowExecution;
import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.observability.ExecutionMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static dev.mars.agentflow.workflow.GraphFixtures.FAILING;
import static dev.mars.agentflow.workflow.GraphFixtures.GATE;
import static dev.mars.agentflow.workflow.GraphFixtures.IDENTITY;
import static dev.mars.agentflow.workflow.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for DefaultExecutionEngine lifecycle, tracking and queries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class DefaultExecutionEngineTest {

    private InMemoryWorkflowGraphRepository repository;
    private GraphFixtures.GateExecutor gate;
    private DefaultExecutionEngine engine;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowGraphRepository();
        gate = new GraphFixtures.GateExecutor();
        engine = DefaultExecutionEngine.builder()
                .graphRepository(repository)
                .nodeExecutors(GraphFixtures.registry(gate))
                .configuration(GraphFixtures.configuration())
                .build();
    }

    @AfterEach
    void tearDown() {
        gate.release();
        engine.shutdown();
    }

    private WorkflowExecution runToCompletion(String workflowId, Map<String, Object> input) throws Exception {
        String executionId = engine.startExecution(workflowId, input);
        return engine.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);
    }

    @Test
    void testStepsStrictlyOrderedAndReferenceGraphNodes() throws Exception {
        WorkflowGraph graph = GraphFixtures.identityPipeline("ordered", OrchestrationType.SEQUENTIAL, 6);
        repository.save(graph);

        WorkflowExecution execution = runToCompletion("ordered", Map.of("x", 1));

        List<ExecutionStep> steps = engine.listExecutionSteps(execution.getExecutionId());
        assertEquals(6, steps.size());
        Set<String> nodeIds = graph.getNodes().stream().map(WorkflowNode::getId).collect(Collectors.toSet());
        for (int i = 0; i < steps.size(); i++) {
            assertTrue(nodeIds.contains(steps.get(i).getNodeId()));
            if (i > 0) {
                assertTrue(steps.get(i).getStartedAt().isAfter(steps.get(i - 1).getStartedAt()));
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 5, 20})
    void testIdentityPipelineReturnsInputUnchanged(int length) throws Exception {
        repository.save(GraphFixtures.identityPipeline("identity", OrchestrationType.SEQUENTIAL, length));
        Map<String, Object> input = Map.of("document", "draft", "revision", 3);

        WorkflowExecution execution = runToCompletion("identity", input);

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(input, execution.getOutputData());
        assertEquals(length, execution.getSteps().size());
        assertTrue(execution.getErrors().isEmpty());
    }

    @Test
    void testConcurrentBranchFailureIsIsolated() throws Exception {
        int branches = 5;
        WorkflowGraph.Builder builder = WorkflowGraph.builder()
                .id("fan-out")
                .orchestrationType(OrchestrationType.CONCURRENT);
        for (int i = 1; i < branches; i++) {
            builder.node(node("b" + i, IDENTITY));
        }
        builder.node(node("broken", FAILING));
        repository.save(builder.build());

        WorkflowExecution execution = runToCompletion("fan-out", Map.of("seed", 42));

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(1, execution.getErrors().size());
        assertEquals(branches - 1, execution.getSuccessfulStepCount());
        assertEquals(ErrorKind.NODE_EXECUTION, execution.getErrors().get(0).getKind());
        assertEquals("broken", execution.getErrors().get(0).getNodeId().orElseThrow());
        assertThat(execution.getOutputData()).containsOnlyKeys("b1", "b2", "b3", "b4");
    }

    @Test
    void testHandoffCycleStopsAtFirstRevisit() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("relay")
                .orchestrationType(OrchestrationType.HANDOFF)
                .node(node("a", NodeTypes.START_NODE))
                .node(node("b", IDENTITY))
                .node(node("c", IDENTITY))
                .connect("a", "b")
                .connect("b", "c")
                .connect("c", "a")
                .build());

        WorkflowExecution execution = runToCompletion("relay", Map.of());

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertThat(execution.getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("a", "b", "c");
    }

    @Test
    void testCancelAfterFirstStep() throws Exception {
        repository.save(GraphFixtures.identityPipeline("cancel-me", OrchestrationType.SEQUENTIAL, 5));
        AtomicInteger completedSteps = new AtomicInteger();
        engine.addListener(new ExecutionListener() {
            @Override
            public void onStepCompleted(StepCompletedEvent event) {
                if (completedSteps.incrementAndGet() == 1) {
                    assertTrue(engine.stopExecution(event.executionId()));
                }
            }
        });

        WorkflowExecution execution = runToCompletion("cancel-me", Map.of());

        assertEquals(ExecutionStatus.CANCELLED, execution.getStatus());
        assertEquals(1, execution.getSteps().size());
        assertEquals(1, execution.getSuccessfulStepCount());

        // nothing is appended once cancelled
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() ->
                engine.getExecutionStatus(execution.getExecutionId()).orElseThrow().getSteps().size() == 1);
        assertEquals(ExecutionStatus.CANCELLED,
                engine.getExecutionStatus(execution.getExecutionId()).orElseThrow().getStatus());
    }

    @Test
    void testUnknownWorkflowIsRejected() {
        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
                () -> engine.startExecution("ghost", Map.of()));

        assertEquals(ErrorKind.VALIDATION, exception.getErrorKind());
        assertTrue(engine.listWorkflowExecutions("ghost").isEmpty());
        assertTrue(engine.getActiveExecutions().isEmpty());
    }

    @Test
    void testMalformedGraphIsRejectedWithoutRecord() {
        repository.save(WorkflowGraph.builder()
                .id("malformed")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("a", "NoSuchType"))
                .connect("a", "missing")
                .build());

        WorkflowValidationException exception = assertThrows(WorkflowValidationException.class,
                () -> engine.startExecution("malformed", Map.of()));

        assertThat(exception.getMessage()).contains("NoSuchType").contains("missing");
        assertTrue(engine.listWorkflowExecutions("malformed").isEmpty());
    }

    @Test
    void testSequentialFailureAbortsRun() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("abort")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("first", IDENTITY))
                .node(node("broken", FAILING))
                .node(node("never", IDENTITY))
                .connect("first", "broken")
                .connect("broken", "never")
                .build());

        WorkflowExecution execution = runToCompletion("abort", Map.of());

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertThat(execution.getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("first", "broken");
        List<ExecutionError> errors = engine.listExecutionErrors(execution.getExecutionId());
        assertEquals(1, errors.size());
        assertEquals(ErrorKind.NODE_EXECUTION, errors.get(0).getKind());
        assertTrue(errors.get(0).getStepId().isPresent());
    }

    @Test
    void testSequentialCycleFailsWithOrchestrationError() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("loop")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("a", IDENTITY))
                .node(node("b", IDENTITY))
                .connect("a", "b")
                .connect("b", "a")
                .build());

        WorkflowExecution execution = runToCompletion("loop", Map.of());

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertTrue(execution.getSteps().isEmpty());
        assertEquals(ErrorKind.ORCHESTRATION, execution.getErrors().get(0).getKind());
    }

    @Test
    void testUndeclaredOrchestrationRunsAsCustom() throws Exception {
        repository.save(GraphFixtures.identityPipeline("plain", null, 3));

        WorkflowExecution execution = runToCompletion("plain", Map.of("k", "v"));

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(3, execution.getSteps().size());
        assertEquals(Map.of("k", "v"), execution.getOutputData());
    }

    @Test
    void testPauseHoldsAtNodeBoundaryUntilResumed() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("pausable")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("held", GATE))
                .node(node("after", IDENTITY))
                .connect("held", "after")
                .build());

        String executionId = engine.startExecution("pausable", Map.of());
        assertTrue(gate.awaitEntered());

        assertTrue(engine.pauseExecution(executionId));
        assertFalse(engine.pauseExecution(executionId));
        gate.release();

        // the in-flight node finishes, the next one waits
        await().atMost(Duration.ofSeconds(5)).until(() ->
                engine.listExecutionSteps(executionId).stream().anyMatch(ExecutionStep::isSuccessful));
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() ->
                engine.listExecutionSteps(executionId).size() == 1);
        assertEquals(ExecutionStatus.PAUSED, engine.getExecutionStatus(executionId).orElseThrow().getStatus());

        assertTrue(engine.resumeExecution(executionId));
        WorkflowExecution execution = engine.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(2, execution.getSteps().size());
    }

    @Test
    void testStopPausedExecution() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("pause-then-stop")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("held", GATE))
                .node(node("after", IDENTITY))
                .connect("held", "after")
                .build());

        String executionId = engine.startExecution("pause-then-stop", Map.of());
        assertTrue(gate.awaitEntered());
        assertTrue(engine.pauseExecution(executionId));
        assertTrue(engine.stopExecution(executionId));
        gate.release();

        WorkflowExecution execution = engine.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);

        assertEquals(ExecutionStatus.CANCELLED, execution.getStatus());
        assertEquals(1, execution.getSteps().size());
        assertFalse(engine.resumeExecution(executionId));
        assertFalse(engine.stopExecution(executionId));
    }

    @Test
    void testLifecycleOperationsOnUnknownExecution() {
        assertFalse(engine.pauseExecution("nope"));
        assertFalse(engine.resumeExecution("nope"));
        assertFalse(engine.stopExecution("nope"));
        assertFalse(engine.stopExecution(null));
        assertTrue(engine.getExecutionStatus("nope").isEmpty());
        assertTrue(engine.listExecutionSteps("nope").isEmpty());
        assertTrue(engine.listExecutionErrors("nope").isEmpty());
    }

    @Test
    void testResumeRunningExecutionReturnsFalse() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("gated")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("held", GATE))
                .build());

        String executionId = engine.startExecution("gated", Map.of());
        assertTrue(gate.awaitEntered());

        assertFalse(engine.resumeExecution(executionId));
        assertEquals(1, engine.getActiveExecutions().size());
        gate.release();
        engine.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);
        assertTrue(engine.getActiveExecutions().isEmpty());
    }

    @Test
    void testAwaitCompletionOfUnknownExecutionFails() {
        CompletableFuture<WorkflowExecution> future = engine.awaitCompletion("unknown");

        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(WorkflowValidationException.class, exception.getCause());
    }

    @Test
    void testAwaitCompletionAfterFinishUsesHistory() throws Exception {
        repository.save(GraphFixtures.identityPipeline("done", OrchestrationType.SEQUENTIAL, 2));
        WorkflowExecution finished = runToCompletion("done", Map.of());

        WorkflowExecution again = engine.awaitCompletion(finished.getExecutionId()).get(1, TimeUnit.SECONDS);

        assertEquals(finished.getExecutionId(), again.getExecutionId());
        assertEquals(ExecutionStatus.COMPLETED, again.getStatus());
    }

    @Test
    void testListWorkflowExecutionsNewestFirst() throws Exception {
        repository.save(GraphFixtures.identityPipeline("history", OrchestrationType.SEQUENTIAL, 1));

        WorkflowExecution first = runToCompletion("history", Map.of("run", 1));
        WorkflowExecution second = runToCompletion("history", Map.of("run", 2));

        List<WorkflowExecution> executions = engine.listWorkflowExecutions("history");
        assertEquals(2, executions.size());
        assertFalse(executions.get(0).getStartedAt().isBefore(executions.get(1).getStartedAt()));
        assertThat(executions).extracting(WorkflowExecution::getExecutionId)
                .containsExactlyInAnyOrder(first.getExecutionId(), second.getExecutionId());
    }

    @Test
    void testStatusEventsPublished() throws Exception {
        repository.save(GraphFixtures.identityPipeline("observed", OrchestrationType.SEQUENTIAL, 2));
        List<ExecutionStatusChangedEvent> statusEvents = new CopyOnWriteArrayList<>();
        List<StepCompletedEvent> stepEvents = new CopyOnWriteArrayList<>();
        ExecutionListener listener = new ExecutionListener() {
            @Override
            public void onStatusChanged(ExecutionStatusChangedEvent event) {
                statusEvents.add(event);
            }

            @Override
            public void onStepCompleted(StepCompletedEvent event) {
                stepEvents.add(event);
            }
        };
        engine.addListener(listener);

        WorkflowExecution execution = runToCompletion("observed", Map.of());

        assertEquals(2, stepEvents.size());
        assertEquals(List.of("n1", "n2"),
                stepEvents.stream().map(StepCompletedEvent::nodeId).collect(Collectors.toList()));
        await().atMost(Duration.ofSeconds(2)).until(() -> statusEvents.size() == 1);
        assertEquals(ExecutionStatus.RUNNING, statusEvents.get(0).previousStatus());
        assertEquals(ExecutionStatus.COMPLETED, statusEvents.get(0).newStatus());
        assertEquals(execution.getExecutionId(), statusEvents.get(0).executionId());
        assertTrue(engine.removeListener(listener));
    }

    @Test
    void testFailingListenerDoesNotAffectRun() throws Exception {
        repository.save(GraphFixtures.identityPipeline("noisy", OrchestrationType.SEQUENTIAL, 3));
        engine.addListener(new ExecutionListener() {
            @Override
            public void onStepCompleted(StepCompletedEvent event) {
                throw new IllegalStateException("listener bug");
            }
        });

        WorkflowExecution execution = runToCompletion("noisy", Map.of());

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(3, execution.getSteps().size());
        assertTrue(execution.getErrors().isEmpty());
    }

    @Test
    void testResumeDuringPauseNotificationLeavesRunResumable() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("pause-resume")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("held", GATE))
                .node(node("after", IDENTITY))
                .connect("held", "after")
                .build());
        List<Boolean> resumeResults = new CopyOnWriteArrayList<>();
        engine.addListener(new ExecutionListener() {
            @Override
            public void onStatusChanged(ExecutionStatusChangedEvent event) {
                if (event.newStatus() == ExecutionStatus.PAUSED) {
                    resumeResults.add(engine.resumeExecution(event.executionId()));
                }
            }
        });

        String executionId = engine.startExecution("pause-resume", Map.of("k", "v"));
        assertTrue(gate.awaitEntered());
        assertTrue(engine.pauseExecution(executionId));
        await().atMost(Duration.ofSeconds(2)).until(() -> resumeResults.size() == 1);
        assertTrue(resumeResults.get(0));
        gate.release();

        WorkflowExecution execution = engine.awaitCompletion(executionId).get(10, TimeUnit.SECONDS);

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertThat(execution.getSteps()).extracting(ExecutionStep::getNodeId).containsExactly("held", "after");
        assertEquals(Map.of("k", "v"), execution.getOutputData());
    }

    @Test
    void testFailingNodePublishesExecutionError() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("error-events")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("first", IDENTITY))
                .node(node("broken", FAILING))
                .connect("first", "broken")
                .build());
        List<ExecutionErrorEvent> errorEvents = new CopyOnWriteArrayList<>();
        engine.addListener(new ExecutionListener() {
            @Override
            public void onExecutionError(ExecutionErrorEvent event) {
                errorEvents.add(event);
            }
        });

        WorkflowExecution execution = runToCompletion("error-events", Map.of());

        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        await().atMost(Duration.ofSeconds(2)).until(() -> errorEvents.size() == 1);
        ExecutionErrorEvent event = errorEvents.get(0);
        assertEquals(execution.getExecutionId(), event.executionId());
        assertEquals(ErrorKind.NODE_EXECUTION, event.error().getKind());
        assertEquals("broken", event.error().getNodeId().orElseThrow());
        assertEquals(execution.getErrors().get(0), event.error());
    }

    @Test
    void testRejectedSubmissionLeavesNoRecord() {
        repository.save(GraphFixtures.identityPipeline("rejected", OrchestrationType.SEQUENTIAL, 1));
        ExecutionMetrics metrics = mock(ExecutionMetrics.class);
        ExecutorService closedPool = Executors.newSingleThreadExecutor();
        closedPool.shutdown();
        DefaultExecutionEngine rejecting = DefaultExecutionEngine.builder()
                .graphRepository(repository)
                .nodeExecutors(GraphFixtures.registry(gate))
                .configuration(GraphFixtures.configuration())
                .metrics(metrics)
                .workerExecutor(closedPool)
                .build();
        try {
            assertThrows(IllegalStateException.class, () -> rejecting.startExecution("rejected", Map.of()));

            assertTrue(rejecting.listWorkflowExecutions("rejected").isEmpty());
            assertTrue(rejecting.getActiveExecutions().isEmpty());
            verify(metrics, never()).recordExecutionStarted(anyString(), anyString());
        } finally {
            rejecting.shutdown();
        }
    }

    @Test
    void testShutdownCancelsActiveExecutions() throws Exception {
        repository.save(WorkflowGraph.builder()
                .id("long-running")
                .orchestrationType(OrchestrationType.SEQUENTIAL)
                .node(node("held", GATE))
                .node(node("after", IDENTITY))
                .connect("held", "after")
                .build());
        String executionId = engine.startExecution("long-running", Map.of());
        assertTrue(gate.awaitEntered());

        engine.shutdown();
        gate.release();

        assertEquals(ExecutionStatus.CANCELLED, engine.getExecutionStatus(executionId).orElseThrow().getStatus());
        assertThrows(IllegalStateException.class, () -> engine.startExecution("long-running", Map.of()));
    }
}
