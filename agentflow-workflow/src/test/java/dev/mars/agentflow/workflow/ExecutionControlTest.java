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

import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import dev.mars.agentflow.execution.ExecutionState;
import dev.mars.agentflow.execution.ExecutionStatus;
import dev.mars.agentflow.graph.OrchestrationType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionControl pause, resume and cancel.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class ExecutionControlTest {

    private ExecutionControl control;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        control = new ExecutionControl();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testBoundaryPassesWhenRunning() {
        assertTrue(control.awaitBoundary());
        assertFalse(control.isPaused());
        assertFalse(control.isCancelled());
    }

    @Test
    void testPausedBoundaryBlocksUntilResume() throws Exception {
        control.pause();
        Future<Boolean> boundary = executor.submit(control::awaitBoundary);

        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1)).until(() -> !boundary.isDone());

        control.resume();
        assertTrue(boundary.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testCancelReleasesPausedBoundary() throws Exception {
        control.pause();
        Future<Boolean> boundary = executor.submit(control::awaitBoundary);

        control.cancel();

        assertFalse(boundary.get(2, TimeUnit.SECONDS));
        assertFalse(control.awaitBoundary());
    }

    @Test
    void testSleepRunsFullTime() {
        long start = System.nanoTime();

        assertTrue(control.sleep(30));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 25);
    }

    @Test
    void testCancelWakesSleep() throws Exception {
        Future<Boolean> sleeping = executor.submit(() -> control.sleep(10_000));

        await().atMost(Duration.ofSeconds(1)).pollDelay(Duration.ofMillis(50)).until(() -> !sleeping.isDone());
        control.cancel();

        assertFalse(sleeping.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testTransitionKeepsPauseFlagInStepWithStatus() throws Exception {
        ExecutionState state = new ExecutionState("exec-1", "wf", OrchestrationType.SEQUENTIAL, Map.of(),
                Clock.systemUTC());

        assertEquals(ExecutionStatus.RUNNING, control.transition(state, ExecutionStatus.PAUSED));
        assertTrue(control.isPaused());
        Future<Boolean> boundary = executor.submit(control::awaitBoundary);

        assertEquals(ExecutionStatus.PAUSED, control.transition(state, ExecutionStatus.RUNNING));
        assertFalse(control.isPaused());
        assertTrue(boundary.get(2, TimeUnit.SECONDS));
        assertEquals(ExecutionStatus.RUNNING, state.getStatus());
    }

    @Test
    void testRejectedTransitionLeavesFlagsUntouched() throws Exception {
        ExecutionState state = new ExecutionState("exec-2", "wf", OrchestrationType.SEQUENTIAL, Map.of(),
                Clock.systemUTC());
        control.transition(state, ExecutionStatus.PAUSED);

        assertThrows(InvalidTransitionException.class, () -> control.transition(state, ExecutionStatus.COMPLETED));
        assertTrue(control.isPaused());
        assertEquals(ExecutionStatus.PAUSED, state.getStatus());

        control.transition(state, ExecutionStatus.CANCELLED);
        assertTrue(control.isCancelled());
        assertFalse(control.awaitBoundary());
    }
}
