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

package dev.mars.agentflow.execution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionStatus state machine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
class ExecutionStatusTest {

    @Test
    void testRunningTransitions() {
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PAUSED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.CANCELLED));
        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.RUNNING));
    }

    @Test
    void testPausedTransitions() {
        assertTrue(ExecutionStatus.PAUSED.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.PAUSED.canTransitionTo(ExecutionStatus.CANCELLED));
        assertFalse(ExecutionStatus.PAUSED.canTransitionTo(ExecutionStatus.COMPLETED));
        assertFalse(ExecutionStatus.PAUSED.canTransitionTo(ExecutionStatus.FAILED));
        assertEquals(2, ExecutionStatus.PAUSED.getValidTransitions().length);
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void testTerminalStatusesHaveNoTransitions(ExecutionStatus status) {
        assertTrue(status.isTerminal());
        assertFalse(status.isActive());
        assertEquals(0, status.getValidTransitions().length);
        for (ExecutionStatus target : ExecutionStatus.values()) {
            assertFalse(status.canTransitionTo(target));
        }
    }

    @Test
    void testActiveStatuses() {
        assertTrue(ExecutionStatus.RUNNING.isActive());
        assertTrue(ExecutionStatus.PAUSED.isActive());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
    }
}
