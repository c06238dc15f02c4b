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

/**
 * Lifecycle status of a workflow execution.
 *
 * The typical flow is:
 * RUNNING -> COMPLETED
 *
 * Alternative flows:
 * RUNNING -> PAUSED -> RUNNING (pause and resume at a node boundary)
 * RUNNING -> FAILED (run-fatal error)
 * RUNNING or PAUSED -> CANCELLED (stop request)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum ExecutionStatus {

    RUNNING("Execution in progress", false),

    PAUSED("Execution paused at a node boundary", false),

    COMPLETED("Execution completed", true),

    FAILED("Execution failed", true),

    CANCELLED("Execution cancelled", true);

    private final String description;
    private final boolean terminal;

    ExecutionStatus(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Terminal states cannot transition to other states.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Check if transition from this status to the target status is valid.
     *
     * @param target the target status to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case RUNNING:
                return target == PAUSED || target == COMPLETED ||
                       target == FAILED || target == CANCELLED;

            case PAUSED:
                return target == RUNNING || target == CANCELLED;

            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this status.
     *
     * @return array of valid target statuses
     */
    public ExecutionStatus[] getValidTransitions() {
        switch (this) {
            case RUNNING:
                return new ExecutionStatus[]{PAUSED, COMPLETED, FAILED, CANCELLED};
            case PAUSED:
                return new ExecutionStatus[]{RUNNING, CANCELLED};
            default:
                return new ExecutionStatus[0];
        }
    }
}
