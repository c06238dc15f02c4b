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

package dev.mars.agentflow.workflow.orchestration.custom;

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.execution.ExecutionError;

/**
 * Signals that a script step failed because a node it ran failed. The
 * node's error is already on the execution's error trail.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class StepFailedException extends AgentflowException {

    private final transient ExecutionError error;

    public StepFailedException(String stepId, ExecutionError error) {
        super("Step '" + stepId + "' failed: " + error.getMessage());
        this.error = error;
    }

    public ExecutionError getError() {
        return error;
    }

    @Override
    public ErrorKind getErrorKind() {
        return error.getKind();
    }
}
