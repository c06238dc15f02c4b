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

package dev.mars.agentflow.core.exceptions;

import dev.mars.agentflow.execution.ErrorKind;

/**
 * Thrown when a workflow cannot be found or its graph is malformed,
 * including references to unknown nodes and node types with no executor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class WorkflowValidationException extends AgentflowException {

    private final String workflowId;

    public WorkflowValidationException(String message) {
        this(null, message);
    }

    public WorkflowValidationException(String workflowId, String message) {
        super(message);
        this.workflowId = workflowId;
    }

    public WorkflowValidationException(String workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.VALIDATION;
    }
}
