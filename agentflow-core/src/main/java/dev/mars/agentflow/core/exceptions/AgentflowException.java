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
 * Base exception class for all Agentflow-related exceptions.
 * Provides a common hierarchy for error handling throughout the system.
 * Each subclass reports the {@link ErrorKind} it is recorded under
 * when it ends up on an execution's error trail.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AgentflowException extends Exception {

    public AgentflowException(String message) {
        super(message);
    }

    public AgentflowException(String message, Throwable cause) {
        super(message, cause);
    }

    public AgentflowException(Throwable cause) {
        super(cause);
    }

    public ErrorKind getErrorKind() {
        return ErrorKind.ORCHESTRATION;
    }
}
