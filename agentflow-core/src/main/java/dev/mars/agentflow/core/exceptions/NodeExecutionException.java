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
 * Exception thrown when a node executor fails while processing its input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class NodeExecutionException extends AgentflowException {

    private final String nodeId;
    private final String nodeType;

    public NodeExecutionException(String nodeId, String nodeType, String message) {
        super(message);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
    }

    public NodeExecutionException(String nodeId, String nodeType, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeType() {
        return nodeType;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.NODE_EXECUTION;
    }
}
