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

import dev.mars.agentflow.core.exceptions.AgentflowException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An error recorded on an execution, optionally tied to the node and step
 * that produced it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class ExecutionError {

    private final String id;
    private final String message;
    private final ErrorKind kind;
    private final String errorType;
    private final Instant occurredAt;
    private final String nodeId;
    private final String stepId;

    public ExecutionError(String id, String message, ErrorKind kind, String errorType,
                          Instant occurredAt, String nodeId, String stepId) {
        this.id = Objects.requireNonNull(id, "Error ID cannot be null");
        this.message = message != null ? message : "";
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.errorType = errorType;
        this.occurredAt = Objects.requireNonNull(occurredAt, "Occurred-at cannot be null");
        this.nodeId = nodeId;
        this.stepId = stepId;
    }

    /**
     * Builds an error from a thrown exception. Agentflow exceptions carry their
     * own kind; anything else raised by a node is classed as a node failure.
     */
    public static ExecutionError from(Throwable failure, String nodeId, String stepId, Instant occurredAt) {
        Objects.requireNonNull(failure, "Failure cannot be null");
        ErrorKind kind = failure instanceof AgentflowException
                ? ((AgentflowException) failure).getErrorKind()
                : ErrorKind.NODE_EXECUTION;
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new ExecutionError(UUID.randomUUID().toString(), message, kind,
                failure.getClass().getName(), occurredAt, nodeId, stepId);
    }

    public static ExecutionError of(ErrorKind kind, String message, String nodeId, Instant occurredAt) {
        return new ExecutionError(UUID.randomUUID().toString(), message, kind, null, occurredAt, nodeId, null);
    }

    /**
     * Returns a copy of this error attributed to the given step.
     */
    public ExecutionError withStep(String nodeId, String stepId) {
        return new ExecutionError(id, message, kind, errorType, occurredAt, nodeId, stepId);
    }

    public String getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<String> getErrorType() {
        return Optional.ofNullable(errorType);
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public Optional<String> getNodeId() {
        return Optional.ofNullable(nodeId);
    }

    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionError that = (ExecutionError) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ExecutionError{" +
                "kind=" + kind +
                ", message='" + message + '\'' +
                ", nodeId='" + nodeId + '\'' +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
