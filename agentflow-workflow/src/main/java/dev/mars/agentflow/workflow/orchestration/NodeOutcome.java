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

import dev.mars.agentflow.execution.ExecutionError;

import java.util.Map;
import java.util.Optional;

/**
 * Result of one recorded node invocation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class NodeOutcome {

    public enum Kind {
        COMPLETED,
        FAILED,
        /** The execution was already terminal, so nothing was run or recorded. */
        SKIPPED
    }

    private static final NodeOutcome SKIPPED = new NodeOutcome(Kind.SKIPPED, null, Map.of(), null);

    private final Kind kind;
    private final String stepId;
    private final Map<String, Object> output;
    private final ExecutionError error;

    private NodeOutcome(Kind kind, String stepId, Map<String, Object> output, ExecutionError error) {
        this.kind = kind;
        this.stepId = stepId;
        this.output = output;
        this.error = error;
    }

    public static NodeOutcome completed(String stepId, Map<String, Object> output) {
        return new NodeOutcome(Kind.COMPLETED, stepId, output, null);
    }

    public static NodeOutcome failed(String stepId, ExecutionError error) {
        return new NodeOutcome(Kind.FAILED, stepId, Map.of(), error);
    }

    public static NodeOutcome skipped() {
        return SKIPPED;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    public boolean isSkipped() {
        return kind == Kind.SKIPPED;
    }

    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public Optional<ExecutionError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "NodeOutcome{kind=" + kind + ", stepId='" + stepId + "'}";
    }
}
