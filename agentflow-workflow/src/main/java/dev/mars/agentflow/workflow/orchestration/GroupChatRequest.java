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

import dev.mars.agentflow.execution.DataMaps;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.NodeExecutionContext;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * What a {@link CollaborativeSession} is seeded with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class GroupChatRequest {

    private final String executionId;
    private final String workflowId;
    private final List<WorkflowNode> participants;
    private final Map<String, Object> inputData;
    private final NodeExecutionContext nodeContext;
    private final BooleanSupplier cancellation;

    public GroupChatRequest(String executionId, String workflowId, List<WorkflowNode> participants,
                            Map<String, Object> inputData, NodeExecutionContext nodeContext,
                            BooleanSupplier cancellation) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.participants = List.copyOf(participants);
        this.inputData = DataMaps.immutableCopy(inputData);
        this.nodeContext = Objects.requireNonNull(nodeContext, "Node context cannot be null");
        this.cancellation = cancellation != null ? cancellation : () -> false;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<WorkflowNode> getParticipants() {
        return participants;
    }

    public Map<String, Object> getInputData() {
        return inputData;
    }

    public NodeExecutionContext getNodeContext() {
        return nodeContext;
    }

    public boolean isCancellationRequested() {
        return cancellation.getAsBoolean();
    }
}
