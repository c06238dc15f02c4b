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

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.core.exceptions.CollaboratorException;
import dev.mars.agentflow.core.exceptions.OrchestrationException;
import dev.mars.agentflow.graph.NodeRole;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Hands the participant nodes to a {@link CollaborativeSession} and records
 * the whole session as one step on the coordinator (or the first
 * participant). Participants are participating nodes holding a primary
 * executor, assistant or coordinator role.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class GroupChatOrchestrationStrategy extends AbstractOrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(GroupChatOrchestrationStrategy.class);

    private static final String COLLABORATOR = "collaborative-session";

    private final CollaborativeSession session;

    public GroupChatOrchestrationStrategy(CollaborativeSession session) {
        super(OrchestrationType.GROUP_CHAT);
        this.session = Objects.requireNonNull(session, "Collaborative session cannot be null");
    }

    @Override
    public OrchestrationResult execute(ExecutionRun run) throws OrchestrationException {
        List<WorkflowNode> participants = run.getGraph().getNodes().stream()
                .filter(WorkflowNode::isParticipating)
                .filter(node -> node.getRoles().stream().anyMatch(NodeRole::isCollaborative))
                .collect(Collectors.toList());
        if (participants.isEmpty()) {
            throw new OrchestrationException("Group chat workflow '" + run.getGraph().getId()
                    + "' has no participants");
        }

        WorkflowNode anchor = participants.stream()
                .filter(node -> node.hasRole(NodeRole.COORDINATOR))
                .findFirst()
                .orElse(participants.get(0));

        Map<String, Object> input = run.getInputData();
        if (!run.awaitBoundary()) {
            return stopped(run, input);
        }

        logger.info("Group chat execution {} with {} participants, anchored on {}",
                run.getExecutionId(), participants.size(), anchor.getId());

        GroupChatRequest request = new GroupChatRequest(run.getExecutionId(), run.getGraph().getId(),
                participants, input, run.getNodeContext(), run::isCancelled);

        NodeOutcome outcome = run.executeStep(anchor, input, () -> {
            try {
                return session.run(request);
            } catch (CollaboratorException e) {
                throw e;
            } catch (AgentflowException | RuntimeException e) {
                throw new CollaboratorException(COLLABORATOR, "Group chat session failed: " + e.getMessage(), e);
            }
        });

        if (outcome.isSkipped()) {
            return stopped(run, input);
        }
        if (outcome.isFailed()) {
            return OrchestrationResult.failed(input);
        }
        if (run.isCancelled()) {
            return stopped(run, outcome.getOutput());
        }
        return OrchestrationResult.completed(outcome.getOutput());
    }
}
