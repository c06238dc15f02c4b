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
import dev.mars.agentflow.execution.DataMaps;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.NodeExecutorRegistry;
import dev.mars.agentflow.node.executors.LlmAgentExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lets each participant speak in turn for a fixed number of rounds. Every
 * participant sees the original input plus the transcript so far.
 *
 * <p>A participant's message is its {@code llm_response}, else its
 * {@code message}, else its whole output.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class RoundRobinGroupChatSession implements CollaborativeSession {

    private static final Logger logger = LoggerFactory.getLogger(RoundRobinGroupChatSession.class);

    public static final String TRANSCRIPT_KEY = "transcript";
    public static final String PARTICIPANTS_KEY = "participants";
    public static final String ROUNDS_KEY = "rounds";
    public static final String LAST_MESSAGE_KEY = "last_message";

    private final NodeExecutorRegistry nodeExecutors;
    private final int maxRounds;

    public RoundRobinGroupChatSession(NodeExecutorRegistry nodeExecutors, int maxRounds) {
        this.nodeExecutors = Objects.requireNonNull(nodeExecutors, "Node executors cannot be null");
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("Max rounds must be positive: " + maxRounds);
        }
        this.maxRounds = maxRounds;
    }

    @Override
    public Map<String, Object> run(GroupChatRequest request) throws AgentflowException {
        List<Map<String, Object>> transcript = new ArrayList<>();
        Object lastMessage = null;
        int rounds = 0;

        chat:
        for (int round = 1; round <= maxRounds; round++) {
            for (WorkflowNode participant : request.getParticipants()) {
                if (request.isCancellationRequested()) {
                    logger.info("Group chat for execution {} cancelled in round {}", request.getExecutionId(), round);
                    break chat;
                }
                Map<String, Object> turnInput = DataMaps.mutableCopy(request.getInputData());
                turnInput.put(TRANSCRIPT_KEY, List.copyOf(transcript));
                turnInput.put("round", round);

                Map<String, Object> output = nodeExecutors.execute(participant, turnInput, request.getNodeContext());
                lastMessage = messageOf(output);

                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("round", round);
                entry.put("node_id", participant.getId());
                entry.put("node_name", participant.getName());
                entry.put("message", lastMessage);
                transcript.add(DataMaps.immutableCopy(entry));
            }
            rounds = round;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(TRANSCRIPT_KEY, List.copyOf(transcript));
        result.put(PARTICIPANTS_KEY, request.getParticipants().stream()
                .map(WorkflowNode::getId)
                .collect(Collectors.toList()));
        result.put(ROUNDS_KEY, rounds);
        result.put(LAST_MESSAGE_KEY, lastMessage);
        return result;
    }

    private static Object messageOf(Map<String, Object> output) {
        Object message = output.get(LlmAgentExecutor.RESPONSE_KEY);
        if (message == null) {
            message = output.get("message");
        }
        return message != null ? message : output;
    }
}
