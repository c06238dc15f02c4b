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

import java.util.Map;

/**
 * A multi-party conversation between the participant nodes of a group chat
 * orchestration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
@FunctionalInterface
public interface CollaborativeSession {

    /**
     * Runs the session to completion.
     *
     * @return the session's aggregate output
     * @throws AgentflowException if the session fails
     */
    Map<String, Object> run(GroupChatRequest request) throws AgentflowException;
}
