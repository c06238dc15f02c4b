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

package dev.mars.agentflow.collaborator;

import dev.mars.agentflow.core.exceptions.CollaboratorException;

/**
 * Produces chat completions for LLM agent nodes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface LlmCompletionProvider {

    /**
     * Requests a completion.
     *
     * @param request the prompt and its settings
     * @return the model's response text
     * @throws CollaboratorException if the provider cannot produce a completion
     */
    String complete(LlmRequest request) throws CollaboratorException;

    /**
     * Opens a chat session for one node within one execution. Providers that
     * keep no server-side conversation can rely on the default.
     *
     * @return an opaque session id passed back on every request for that node
     * @throws CollaboratorException if the session cannot be opened
     */
    default String openSession(String executionId, String nodeId) throws CollaboratorException {
        return executionId + ":" + nodeId;
    }

    /**
     * Releases a session opened with {@link #openSession(String, String)}.
     */
    default void closeSession(String sessionId) throws CollaboratorException {
    }
}
