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

import java.util.Map;

/**
 * Client for tool servers reached over a model context protocol, used by
 * MCP agent nodes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ProtocolClient {

    void connect(String serverId) throws CollaboratorException;

    void disconnect(String serverId) throws CollaboratorException;

    ProtocolConnectionStatus getStatus(String serverId);

    Map<String, Object> callTool(String serverId, String toolName, Map<String, Object> arguments)
            throws CollaboratorException;
}
