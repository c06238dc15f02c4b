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
 * Invokes named tools on behalf of tool agent nodes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ToolInvocationProvider {

    /**
     * @param toolName  the tool to invoke
     * @param arguments the tool's arguments
     * @return the tool's result
     * @throws CollaboratorException if the tool is unknown or fails
     */
    Map<String, Object> invoke(String toolName, Map<String, Object> arguments) throws CollaboratorException;
}
