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

package dev.mars.agentflow.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Roles a node can play when it takes part in an orchestration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum NodeRole {
    PRIMARY_EXECUTOR,
    ASSISTANT,
    VALIDATOR,
    AGGREGATOR,
    COORDINATOR,
    OBSERVER,
    CUSTOM;

    public static Optional<NodeRole> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (NodeRole role : values()) {
            if (role.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Roles that make a node a group chat participant.
     */
    public boolean isCollaborative() {
        return this == PRIMARY_EXECUTOR || this == ASSISTANT || this == COORDINATOR;
    }
}
