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
 * Orchestration policy declared by a workflow graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum OrchestrationType {

    /** Nodes run one after another in pipeline order, each feeding the next. */
    SEQUENTIAL,

    /** Eligible nodes run in parallel against the same input and are merged at the fan-in. */
    CONCURRENT,

    /** Control passes from node to node along selected outgoing connections. */
    HANDOFF,

    /** A selector repeatedly picks the next node to run. */
    MAGENTIC,

    /** Participant nodes collaborate through a shared session. */
    GROUP_CHAT,

    /** The graph's own step script is interpreted. */
    CUSTOM;

    /**
     * Resolves a declared type name leniently: case is ignored, as are
     * underscores, hyphens and spaces, so {@code "GroupChat"} and
     * {@code "group_chat"} both match {@link #GROUP_CHAT}.
     */
    public static Optional<OrchestrationType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        for (OrchestrationType type : values()) {
            if (normalize(type.name()).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String value) {
        return value.replace("_", "").replace("-", "").replace(" ", "").toLowerCase(Locale.ROOT);
    }
}
