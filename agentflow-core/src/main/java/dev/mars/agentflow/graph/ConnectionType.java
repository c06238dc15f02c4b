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
 * Kind of a connection between two node ports.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public enum ConnectionType {
    DATA_FLOW(true),
    CONTROL_FLOW(true),
    CONDITIONAL(true),
    PARALLEL(true),
    ERROR(false),
    SIGNAL(false);

    private final boolean ordering;

    ConnectionType(boolean ordering) {
        this.ordering = ordering;
    }

    /**
     * Whether the connection constrains pipeline order. Error and signal
     * connections describe side channels and are left out of ordering.
     */
    public boolean isOrdering() {
        return ordering;
    }

    public static Optional<ConnectionType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (ConnectionType type : values()) {
            if (type.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
