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

import java.util.Objects;
import java.util.Optional;

/**
 * A directed connection from an output port of one node to an input port
 * of another, optionally guarded by a condition expression.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class NodeConnection {

    public static final String DEFAULT_OUTPUT_PORT = "output";
    public static final String DEFAULT_INPUT_PORT = "input";

    private final String id;
    private final String fromNodeId;
    private final String fromPort;
    private final String toNodeId;
    private final String toPort;
    private final ConnectionType type;
    private final String condition;

    public NodeConnection(String id, String fromNodeId, String fromPort, String toNodeId, String toPort,
                          ConnectionType type, String condition) {
        this.fromNodeId = Objects.requireNonNull(fromNodeId, "Source node ID cannot be null");
        this.toNodeId = Objects.requireNonNull(toNodeId, "Target node ID cannot be null");
        this.id = id != null ? id : fromNodeId + "->" + toNodeId;
        this.fromPort = fromPort != null ? fromPort : DEFAULT_OUTPUT_PORT;
        this.toPort = toPort != null ? toPort : DEFAULT_INPUT_PORT;
        this.type = type != null ? type : ConnectionType.DATA_FLOW;
        this.condition = condition;
    }

    public static NodeConnection of(String fromNodeId, String toNodeId) {
        return new NodeConnection(null, fromNodeId, null, toNodeId, null, ConnectionType.DATA_FLOW, null);
    }

    public static NodeConnection conditional(String fromNodeId, String toNodeId, String condition) {
        return new NodeConnection(null, fromNodeId, null, toNodeId, null, ConnectionType.CONDITIONAL, condition);
    }

    public String getId() {
        return id;
    }

    public String getFromNodeId() {
        return fromNodeId;
    }

    public String getFromPort() {
        return fromPort;
    }

    public String getToNodeId() {
        return toNodeId;
    }

    public String getToPort() {
        return toPort;
    }

    public ConnectionType getType() {
        return type;
    }

    public Optional<String> getCondition() {
        return condition == null || condition.isBlank() ? Optional.empty() : Optional.of(condition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeConnection that = (NodeConnection) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "NodeConnection{" + fromNodeId + "." + fromPort + " -> " + toNodeId + "." + toPort +
                ", type=" + type + '}';
    }
}
