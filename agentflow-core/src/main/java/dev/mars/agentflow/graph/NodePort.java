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

/**
 * A named input or output port on a node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class NodePort {

    private final String id;
    private final String name;
    private final String dataType;
    private final boolean required;

    public NodePort(String id, String name, String dataType, boolean required) {
        this.id = Objects.requireNonNull(id, "Port ID cannot be null");
        this.name = name != null ? name : id;
        this.dataType = dataType != null ? dataType : "any";
        this.required = required;
    }

    public static NodePort of(String id) {
        return new NodePort(id, id, "any", false);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDataType() {
        return dataType;
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodePort nodePort = (NodePort) o;
        return required == nodePort.required && id.equals(nodePort.id) && name.equals(nodePort.name)
                && dataType.equals(nodePort.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, dataType, required);
    }

    @Override
    public String toString() {
        return "NodePort{id='" + id + "', dataType='" + dataType + "', required=" + required + '}';
    }
}
