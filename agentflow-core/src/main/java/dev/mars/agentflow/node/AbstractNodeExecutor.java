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

package dev.mars.agentflow.node;

import dev.mars.agentflow.execution.DataMaps;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowNode;

import java.util.Map;

/**
 * Base class for the built-in executors. Outputs start from the node's
 * input and are stamped with the node's identity and properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public abstract class AbstractNodeExecutor implements NodeExecutor {

    public static final String NODE_ID = "node_id";
    public static final String NODE_NAME = "node_name";
    public static final String NODE_TYPE = "node_type";
    public static final String NODE_PROPERTY_PREFIX = "node_property_";

    private final String nodeType;

    protected AbstractNodeExecutor(String nodeType) {
        this.nodeType = nodeType;
    }

    @Override
    public String getNodeType() {
        return nodeType;
    }

    /**
     * Copies the input and adds the node's identity and properties.
     */
    protected Map<String, Object> baseOutput(WorkflowNode node, Map<String, Object> input) {
        Map<String, Object> output = DataMaps.mutableCopy(input);
        output.put(NODE_ID, node.getId());
        output.put(NODE_NAME, node.getName());
        output.put(NODE_TYPE, node.getType());
        node.getProperties().forEach((key, value) -> output.put(NODE_PROPERTY_PREFIX + key, value));
        return output;
    }

    protected void requireProperty(WorkflowNode node, String property, ValidationResult result) {
        if (node.getStringProperty(property).filter(value -> !value.isBlank()).isEmpty()) {
            result.addError("nodes." + node.getId() + ".properties." + property,
                    nodeType + " node '" + node.getId() + "' requires property '" + property + "'");
        }
    }

    protected void requireOutputPorts(WorkflowNode node, int minimum, ValidationResult result) {
        if (node.getOutputPorts().size() < minimum) {
            result.addWarning("nodes." + node.getId() + ".outputPorts",
                    nodeType + " node '" + node.getId() + "' should have at least " + minimum + " output ports");
        }
    }
}
