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

package dev.mars.agentflow.node.executors;

import dev.mars.agentflow.graph.NodeTypes;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.node.AbstractNodeExecutor;
import dev.mars.agentflow.node.NodeExecutionContext;

import java.time.Instant;
import java.util.Map;

/**
 * Exit node. Passes its input through and marks the end of the run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class EndNodeExecutor extends AbstractNodeExecutor {

    public EndNodeExecutor() {
        super(NodeTypes.END_NODE);
    }

    @Override
    public Map<String, Object> execute(WorkflowNode node, Map<String, Object> input, NodeExecutionContext context) {
        Map<String, Object> output = baseOutput(node, input);
        output.put("workflow_completed_at", Instant.now().toString());
        return output;
    }
}
