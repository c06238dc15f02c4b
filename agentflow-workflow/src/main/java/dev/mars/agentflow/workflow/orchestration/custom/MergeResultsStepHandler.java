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

package dev.mars.agentflow.workflow.orchestration.custom;

import dev.mars.agentflow.graph.OrchestrationStep;
import dev.mars.agentflow.graph.OrchestrationStepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the current data with the outputs of earlier steps keyed by step
 * id: the named source steps, or every earlier step when none are named.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class MergeResultsStepHandler implements StepHandler {

    private static final Logger logger = LoggerFactory.getLogger(MergeResultsStepHandler.class);

    @Override
    public OrchestrationStepType getStepType() {
        return OrchestrationStepType.MERGE_RESULTS;
    }

    @Override
    public Map<String, Object> handle(OrchestrationStep step, ScriptContext context) {
        Map<String, Map<String, Object>> outputs = context.getStepOutputs();
        List<String> sources = step.getSourceStepIds().isEmpty()
                ? List.copyOf(outputs.keySet())
                : step.getSourceStepIds();

        Map<String, Object> merged = new LinkedHashMap<>();
        for (String source : sources) {
            Map<String, Object> output = outputs.get(source);
            if (output != null) {
                merged.put(source, output);
            } else {
                logger.debug("Merge step {} found no output for step {}", step.getId(), source);
            }
        }
        return merged;
    }
}
