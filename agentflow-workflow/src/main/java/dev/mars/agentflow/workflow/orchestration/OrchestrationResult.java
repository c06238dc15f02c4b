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

package dev.mars.agentflow.workflow.orchestration;

import dev.mars.agentflow.execution.DataMaps;
import dev.mars.agentflow.execution.ExecutionStatus;

import java.util.Map;

/**
 * How a strategy finished, and the data it finished with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class OrchestrationResult {

    private final ExecutionStatus status;
    private final Map<String, Object> outputData;

    private OrchestrationResult(ExecutionStatus status, Map<String, Object> outputData) {
        this.status = status;
        this.outputData = DataMaps.immutableCopy(outputData);
    }

    public static OrchestrationResult completed(Map<String, Object> outputData) {
        return new OrchestrationResult(ExecutionStatus.COMPLETED, outputData);
    }

    public static OrchestrationResult failed(Map<String, Object> outputData) {
        return new OrchestrationResult(ExecutionStatus.FAILED, outputData);
    }

    public static OrchestrationResult cancelled(Map<String, Object> outputData) {
        return new OrchestrationResult(ExecutionStatus.CANCELLED, outputData);
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Map<String, Object> getOutputData() {
        return outputData;
    }

    @Override
    public String toString() {
        return "OrchestrationResult{status=" + status + ", outputKeys=" + outputData.keySet() + '}';
    }
}
