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

import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Shared handling for strategies whose walk was stopped at a node boundary.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public abstract class AbstractOrchestrationStrategy implements OrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(AbstractOrchestrationStrategy.class);

    private final OrchestrationType type;

    protected AbstractOrchestrationStrategy(OrchestrationType type) {
        this.type = type;
    }

    @Override
    public OrchestrationType getType() {
        return type;
    }

    /**
     * Result for a walk that could not pass a boundary. A cancelled run ends
     * cancelled; a worker interrupted without a cancel request ends failed.
     */
    protected OrchestrationResult stopped(ExecutionRun run, Map<String, Object> data) {
        if (run.isCancelled() || run.getState().isTerminal()) {
            logger.info("{} orchestration of execution {} stopped by cancellation", type, run.getExecutionId());
            return OrchestrationResult.cancelled(data);
        }
        run.recordError(ErrorKind.ORCHESTRATION, "Execution interrupted while waiting at a node boundary", null);
        return OrchestrationResult.failed(data);
    }
}
