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

import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.workflow.ExecutionRun;

/**
 * Walks a workflow graph under one orchestration policy.
 *
 * <p>Implementations record every node invocation through
 * {@link ExecutionRun#executeNode}, check {@link ExecutionRun#awaitBoundary()}
 * before each invocation, and report how the walk ended. Throwing ends the
 * execution as failed with the exception on its error trail.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface OrchestrationStrategy {

    OrchestrationType getType();

    OrchestrationResult execute(ExecutionRun run) throws AgentflowException;
}
