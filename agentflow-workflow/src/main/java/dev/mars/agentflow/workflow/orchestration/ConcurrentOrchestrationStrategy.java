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

import dev.mars.agentflow.core.exceptions.OrchestrationException;
import dev.mars.agentflow.graph.OrchestrationType;
import dev.mars.agentflow.graph.WorkflowNode;
import dev.mars.agentflow.workflow.ExecutionRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Runs every participating, parallel-eligible node (start and end nodes
 * excluded) as an independent branch against the same input, then joins
 * them and merges the successful outputs keyed by node id.
 *
 * <p>A failing branch is recorded on its own step and on the execution; the
 * other branches carry on and the run still completes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ConcurrentOrchestrationStrategy extends AbstractOrchestrationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentOrchestrationStrategy.class);

    private final ExecutorService branchExecutor;

    public ConcurrentOrchestrationStrategy(ExecutorService branchExecutor) {
        super(OrchestrationType.CONCURRENT);
        this.branchExecutor = Objects.requireNonNull(branchExecutor, "Branch executor cannot be null");
    }

    @Override
    public OrchestrationResult execute(ExecutionRun run) throws OrchestrationException {
        List<WorkflowNode> branches = run.getGraph().getNodes().stream()
                .filter(WorkflowNode::isParticipating)
                .filter(WorkflowNode::isParallelEligible)
                .filter(node -> !node.isStartNode() && !node.isEndNode())
                .collect(Collectors.toList());
        if (branches.isEmpty()) {
            throw new OrchestrationException("No nodes are eligible for concurrent execution in workflow '"
                    + run.getGraph().getId() + "'");
        }

        logger.info("Concurrent execution {} fanning out to {} branches", run.getExecutionId(), branches.size());

        Map<String, Object> input = run.getInputData();
        Map<String, NodeOutcome> outcomes = new ConcurrentHashMap<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        CompletableFuture<?>[] futures = branches.stream()
                .map(branch -> CompletableFuture.runAsync(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        if (run.awaitBoundary()) {
                            outcomes.put(branch.getId(), run.executeNode(branch, input));
                        }
                    } finally {
                        MDC.clear();
                    }
                }, branchExecutor))
                .toArray(CompletableFuture[]::new);

        // fan-in
        CompletableFuture.allOf(futures).join();

        Map<String, Object> merged = new LinkedHashMap<>();
        for (WorkflowNode branch : branches) {
            NodeOutcome outcome = outcomes.get(branch.getId());
            if (outcome != null && outcome.isCompleted()) {
                merged.put(branch.getId(), outcome.getOutput());
            }
        }

        if (run.isCancelled() || run.getState().isTerminal()) {
            return stopped(run, merged);
        }

        long failed = outcomes.values().stream().filter(NodeOutcome::isFailed).count();
        logger.info("Concurrent execution {} joined: {} succeeded, {} failed",
                run.getExecutionId(), merged.size(), failed);
        return OrchestrationResult.completed(merged);
    }
}
