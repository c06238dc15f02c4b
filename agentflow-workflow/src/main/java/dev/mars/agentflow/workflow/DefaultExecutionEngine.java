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

package dev.mars.agentflow.workflow;

import dev.mars.agentflow.config.AgentflowConfiguration;
import dev.mars.agentflow.core.exceptions.AgentflowException;
import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import dev.mars.agentflow.core.exceptions.WorkflowValidationException;
import dev.mars.agentflow.execution.ErrorKind;
import dev.mars.agentflow.execution.ExecutionError;
import dev.mars.agentflow.execution.ExecutionState;
import dev.mars.agentflow.execution.ExecutionStatus;
import dev.mars.agentflow.execution.ExecutionStep;
import dev.mars.agentflow.execution.WorkflowExecution;
import dev.mars.agentflow.expression.ConditionEvaluator;
import dev.mars.agentflow.expression.SpelConditionEvaluator;
import dev.mars.agentflow.graph.ValidationResult;
import dev.mars.agentflow.graph.WorkflowGraph;
import dev.mars.agentflow.node.NodeExecutionContext;
import dev.mars.agentflow.node.NodeExecutorRegistry;
import dev.mars.agentflow.workflow.observability.ExecutionMetrics;
import dev.mars.agentflow.workflow.orchestration.CollaborativeSession;
import dev.mars.agentflow.workflow.orchestration.ConcurrentOrchestrationStrategy;
import dev.mars.agentflow.workflow.orchestration.ConditionalHandoffEvaluator;
import dev.mars.agentflow.workflow.orchestration.CustomOrchestrationStrategy;
import dev.mars.agentflow.workflow.orchestration.GroupChatOrchestrationStrategy;
import dev.mars.agentflow.workflow.orchestration.HandoffConditionEvaluator;
import dev.mars.agentflow.workflow.orchestration.HandoffOrchestrationStrategy;
import dev.mars.agentflow.workflow.orchestration.MagenticOrchestrationStrategy;
import dev.mars.agentflow.workflow.orchestration.NodeSelector;
import dev.mars.agentflow.workflow.orchestration.OrchestrationResult;
import dev.mars.agentflow.workflow.orchestration.OrchestrationStrategy;
import dev.mars.agentflow.workflow.orchestration.OrchestrationStrategySelector;
import dev.mars.agentflow.workflow.orchestration.PriorityNodeSelector;
import dev.mars.agentflow.workflow.orchestration.RoundRobinGroupChatSession;
import dev.mars.agentflow.workflow.orchestration.SequentialOrchestrationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Default implementation of ExecutionEngine.
 *
 * <p>Each execution runs on the engine's worker pool. The strategy is chosen
 * once from the graph's declared orchestration type; concurrent branches run
 * on a separate branch pool. Active executions are kept in memory and every
 * status change is written through to the {@link ExecutionHistoryStore}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DefaultExecutionEngine implements ExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultExecutionEngine.class);

    static final String MDC_EXECUTION_ID = "executionId";

    private final WorkflowGraphRepository graphRepository;
    private final NodeExecutorRegistry nodeExecutors;
    private final ExecutionHistoryStore historyStore;
    private final AgentflowConfiguration configuration;
    private final ExecutionMetrics metrics;
    private final Clock clock;
    private final OrchestrationStrategySelector strategySelector;
    private final ExecutionEventPublisher publisher = new ExecutionEventPublisher();
    private final Map<String, ExecutionRun> activeExecutions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<WorkflowExecution>> pendingCompletions = new ConcurrentHashMap<>();
    private final ExecutorService workerExecutor;
    private final ExecutorService branchExecutor;
    private volatile boolean shutdown = false;

    private DefaultExecutionEngine(Builder builder) {
        this.graphRepository = Objects.requireNonNull(builder.graphRepository, "Graph repository cannot be null");
        this.nodeExecutors = Objects.requireNonNull(builder.nodeExecutors, "Node executors cannot be null");
        this.historyStore = builder.historyStore != null ? builder.historyStore : new InMemoryExecutionHistoryStore();
        this.configuration = builder.configuration != null ? builder.configuration : new AgentflowConfiguration();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.metrics != null) {
            this.metrics = builder.metrics;
        } else {
            this.metrics = configuration.isMetricsEnabled() ? ExecutionMetrics.getInstance() : ExecutionMetrics.noop();
        }

        this.workerExecutor = builder.workerExecutor != null
                ? builder.workerExecutor
                : Executors.newFixedThreadPool(configuration.getEngineWorkerThreads(), namedThreads("agentflow-worker"));
        this.branchExecutor = Executors.newFixedThreadPool(configuration.getConcurrentBranchThreads(),
                namedThreads("agentflow-branch"));

        ConditionEvaluator conditionEvaluator = builder.conditionEvaluator != null
                ? builder.conditionEvaluator : new SpelConditionEvaluator();
        NodeSelector nodeSelector = builder.nodeSelector != null ? builder.nodeSelector : new PriorityNodeSelector();
        HandoffConditionEvaluator handoffEvaluator = builder.handoffEvaluator != null
                ? builder.handoffEvaluator : new ConditionalHandoffEvaluator(conditionEvaluator);
        CollaborativeSession session = builder.collaborativeSession != null
                ? builder.collaborativeSession
                : new RoundRobinGroupChatSession(nodeExecutors, configuration.getGroupChatMaxRounds());

        List<OrchestrationStrategy> strategies = new ArrayList<>();
        strategies.add(new SequentialOrchestrationStrategy());
        strategies.add(new ConcurrentOrchestrationStrategy(branchExecutor));
        strategies.add(new HandoffOrchestrationStrategy(handoffEvaluator));
        strategies.add(new MagenticOrchestrationStrategy(nodeSelector, configuration.getMagenticMaxIterations()));
        strategies.add(new GroupChatOrchestrationStrategy(session));
        strategies.add(new CustomOrchestrationStrategy(conditionEvaluator,
                configuration.getCustomWaitTimeoutMs(),
                configuration.getCustomWaitPollIntervalMs(),
                configuration.getCustomLoopMaxIterations()));
        this.strategySelector = new OrchestrationStrategySelector(strategies);

        logger.info("DefaultExecutionEngine initialized with {} worker threads and {} branch threads",
                configuration.getEngineWorkerThreads(), configuration.getConcurrentBranchThreads());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String startExecution(String workflowId, Map<String, Object> inputData)
            throws WorkflowValidationException {
        if (shutdown) {
            throw new IllegalStateException("Execution engine is shutdown");
        }
        if (workflowId == null || workflowId.isBlank()) {
            throw new WorkflowValidationException("Workflow ID cannot be null or blank");
        }

        WorkflowGraph graph = graphRepository.findById(workflowId)
                .orElseThrow(() -> new WorkflowValidationException(workflowId, "Workflow not found: " + workflowId));

        ValidationResult validation = graph.validate().merge(nodeExecutors.validate(graph));
        if (!validation.isValid()) {
            logger.warn("Workflow {} failed validation: {}", workflowId, validation.getErrorSummary());
            throw new WorkflowValidationException(workflowId,
                    "Workflow graph is invalid: " + validation.getErrorSummary());
        }
        if (validation.hasWarnings()) {
            logger.debug("Workflow {} validated with warnings: {}", workflowId, validation.getWarnings());
        }

        OrchestrationStrategy strategy = strategySelector.select(graph.getOrchestrationType());
        String executionId = UUID.randomUUID().toString();
        ExecutionState state = new ExecutionState(executionId, workflowId, graph.getOrchestrationType(),
                inputData, clock);
        ExecutionRun run = new ExecutionRun(graph, state, nodeExecutors, publisher, metrics, configuration);

        activeExecutions.put(executionId, run);
        pendingCompletions.put(executionId, run.getCompletion());
        historyStore.save(state.snapshot());

        try {
            workerExecutor.submit(() -> runExecution(run, strategy));
        } catch (RejectedExecutionException e) {
            activeExecutions.remove(executionId);
            pendingCompletions.remove(executionId);
            historyStore.remove(executionId);
            throw new IllegalStateException("Execution engine rejected execution of workflow " + workflowId, e);
        }
        metrics.recordExecutionStarted(workflowId, strategy.getType().name());

        logger.info("Started execution {} of workflow {} using {} orchestration",
                executionId, workflowId, strategy.getType());
        return executionId;
    }

    private void runExecution(ExecutionRun run, OrchestrationStrategy strategy) {
        MDC.put(MDC_EXECUTION_ID, run.getExecutionId());
        try {
            OrchestrationResult result;
            try (NodeExecutionContext ignored = run.getNodeContext()) {
                result = strategy.execute(run);
            } catch (AgentflowException e) {
                logger.error("Execution {} failed: {}", run.getExecutionId(), e.getMessage());
                run.recordError(e, null);
                result = OrchestrationResult.failed(run.getInputData());
            } catch (RuntimeException e) {
                logger.error("Execution {} failed unexpectedly", run.getExecutionId(), e);
                run.recordError(ErrorKind.ORCHESTRATION, "Unexpected error: " + e.getMessage(), null);
                result = OrchestrationResult.failed(run.getInputData());
            }
            finish(run, strategy, result);
        } finally {
            WorkflowExecution finalSnapshot = run.getState().snapshot();
            activeExecutions.remove(run.getExecutionId());
            historyStore.save(finalSnapshot);
            run.getCompletion().complete(finalSnapshot);
            pendingCompletions.remove(run.getExecutionId());
            MDC.remove(MDC_EXECUTION_ID);
        }
    }

    /**
     * Moves the execution to the strategy's outcome. A paused execution
     * holds here until it is resumed or cancelled.
     */
    private void finish(ExecutionRun run, OrchestrationStrategy strategy, OrchestrationResult result) {
        ExecutionState state = run.getState();
        ExecutionStatus target = result.getStatus();
        while (!state.isTerminal()) {
            if (!run.getControl().awaitBoundary()) {
                target = ExecutionStatus.CANCELLED;
            }
            state.setOutputData(result.getOutputData());
            try {
                ExecutionStatus previous = run.getControl().transition(state, target);
                publishStatus(state, previous, target);
                recordTerminal(state, strategy, target);
                logger.info("Execution {} finished with status {}", run.getExecutionId(), target);
            } catch (InvalidTransitionException e) {
                logger.debug("Execution {} changed status before finishing: {}", run.getExecutionId(),
                        e.getMessage());
            }
        }
    }

    @Override
    public boolean pauseExecution(String executionId) {
        ExecutionRun run = executionId == null ? null : activeExecutions.get(executionId);
        if (run == null) {
            return false;
        }
        if (!changeStatus(run, ExecutionStatus.PAUSED)) {
            return false;
        }
        logger.info("Paused execution {}", executionId);
        return true;
    }

    @Override
    public boolean resumeExecution(String executionId) {
        ExecutionRun run = executionId == null ? null : activeExecutions.get(executionId);
        if (run == null) {
            return false;
        }
        if (!changeStatus(run, ExecutionStatus.RUNNING)) {
            return false;
        }
        logger.info("Resumed execution {}", executionId);
        return true;
    }

    @Override
    public boolean stopExecution(String executionId) {
        ExecutionRun run = executionId == null ? null : activeExecutions.get(executionId);
        if (run == null) {
            return false;
        }
        if (!changeStatus(run, ExecutionStatus.CANCELLED)) {
            return false;
        }
        activeExecutions.remove(executionId);
        recordTerminal(run.getState(), strategySelector.select(run.getGraph().getOrchestrationType()),
                ExecutionStatus.CANCELLED);
        logger.info("Cancelled execution {}", executionId);
        return true;
    }

    private boolean changeStatus(ExecutionRun run, ExecutionStatus target) {
        ExecutionState state = run.getState();
        ExecutionStatus previous;
        try {
            previous = run.getControl().transition(state, target);
        } catch (InvalidTransitionException e) {
            logger.debug("Execution {} cannot move to {}: {}", run.getExecutionId(), target, e.getMessage());
            return false;
        }
        historyStore.save(state.snapshot());
        publishStatus(state, previous, target);
        return true;
    }

    private void publishStatus(ExecutionState state, ExecutionStatus previous, ExecutionStatus current) {
        publisher.statusChanged(new ExecutionStatusChangedEvent(state.getExecutionId(), state.getWorkflowId(),
                previous, current, state.now()));
    }

    private void recordTerminal(ExecutionState state, OrchestrationStrategy strategy, ExecutionStatus status) {
        WorkflowExecution snapshot = state.snapshot();
        Instant end = snapshot.getCompletedAt().orElse(state.now());
        Duration duration = Duration.between(snapshot.getStartedAt(), end);
        String type = strategy.getType().name();
        int steps = snapshot.getSteps().size();
        switch (status) {
            case COMPLETED:
                metrics.recordExecutionCompleted(snapshot.getWorkflowId(), type, duration, steps);
                break;
            case FAILED:
                metrics.recordExecutionFailed(snapshot.getWorkflowId(), type, duration, steps);
                break;
            case CANCELLED:
                metrics.recordExecutionCancelled(snapshot.getWorkflowId(), type, duration, steps);
                break;
            default:
                break;
        }
    }

    @Override
    public Optional<WorkflowExecution> getExecutionStatus(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        ExecutionRun run = activeExecutions.get(executionId);
        if (run != null) {
            return Optional.of(run.getState().snapshot());
        }
        return historyStore.findById(executionId);
    }

    @Override
    public List<WorkflowExecution> listWorkflowExecutions(String workflowId) {
        if (workflowId == null) {
            return List.of();
        }
        Map<String, WorkflowExecution> executions = new LinkedHashMap<>();
        for (WorkflowExecution stored : historyStore.findByWorkflowId(workflowId)) {
            executions.put(stored.getExecutionId(), stored);
        }
        for (ExecutionRun run : activeExecutions.values()) {
            if (run.getState().getWorkflowId().equals(workflowId)) {
                executions.put(run.getExecutionId(), run.getState().snapshot());
            }
        }
        return executions.values().stream()
                .sorted(Comparator.comparing(WorkflowExecution::getStartedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<ExecutionStep> listExecutionSteps(String executionId) {
        return getExecutionStatus(executionId)
                .map(execution -> execution.getSteps().stream()
                        .sorted(Comparator.comparing(ExecutionStep::getStartedAt))
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    @Override
    public List<ExecutionError> listExecutionErrors(String executionId) {
        return getExecutionStatus(executionId)
                .map(execution -> execution.getErrors().stream()
                        .sorted(Comparator.comparing(ExecutionError::getOccurredAt))
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    @Override
    public CompletableFuture<WorkflowExecution> awaitCompletion(String executionId) {
        CompletableFuture<WorkflowExecution> pending = executionId == null ? null : pendingCompletions.get(executionId);
        if (pending != null) {
            return pending;
        }
        Optional<WorkflowExecution> stored = historyStore.findById(executionId);
        if (stored.isPresent() && stored.get().getStatus().isTerminal()) {
            return CompletableFuture.completedFuture(stored.get());
        }
        return CompletableFuture.failedFuture(
                new WorkflowValidationException("Execution not found: " + executionId));
    }

    @Override
    public List<WorkflowExecution> getActiveExecutions() {
        return activeExecutions.values().stream()
                .map(run -> run.getState().snapshot())
                .collect(Collectors.toList());
    }

    @Override
    public void addListener(ExecutionListener listener) {
        publisher.addListener(listener);
    }

    @Override
    public boolean removeListener(ExecutionListener listener) {
        return publisher.removeListener(listener);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        for (String executionId : new ArrayList<>(activeExecutions.keySet())) {
            stopExecution(executionId);
        }
        workerExecutor.shutdown();
        branchExecutor.shutdown();
        logger.info("DefaultExecutionEngine shutdown initiated");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Builder for {@link DefaultExecutionEngine}. A graph repository and a
     * node executor registry are required; everything else has a default.
     */
    public static class Builder {
        private WorkflowGraphRepository graphRepository;
        private NodeExecutorRegistry nodeExecutors;
        private ExecutionHistoryStore historyStore;
        private AgentflowConfiguration configuration;
        private NodeSelector nodeSelector;
        private HandoffConditionEvaluator handoffEvaluator;
        private CollaborativeSession collaborativeSession;
        private ConditionEvaluator conditionEvaluator;
        private ExecutionMetrics metrics;
        private Clock clock;
        private ExecutorService workerExecutor;

        public Builder graphRepository(WorkflowGraphRepository graphRepository) {
            this.graphRepository = graphRepository;
            return this;
        }

        public Builder nodeExecutors(NodeExecutorRegistry nodeExecutors) {
            this.nodeExecutors = nodeExecutors;
            return this;
        }

        public Builder historyStore(ExecutionHistoryStore historyStore) {
            this.historyStore = historyStore;
            return this;
        }

        public Builder configuration(AgentflowConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder nodeSelector(NodeSelector nodeSelector) {
            this.nodeSelector = nodeSelector;
            return this;
        }

        public Builder handoffEvaluator(HandoffConditionEvaluator handoffEvaluator) {
            this.handoffEvaluator = handoffEvaluator;
            return this;
        }

        public Builder collaborativeSession(CollaborativeSession collaborativeSession) {
            this.collaborativeSession = collaborativeSession;
            return this;
        }

        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        public Builder metrics(ExecutionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Runs executions on the given pool instead of a fixed pool sized by
         * the configuration. The engine shuts the pool down with itself.
         */
        public Builder workerExecutor(ExecutorService workerExecutor) {
            this.workerExecutor = workerExecutor;
            return this;
        }

        public DefaultExecutionEngine build() {
            return new DefaultExecutionEngine(this);
        }
    }
}
