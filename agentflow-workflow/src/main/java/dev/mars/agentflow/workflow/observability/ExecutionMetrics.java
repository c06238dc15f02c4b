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

package dev.mars.agentflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the execution engine.
 *
 * Provides:
 * - agentflow.execution.active (gauge) - Currently active executions
 * - agentflow.execution.total (counter) - Executions started
 * - agentflow.execution.completed (counter) - Executions completed
 * - agentflow.execution.failed (counter) - Executions failed
 * - agentflow.execution.cancelled (counter) - Executions cancelled
 * - agentflow.execution.steps.total (counter) - Node invocations
 * - agentflow.execution.steps.failed (counter) - Failed node invocations
 * - agentflow.execution.duration.seconds (histogram) - Execution duration
 * - agentflow.execution.steps.per_execution (histogram) - Steps per execution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0
 */
public class ExecutionMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionMetrics.class);
    private static final String METER_NAME = "agentflow-workflow";

    private static ExecutionMetrics instance;

    // Counters
    private final LongCounter executionsTotal;
    private final LongCounter executionsCompleted;
    private final LongCounter executionsFailed;
    private final LongCounter executionsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;

    // Histograms
    private final DoubleHistogram executionDuration;
    private final DoubleHistogram stepsPerExecution;

    private final AtomicLong activeExecutions = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> ORCHESTRATION_KEY = AttributeKey.stringKey("orchestration.type");
    private static final AttributeKey<String> NODE_TYPE_KEY = AttributeKey.stringKey("node.type");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");

    public ExecutionMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        executionsTotal = meter.counterBuilder("agentflow.execution.total")
                .setDescription("Total number of executions started")
                .setUnit("1")
                .build();

        executionsCompleted = meter.counterBuilder("agentflow.execution.completed")
                .setDescription("Number of completed executions")
                .setUnit("1")
                .build();

        executionsFailed = meter.counterBuilder("agentflow.execution.failed")
                .setDescription("Number of failed executions")
                .setUnit("1")
                .build();

        executionsCancelled = meter.counterBuilder("agentflow.execution.cancelled")
                .setDescription("Number of cancelled executions")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("agentflow.execution.steps.total")
                .setDescription("Total number of node invocations")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("agentflow.execution.steps.failed")
                .setDescription("Number of failed node invocations")
                .setUnit("1")
                .build();

        executionDuration = meter.histogramBuilder("agentflow.execution.duration.seconds")
                .setDescription("Execution duration in seconds")
                .setUnit("s")
                .build();

        stepsPerExecution = meter.histogramBuilder("agentflow.execution.steps.per_execution")
                .setDescription("Number of steps recorded per execution")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("agentflow.execution.active")
                .setDescription("Number of currently active executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeExecutions.get()));

        logger.debug("ExecutionMetrics initialized");
    }

    /**
     * Get the shared instance bound to the global OpenTelemetry.
     */
    public static synchronized ExecutionMetrics getInstance() {
        if (instance == null) {
            instance = new ExecutionMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing, for when monitoring is disabled.
     */
    public static ExecutionMetrics noop() {
        return new ExecutionMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordExecutionStarted(String workflowId, String orchestrationType) {
        executionsTotal.add(1, executionAttributes(workflowId, orchestrationType));
        activeExecutions.incrementAndGet();
    }

    public void recordExecutionCompleted(String workflowId, String orchestrationType, Duration duration, int steps) {
        Attributes attrs = executionAttributes(workflowId, orchestrationType);
        executionsCompleted.add(1, attrs);
        recordFinished(attrs, duration, steps);
    }

    public void recordExecutionFailed(String workflowId, String orchestrationType, Duration duration, int steps) {
        Attributes attrs = executionAttributes(workflowId, orchestrationType);
        executionsFailed.add(1, attrs);
        recordFinished(attrs, duration, steps);
    }

    public void recordExecutionCancelled(String workflowId, String orchestrationType, Duration duration, int steps) {
        Attributes attrs = executionAttributes(workflowId, orchestrationType);
        executionsCancelled.add(1, attrs);
        recordFinished(attrs, duration, steps);
    }

    public void recordStepCompleted(String nodeType) {
        stepsTotal.add(1, Attributes.of(NODE_TYPE_KEY, nodeType));
    }

    public void recordStepFailed(String nodeType, String errorKind) {
        Attributes attrs = Attributes.of(NODE_TYPE_KEY, nodeType, ERROR_KIND_KEY, errorKind);
        stepsTotal.add(1, Attributes.of(NODE_TYPE_KEY, nodeType));
        stepsFailed.add(1, attrs);
    }

    public long getActiveExecutions() {
        return activeExecutions.get();
    }

    private void recordFinished(Attributes attrs, Duration duration, int steps) {
        executionDuration.record(duration.toMillis() / 1000.0, attrs);
        stepsPerExecution.record(steps, attrs);
        activeExecutions.decrementAndGet();
    }

    private static Attributes executionAttributes(String workflowId, String orchestrationType) {
        return Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(ORCHESTRATION_KEY, orchestrationType)
                .build();
    }
}
