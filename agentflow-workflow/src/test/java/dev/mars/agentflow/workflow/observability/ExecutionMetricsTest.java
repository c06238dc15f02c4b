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

import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collection;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionMetrics against an in-memory OpenTelemetry reader.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0
 */
class ExecutionMetricsTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private ExecutionMetrics metrics;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new ExecutionMetrics(meterProvider.get("agentflow-test"));
    }

    @AfterEach
    void tearDown() {
        meterProvider.close();
    }

    private static MetricData find(Collection<MetricData> data, String name) {
        return data.stream()
                .filter(metric -> metric.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("Metric not exported: " + name));
    }

    private static long sum(Collection<MetricData> data, String name) {
        return find(data, name).getLongSumData().getPoints().stream()
                .mapToLong(LongPointData::getValue)
                .sum();
    }

    @Test
    void testExecutionLifecycleCounters() {
        metrics.recordExecutionStarted("wf-1", "SEQUENTIAL");
        metrics.recordExecutionStarted("wf-1", "SEQUENTIAL");
        metrics.recordExecutionStarted("wf-2", "CONCURRENT");
        metrics.recordExecutionCompleted("wf-1", "SEQUENTIAL", Duration.ofMillis(1500), 3);
        metrics.recordExecutionFailed("wf-1", "SEQUENTIAL", Duration.ofMillis(200), 1);

        Collection<MetricData> data = reader.collectAllMetrics();

        assertEquals(3, sum(data, "agentflow.execution.total"));
        assertEquals(1, sum(data, "agentflow.execution.completed"));
        assertEquals(1, sum(data, "agentflow.execution.failed"));
        assertEquals(1, metrics.getActiveExecutions());

        long active = find(data, "agentflow.execution.active").getLongGaugeData().getPoints().stream()
                .mapToLong(LongPointData::getValue)
                .sum();
        assertEquals(1, active);
    }

    @Test
    void testDurationAndStepHistograms() {
        metrics.recordExecutionStarted("wf-1", "HANDOFF");
        metrics.recordExecutionCancelled("wf-1", "HANDOFF", Duration.ofSeconds(2), 4);

        Collection<MetricData> data = reader.collectAllMetrics();

        HistogramPointData duration = find(data, "agentflow.execution.duration.seconds")
                .getHistogramData().getPoints().iterator().next();
        assertEquals(1, duration.getCount());
        assertEquals(2.0, duration.getSum(), 0.001);

        HistogramPointData steps = find(data, "agentflow.execution.steps.per_execution")
                .getHistogramData().getPoints().iterator().next();
        assertEquals(4.0, steps.getSum(), 0.001);
        assertEquals(1, sum(data, "agentflow.execution.cancelled"));
        assertEquals(0, metrics.getActiveExecutions());
    }

    @Test
    void testStepCounters() {
        metrics.recordStepCompleted("LLMAgent");
        metrics.recordStepCompleted("ToolAgent");
        metrics.recordStepFailed("ToolAgent", "COLLABORATOR");

        Collection<MetricData> data = reader.collectAllMetrics();

        assertEquals(3, sum(data, "agentflow.execution.steps.total"));
        assertEquals(1, sum(data, "agentflow.execution.steps.failed"));
    }

    @Test
    void testNoopMetricsTrackActiveCount() {
        ExecutionMetrics noop = ExecutionMetrics.noop();

        noop.recordExecutionStarted("wf", "CUSTOM");
        assertEquals(1, noop.getActiveExecutions());
        noop.recordExecutionCompleted("wf", "CUSTOM", Duration.ZERO, 0);
        assertEquals(0, noop.getActiveExecutions());
    }

    @Test
    void testSharedInstance() {
        assertSame(ExecutionMetrics.getInstance(), ExecutionMetrics.getInstance());
    }
}
