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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers execution events to registered listeners. A failing listener is
 * logged and never affects the execution or the other listeners.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ExecutionEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionEventPublisher.class);

    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public boolean removeListener(ExecutionListener listener) {
        return listeners.remove(listener);
    }

    public void statusChanged(ExecutionStatusChangedEvent event) {
        publish("status-changed", listener -> listener.onStatusChanged(event));
    }

    public void stepCompleted(StepCompletedEvent event) {
        publish("step-completed", listener -> listener.onStepCompleted(event));
    }

    public void executionError(ExecutionErrorEvent event) {
        publish("execution-error", listener -> listener.onExecutionError(event));
    }

    private void publish(String eventName, Consumer<ExecutionListener> delivery) {
        for (ExecutionListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed handling {} event: {}",
                        listener.getClass().getName(), eventName, e.getMessage(), e);
            }
        }
    }
}
