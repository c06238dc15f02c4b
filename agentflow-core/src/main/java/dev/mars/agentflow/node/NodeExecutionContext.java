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

package dev.mars.agentflow.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-execution context handed to node executors.
 *
 * <p>Executors that keep handles between invocations (chat sessions,
 * protocol connections) store them here rather than in shared state, so a
 * handle never outlives or leaks across executions. Release actions
 * registered with {@link #onClose(AutoCloseable)} run, newest first, when
 * the execution finishes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class NodeExecutionContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NodeExecutionContext.class);

    private final String executionId;
    private final String workflowId;
    private final Map<String, Object> handles = new ConcurrentHashMap<>();
    private final List<AutoCloseable> closeActions = Collections.synchronizedList(new ArrayList<>());

    public NodeExecutionContext(String executionId, String workflowId) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * Returns the handle stored under the key, creating it on first use.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCreateHandle(String key, Supplier<T> factory) {
        return (T) handles.computeIfAbsent(key, k -> factory.get());
    }

    public void putHandle(String key, Object handle) {
        handles.put(key, Objects.requireNonNull(handle, "Handle cannot be null"));
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getHandle(String key, Class<T> type) {
        Object value = handles.get(key);
        if (value != null && type.isInstance(value)) {
            return Optional.of((T) value);
        }
        return Optional.empty();
    }

    public void onClose(AutoCloseable action) {
        closeActions.add(Objects.requireNonNull(action, "Close action cannot be null"));
    }

    public int getHandleCount() {
        return handles.size();
    }

    /**
     * Runs the registered release actions and drops every handle. A failing
     * action is logged and does not stop the others.
     */
    @Override
    public void close() {
        List<AutoCloseable> actions;
        synchronized (closeActions) {
            actions = new ArrayList<>(closeActions);
            closeActions.clear();
        }
        Collections.reverse(actions);
        for (AutoCloseable action : actions) {
            try {
                action.close();
            } catch (Exception e) {
                logger.warn("Failed to release handle for execution {}: {}", executionId, e.getMessage());
            }
        }
        handles.clear();
    }
}
