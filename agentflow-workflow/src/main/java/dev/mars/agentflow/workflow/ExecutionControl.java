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

import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import dev.mars.agentflow.execution.ExecutionState;
import dev.mars.agentflow.execution.ExecutionStatus;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative cancel and pause flags for one execution. The worker running
 * the execution checks them between node invocations; an in-flight node
 * call is never interrupted.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ExecutionControl {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private final Lock pauseLock = new ReentrantLock();
    private final Condition stateChanged = pauseLock.newCondition();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        pauseLock.lock();
        try {
            cancelled.set(true);
            stateChanged.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public void pause() {
        pauseLock.lock();
        try {
            paused.set(true);
        } finally {
            pauseLock.unlock();
        }
    }

    public void resume() {
        pauseLock.lock();
        try {
            paused.set(false);
            stateChanged.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Moves the execution to the target status and sets the matching flag
     * under the same lock, so the flags always agree with the status.
     * Callers publish the status change after this returns.
     *
     * @return the status before the transition
     * @throws InvalidTransitionException if the current status cannot move to the target
     */
    public ExecutionStatus transition(ExecutionState state, ExecutionStatus target)
            throws InvalidTransitionException {
        pauseLock.lock();
        try {
            ExecutionStatus previous = state.transitionTo(target);
            switch (target) {
                case PAUSED:
                    paused.set(true);
                    break;
                case RUNNING:
                    paused.set(false);
                    break;
                case CANCELLED:
                    cancelled.set(true);
                    break;
                default:
                    break;
            }
            stateChanged.signalAll();
            return previous;
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Blocks while the execution is paused, without spinning.
     *
     * @return true if the execution may continue, false if it was cancelled
     *         or the waiting thread was interrupted
     */
    public boolean awaitBoundary() {
        if (cancelled.get()) {
            return false;
        }
        if (!paused.get()) {
            return true;
        }

        pauseLock.lock();
        try {
            while (paused.get() && !cancelled.get()) {
                try {
                    stateChanged.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return !cancelled.get();
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Sleeps for up to the given time, waking early on cancellation.
     *
     * @return true if the full time elapsed, false if cancelled or interrupted
     */
    public boolean sleep(long millis) {
        pauseLock.lock();
        try {
            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(millis);
            while (!cancelled.get() && remainingNanos > 0) {
                try {
                    remainingNanos = stateChanged.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return !cancelled.get();
        } finally {
            pauseLock.unlock();
        }
    }
}
