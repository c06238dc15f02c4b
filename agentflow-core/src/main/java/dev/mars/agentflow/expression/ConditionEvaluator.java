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

package dev.mars.agentflow.expression;

import dev.mars.agentflow.core.exceptions.WorkflowValidationException;

import java.util.Map;

/**
 * Evaluates the boolean condition expressions carried by connections,
 * conditional nodes and script steps against the current data.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public interface ConditionEvaluator {

    /**
     * @param expression the condition to evaluate
     * @param data       the data the condition is evaluated against
     * @return the condition's value; a null result counts as false
     * @throws WorkflowValidationException if the expression is malformed or cannot be evaluated
     */
    boolean evaluate(String expression, Map<String, Object> data) throws WorkflowValidationException;
}
