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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ConditionEvaluator} backed by the Spring Expression Language.
 *
 * <p>Expressions run in a read-only {@link SimpleEvaluationContext}: no
 * constructors, static methods or type references, though public instance
 * methods of the data values may be called (for example
 * {@code ['ready'].get()} on an {@code AtomicBoolean}). The data map is the
 * root object and each entry is also bound as a variable; both
 * {@code ['status'] == 'ok'} and {@code #status == 'ok'} work.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class SpelConditionEvaluator implements ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SpelConditionEvaluator.class);

    public static final int DEFAULT_CACHE_SIZE = 256;

    private final ExpressionParser parser = new SpelExpressionParser();
    private final int maxCacheSize;
    private final Map<String, Expression> cache;

    public SpelConditionEvaluator() {
        this(DEFAULT_CACHE_SIZE);
    }

    /**
     * @param maxCacheSize parsed expressions kept; the least recently used is evicted first
     */
    public SpelConditionEvaluator(int maxCacheSize) {
        if (maxCacheSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxCacheSize);
        }
        this.maxCacheSize = maxCacheSize;
        this.cache = Collections.synchronizedMap(new LinkedHashMap<String, Expression>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Expression> eldest) {
                return size() > SpelConditionEvaluator.this.maxCacheSize;
            }
        });
    }

    @Override
    public boolean evaluate(String expression, Map<String, Object> data) throws WorkflowValidationException {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Map<String, Object> root = data != null ? data : Map.of();

        Expression parsed = parse(expression);
        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                .withInstanceMethods()
                .withRootObject(root)
                .build();
        root.forEach(context::setVariable);

        try {
            Boolean value = parsed.getValue(context, Boolean.class);
            logger.trace("Condition '{}' evaluated to {}", expression, value);
            return Boolean.TRUE.equals(value);
        } catch (EvaluationException e) {
            throw new WorkflowValidationException(null,
                    "Failed to evaluate condition '" + expression + "': " + e.getMessage(), e);
        }
    }

    private Expression parse(String expression) throws WorkflowValidationException {
        Expression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        try {
            Expression parsed = parser.parseExpression(expression);
            cache.put(expression, parsed);
            return parsed;
        } catch (ParseException e) {
            throw new WorkflowValidationException(null,
                    "Malformed condition '" + expression + "': " + e.getMessage(), e);
        }
    }

    int cachedExpressionCount() {
        return cache.size();
    }
}
