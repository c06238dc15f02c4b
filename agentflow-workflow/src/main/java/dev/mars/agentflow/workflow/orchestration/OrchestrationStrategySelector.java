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

import dev.mars.agentflow.graph.OrchestrationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Chooses the strategy for a declared orchestration type. Types that are
 * missing or have no registered strategy fall back to custom orchestration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class OrchestrationStrategySelector {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationStrategySelector.class);

    private final Map<OrchestrationType, OrchestrationStrategy> strategies = new EnumMap<>(OrchestrationType.class);
    private final OrchestrationStrategy fallback;

    public OrchestrationStrategySelector(List<OrchestrationStrategy> strategies) {
        for (OrchestrationStrategy strategy : strategies) {
            this.strategies.put(strategy.getType(), strategy);
        }
        this.fallback = Objects.requireNonNull(this.strategies.get(OrchestrationType.CUSTOM),
                "A custom orchestration strategy is required as the fallback");
    }

    public OrchestrationStrategy select(OrchestrationType type) {
        if (type == null) {
            logger.warn("No orchestration type declared; using {}", OrchestrationType.CUSTOM);
            return fallback;
        }
        OrchestrationStrategy strategy = strategies.get(type);
        if (strategy == null) {
            logger.warn("No strategy registered for {}; using {}", type, OrchestrationType.CUSTOM);
            return fallback;
        }
        return strategy;
    }
}
