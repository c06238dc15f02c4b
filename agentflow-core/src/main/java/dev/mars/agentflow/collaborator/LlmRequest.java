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

package dev.mars.agentflow.collaborator;

import dev.mars.agentflow.execution.DataMaps;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A completion request built by an LLM agent node from its properties and
 * its current input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public final class LlmRequest {

    private final String sessionId;
    private final String model;
    private final String systemPrompt;
    private final String prompt;
    private final Double temperature;
    private final Integer maxTokens;
    private final Map<String, Object> context;

    private LlmRequest(Builder builder) {
        this.sessionId = builder.sessionId;
        this.model = builder.model;
        this.systemPrompt = builder.systemPrompt;
        this.prompt = Objects.requireNonNull(builder.prompt, "Prompt cannot be null");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.context = DataMaps.immutableCopy(builder.context);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getSessionId() {
        return Optional.ofNullable(sessionId);
    }

    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<String> getSystemPrompt() {
        return Optional.ofNullable(systemPrompt);
    }

    public String getPrompt() {
        return prompt;
    }

    public Optional<Double> getTemperature() {
        return Optional.ofNullable(temperature);
    }

    public Optional<Integer> getMaxTokens() {
        return Optional.ofNullable(maxTokens);
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "LlmRequest{" +
                "sessionId='" + sessionId + '\'' +
                ", model='" + model + '\'' +
                ", promptLength=" + prompt.length() +
                '}';
    }

    public static class Builder {
        private String sessionId;
        private String model;
        private String systemPrompt;
        private String prompt;
        private Double temperature;
        private Integer maxTokens;
        private Map<String, Object> context = Map.of();

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context != null ? context : Map.of();
            return this;
        }

        public LlmRequest build() {
            return new LlmRequest(this);
        }
    }
}
