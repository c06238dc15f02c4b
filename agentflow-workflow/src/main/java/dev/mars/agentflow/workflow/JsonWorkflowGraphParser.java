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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.agentflow.graph.WorkflowGraph;

import java.util.Map;

/**
 * JSON-based implementation of WorkflowGraphParser using Jackson.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class JsonWorkflowGraphParser implements WorkflowGraphParser {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final GraphDocumentMapper mapper;

    public JsonWorkflowGraphParser() {
        this(new ObjectMapper());
    }

    public JsonWorkflowGraphParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.mapper = new GraphDocumentMapper();
    }

    @Override
    public WorkflowGraph parseFromString(String jsonContent) throws WorkflowParseException {
        Map<String, Object> document;
        try {
            document = objectMapper.readValue(jsonContent, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new WorkflowParseException("Empty or invalid JSON content");
        }
        return mapper.toGraph(document);
    }
}
