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

import dev.mars.agentflow.graph.WorkflowGraph;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.Map;

/**
 * YAML-based implementation of WorkflowGraphParser using SnakeYAML.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class YamlWorkflowGraphParser implements WorkflowGraphParser {

    private final Yaml yaml;
    private final GraphDocumentMapper mapper;

    public YamlWorkflowGraphParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.mapper = new GraphDocumentMapper();
    }

    @Override
    public WorkflowGraph parseFromString(String yamlContent) throws WorkflowParseException {
        Object loaded;
        try {
            loaded = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> document = (Map<String, Object>) loaded;
        return mapper.toGraph(document);
    }
}
