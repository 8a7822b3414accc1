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

package dev.mars.gorgon.workflow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from {@code <id>.yaml} or {@code <id>.yml} files in a directory.
 * A file that parses but fails validation is rejected like a malformed one.
 */
public class YamlDirectoryWorkflowSource implements WorkflowSource {

    private static final Logger logger = Logger.getLogger(YamlDirectoryWorkflowSource.class.getName());

    private final Path directory;
    private final WorkflowDefinitionParser parser;

    public YamlDirectoryWorkflowSource(Path directory) {
        this(directory, new YamlWorkflowDefinitionParser());
    }

    public YamlDirectoryWorkflowSource(Path directory, WorkflowDefinitionParser parser) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
    }

    @Override
    public WorkflowDefinition load(String workflowId) throws WorkflowSourceException {
        Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        for (String extension : List.of(".yaml", ".yml")) {
            Path file = directory.resolve(workflowId + extension);
            if (Files.isRegularFile(file)) {
                try {
                    WorkflowDefinition definition = parser.parse(file);
                    parser.validate(definition).throwIfInvalid(workflowId);
                    logger.fine("Loaded workflow " + workflowId + " from " + file);
                    return definition;
                } catch (WorkflowParseException e) {
                    throw new WorkflowSourceException(workflowId, "Invalid workflow file " + file + ": " + e.getMessage(), e);
                }
            }
        }
        throw new WorkflowSourceException(workflowId, "Workflow not found in " + directory + ": " + workflowId);
    }

    @Override
    public List<String> listWorkflowIds() throws WorkflowSourceException {
        if (!Files.isDirectory(directory)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(".yaml") || name.endsWith(".yml"))
                    .map(name -> name.substring(0, name.lastIndexOf('.')))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to list workflows in " + directory, e);
            throw new WorkflowSourceException(null, "Failed to list workflows in " + directory, e);
        }
    }
}
