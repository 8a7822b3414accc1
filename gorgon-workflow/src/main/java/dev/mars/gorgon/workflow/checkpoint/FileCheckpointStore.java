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

package dev.mars.gorgon.workflow.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.gorgon.config.GorgonConfiguration;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores each checkpoint as a JSON file named {@code <checkpointId>.json} in one directory,
 * so paused executions survive a process restart. Writes go to a temporary file first and
 * are moved into place.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger logger = Logger.getLogger(FileCheckpointStore.class.getName());

    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCheckpointStore(GorgonConfiguration configuration) {
        this(Paths.get(configuration.getCheckpointDirectory()));
    }

    public FileCheckpointStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String save(Checkpoint checkpoint) throws CheckpointException {
        String id = checkpoint.getCheckpointId();
        Path target = fileFor(id);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, "checkpoint-" + id, ".tmp");
            try {
                writeAndMove(checkpoint, temp, target);
            } catch (IOException | RuntimeException e) {
                discard(temp, e);
                throw e;
            }
        } catch (IOException e) {
            throw new CheckpointException(CheckpointException.Kind.IO, id,
                    "Failed to save checkpoint " + id + ": " + e.getMessage(), e);
        }
        logger.info("Saved checkpoint " + id + " for execution " + checkpoint.getExecutionId() + " to " + target);
        return id;
    }

    @Override
    public Checkpoint load(String checkpointId) throws CheckpointException {
        Path file = fileFor(checkpointId);
        try {
            return objectMapper.readValue(file.toFile(), Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException(CheckpointException.Kind.CORRUPT, checkpointId,
                    "Checkpoint " + checkpointId + " is corrupt: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            if (!Files.exists(file)) {
                throw CheckpointException.notFound(checkpointId);
            }
            throw new CheckpointException(CheckpointException.Kind.IO, checkpointId,
                    "Failed to read checkpoint " + checkpointId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String checkpointId) throws CheckpointException {
        try {
            boolean deleted = Files.deleteIfExists(fileFor(checkpointId));
            if (deleted) {
                logger.fine("Deleted checkpoint " + checkpointId);
            }
            return deleted;
        } catch (IOException e) {
            throw new CheckpointException(CheckpointException.Kind.IO, checkpointId,
                    "Failed to delete checkpoint " + checkpointId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listCheckpointIds() throws CheckpointException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new CheckpointException(CheckpointException.Kind.IO, null,
                    "Failed to list checkpoints in " + directory + ": " + e.getMessage(), e);
        }
    }

    private void writeAndMove(Checkpoint checkpoint, Path temp, Path target) throws IOException {
        objectMapper.writeValue(temp.toFile(), checkpoint);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp, Exception failure) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warning("Could not remove temporary checkpoint file " + temp + ": " + e.getMessage());
            failure.addSuppressed(e);
        }
    }

    private Path fileFor(String checkpointId) throws CheckpointException {
        if (checkpointId == null || !SAFE_ID.matcher(checkpointId).matches()) {
            throw new CheckpointException(CheckpointException.Kind.NOT_FOUND, checkpointId,
                    "Invalid checkpoint id: " + checkpointId);
        }
        return directory.resolve(checkpointId + SUFFIX);
    }
}
