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

package dev.mars.quill.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.quill.core.exceptions.CheckpointStorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * File-based {@link CheckpointStore} writing one JSON document per checkpoint.
 *
 * <p><b>Storage Layout:</b></p>
 * <pre>
 * {baseDir}/
 *   └── {jobId}/
 *         ├── {checkpointId}.json     // complete checkpoints
 *         └── {checkpointId}*.tmp     // in-flight writes, never listed
 * </pre>
 *
 * <p>A checkpoint is serialized to a temporary file in the job directory,
 * flushed, then renamed over its final name with an atomic move. Readers only
 * consider {@code .json} files, so a partially written checkpoint is never
 * observable.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final Logger logger = Logger.getLogger(FileCheckpointStore.class.getName());

    private static final String CHECKPOINT_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final boolean fsyncEnabled;

    public FileCheckpointStore(Path baseDir) {
        this(baseDir, true);
    }

    /**
     * @param baseDir      root directory holding one sub-directory per job
     * @param fsyncEnabled whether to force file contents to disk before the rename
     */
    public FileCheckpointStore(Path baseDir, boolean fsyncEnabled) {
        this.baseDir = Objects.requireNonNull(baseDir, "Base directory cannot be null");
        this.objectMapper = CheckpointJson.createObjectMapper();
        this.fsyncEnabled = fsyncEnabled;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public void write(Checkpoint checkpoint) throws CheckpointStorageException {
        String jobId = checkpoint.getJobId();
        Path jobDir = jobDirectory(jobId);
        Path target = jobDir.resolve(checkpoint.getCheckpointId() + CHECKPOINT_SUFFIX);
        Path temp = null;

        try {
            Files.createDirectories(jobDir);
            temp = Files.createTempFile(jobDir, checkpoint.getCheckpointId() + "_", TEMP_SUFFIX);

            byte[] content = objectMapper.writeValueAsBytes(checkpoint);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                channel.write(ByteBuffer.wrap(content));
                if (fsyncEnabled) {
                    channel.force(true);
                }
            }

            moveIntoPlace(temp, target);
            logger.fine("Wrote checkpoint " + checkpoint.getCheckpointId() + " to " + target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CheckpointStorageException(jobId,
                    "Failed to write checkpoint " + checkpoint.getCheckpointId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Checkpoint> list(String jobId) throws CheckpointStorageException {
        Path jobDir = jobDirectory(jobId);
        if (!Files.isDirectory(jobDir)) {
            return List.of();
        }

        List<Checkpoint> checkpoints = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(jobDir, "*" + CHECKPOINT_SUFFIX)) {
            for (Path file : files) {
                readCheckpoint(file).ifPresent(checkpoints::add);
            }
        } catch (IOException e) {
            throw new CheckpointStorageException(jobId, "Failed to list checkpoints: " + e.getMessage(), e);
        }

        checkpoints.sort(Checkpoint.MOST_RECENT_FIRST);
        return checkpoints;
    }

    @Override
    public Optional<Checkpoint> find(String checkpointId) throws CheckpointStorageException {
        Objects.requireNonNull(checkpointId, "Checkpoint ID cannot be null");
        if (!isSafeName(checkpointId) || !Files.isDirectory(baseDir)) {
            return Optional.empty();
        }

        String fileName = checkpointId + CHECKPOINT_SUFFIX;
        try (DirectoryStream<Path> jobDirs = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
            for (Path jobDir : jobDirs) {
                Path candidate = jobDir.resolve(fileName);
                if (Files.isRegularFile(candidate)) {
                    return readCheckpoint(candidate);
                }
            }
        } catch (IOException e) {
            throw new CheckpointStorageException("*", "Failed to search checkpoints: " + e.getMessage(), e);
        }
        return Optional.empty();
    }

    @Override
    public boolean delete(String jobId, String checkpointId) throws CheckpointStorageException {
        if (!isSafeName(checkpointId)) {
            return false;
        }
        Path file = jobDirectory(jobId).resolve(checkpointId + CHECKPOINT_SUFFIX);
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                logger.fine("Deleted checkpoint file: " + file);
            }
            return deleted;
        } catch (IOException e) {
            throw new CheckpointStorageException(jobId,
                    "Failed to delete checkpoint " + checkpointId + ": " + e.getMessage(), e);
        }
    }

    private Optional<Checkpoint> readCheckpoint(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Checkpoint.class));
        } catch (NoSuchFileException e) {
            // removed by a concurrent cleanup
            return Optional.empty();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Ignoring unreadable checkpoint file " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported for " + target + ", falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path jobDirectory(String jobId) throws CheckpointStorageException {
        if (!isSafeName(jobId)) {
            throw new CheckpointStorageException(jobId, "Unsafe job identifier for file storage");
        }
        return baseDir.resolve(jobId);
    }

    private static boolean isSafeName(String name) {
        return name != null && !name.isBlank()
                && !name.contains("/") && !name.contains("\\") && !name.contains("..");
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warning("Failed to remove temporary checkpoint file " + path + ": " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "FileCheckpointStore{baseDir=" + baseDir + ", fsync=" + fsyncEnabled + '}';
    }
}
