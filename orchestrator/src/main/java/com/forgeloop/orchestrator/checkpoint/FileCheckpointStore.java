package com.forgeloop.orchestrator.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.PhaseStatus;
import com.forgeloop.orchestrator.model.ProjectIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Checkpoint store backed by one JSON file.
 *
 * Writes go to a temp file in the same directory, are fsync'ed, and are then
 * renamed over the target, so a reader sees either the previous document or
 * the new one and never a partial write. Read-modify-write cycles hold an OS
 * lock on {@code <checkpoint>.lock} so an external editor using the same
 * protocol cannot interleave with a mutation.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    // One monitor per checkpoint path: FileLock is per-process, not per-thread.
    private static final Map<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path path;
    private final Path lockFile;
    private final ObjectMapper json;
    private final Clock clock;
    private final Object monitor;

    public FileCheckpointStore(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path     = path.toAbsolutePath().normalize();
        this.lockFile = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.clock    = clock;
        this.monitor  = MONITORS.computeIfAbsent(this.path, p -> new Object());
        this.json     = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() { return path; }

    // ------------------------------------------------------------------
    // CheckpointStore
    // ------------------------------------------------------------------

    @Override
    public Optional<Checkpoint> load() {
        synchronized (monitor) {
            return read();
        }
    }

    @Override
    public Checkpoint initialize(ProjectIdentity identity) {
        synchronized (monitor) {
            return withFileLock(() -> {
                if (Files.exists(path)) {
                    throw new CheckpointException(CheckpointException.Kind.ALREADY_EXISTS,
                            "Checkpoint already exists at " + path);
                }
                Instant now = clock.instant();
                Checkpoint cp = new Checkpoint();
                identity.setStartedAt(now);
                identity.setLastUpdated(now);
                cp.setProject(identity);
                cp.getPhase().setStatus(PhaseStatus.NOT_STARTED);
                cp.setResumeHint("Start phase 0");
                write(cp);
                log.info("Initialized checkpoint for project '{}' at {}", identity.getName(), path);
                return cp;
            });
        }
    }

    @Override
    public Checkpoint mutate(UnaryOperator<Checkpoint> mutation) {
        synchronized (monitor) {
            return withFileLock(() -> {
                Checkpoint current = read().orElseThrow(() -> new CheckpointException(
                        CheckpointException.Kind.NOT_FOUND, "No checkpoint at " + path));
                Checkpoint next = mutation.apply(current);
                next.getProject().setLastUpdated(clock.instant());

                List<String> violations = CheckpointInvariants.violations(next);
                if (!violations.isEmpty()) {
                    // Nothing is written: the stored document stays as it was.
                    throw new IllegalStateException("Checkpoint mutation breaks invariants: " + violations);
                }
                write(next);
                return next;
            });
        }
    }

    @Override
    public void delete() {
        synchronized (monitor) {
            try {
                boolean deleted = Files.deleteIfExists(path);
                Files.deleteIfExists(lockFile);
                if (deleted) {
                    log.warn("Deleted checkpoint {}", path);
                }
            } catch (IOException e) {
                throw new CheckpointException(CheckpointException.Kind.IO_FAILURE,
                        "Could not delete " + path, e);
            }
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(path);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<Checkpoint> read() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CheckpointException(CheckpointException.Kind.IO_FAILURE, "Could not read " + path, e);
        }

        try {
            JsonNode tree = json.readTree(bytes);
            if (tree == null || !tree.isObject()) {
                throw new CheckpointException(CheckpointException.Kind.CORRUPT_STATE,
                        "Checkpoint " + path + " is not a JSON object");
            }
            ObjectNode migrated = CheckpointMigrator.migrate((ObjectNode) tree);
            Checkpoint cp = json.treeToValue(migrated, Checkpoint.class);
            List<String> violations = CheckpointInvariants.violations(cp);
            if (!violations.isEmpty()) {
                throw new CheckpointException(CheckpointException.Kind.CORRUPT_STATE,
                        "Checkpoint " + path + " violates invariants: " + violations);
            }
            return Optional.of(cp);
        } catch (JsonProcessingException e) {
            throw new CheckpointException(CheckpointException.Kind.CORRUPT_STATE,
                    "Checkpoint " + path + " cannot be parsed: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CheckpointException(CheckpointException.Kind.IO_FAILURE, "Could not read " + path, e);
        }
    }

    private void write(Checkpoint cp) {
        Path tmp = null;
        try {
            Path dir = path.getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(json.writeValueAsBytes(cp));
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported for {}, falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new CheckpointException(CheckpointException.Kind.IO_FAILURE, "Could not write " + path, e);
        }
    }

    private <T> T withFileLock(LockedAction<T> action) {
        try {
            Files.createDirectories(lockFile.getParent());
            try (FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = ch.lock()) {
                return action.run();
            }
        } catch (IOException e) {
            throw new CheckpointException(CheckpointException.Kind.IO_FAILURE, "Could not lock " + lockFile, e);
        }
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run();
    }
}
