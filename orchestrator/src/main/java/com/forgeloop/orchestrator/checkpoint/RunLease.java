package com.forgeloop.orchestrator.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive claim on a checkpoint for the duration of one run.
 *
 * Backed by an OS file lock on {@code <checkpoint>.run.lock}, so a second
 * process (or a second run in this JVM) pointed at the same checkpoint is
 * refused instead of racing. The lock dies with the process, so a crashed
 * run never leaves a stale lease behind.
 */
public final class RunLease implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunLease.class);

    private final FileChannel channel;
    private final FileLock lock;
    private final Path lockFile;

    private RunLease(FileChannel channel, FileLock lock, Path lockFile) {
        this.channel  = channel;
        this.lock     = lock;
        this.lockFile = lockFile;
    }

    public static RunLease acquire(Path checkpointPath) {
        Path lockFile = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".run.lock");
        FileChannel channel = null;
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw new RunAlreadyActiveException("Checkpoint " + checkpointPath + " is held by another process");
            }
            log.debug("Acquired run lease {}", lockFile);
            return new RunLease(channel, lock, lockFile);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new RunAlreadyActiveException("Checkpoint " + checkpointPath + " is already held by a run in this process");
        } catch (IOException e) {
            closeQuietly(channel);
            throw new CheckpointException(CheckpointException.Kind.IO_FAILURE,
                    "Could not lock " + lockFile, e);
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
            log.debug("Released run lease {}", lockFile);
        } catch (IOException e) {
            log.warn("Could not release run lease {}: {}", lockFile, e.getMessage());
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Could not close lock channel: {}", e.getMessage());
        }
    }
}
