package com.forgeloop.orchestrator.checkpoint;

import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.ProjectIdentity;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable storage for the single checkpoint document of a project.
 *
 * <p>Error contract:
 * <ul>
 *   <li>No document → {@link #load()} returns empty (a new project, not an error).</li>
 *   <li>Unparsable document → {@link CheckpointException.Kind#CORRUPT_STATE}. Callers
 *       must never delete the document on this error without explicit confirmation.</li>
 * </ul>
 */
public interface CheckpointStore {

    Optional<Checkpoint> load();

    /**
     * Create the document for a new project.
     *
     * @throws CheckpointException ALREADY_EXISTS if a document is present
     */
    Checkpoint initialize(ProjectIdentity identity);

    /**
     * Atomic read-modify-write of the whole document.
     *
     * The mutation receives a freshly read copy, and the returned checkpoint
     * replaces the stored one in a single write; lastUpdated is stamped here.
     * Mutations must be idempotent when replayed (set union, not append).
     *
     * @throws CheckpointException NOT_FOUND if there is no document
     */
    Checkpoint mutate(UnaryOperator<Checkpoint> mutation);

    /** Explicit operator action only; never called on CORRUPT_STATE. */
    void delete();

    boolean exists();
}
