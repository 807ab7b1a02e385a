package com.forgeloop.orchestrator.checkpoint;

/**
 * Failure to read or write the checkpoint document.
 *
 * Unchecked: a checkpoint failure halts forward progress, there is no local
 * recovery strategy apart from suspending the run.
 */
public class CheckpointException extends RuntimeException {

    public enum Kind { NOT_FOUND, ALREADY_EXISTS, CORRUPT_STATE, UNSUPPORTED_VERSION, IO_FAILURE }

    private final Kind kind;

    public CheckpointException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CheckpointException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
