package com.forgeloop.orchestrator.tracker;

/**
 * Thrown when the issue tracker returns an error or is unreachable.
 */
public class TrackerException extends RuntimeException {

    public enum Kind { UNREACHABLE, NOT_FOUND, REJECTED }

    private final Kind kind;

    public TrackerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TrackerException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
