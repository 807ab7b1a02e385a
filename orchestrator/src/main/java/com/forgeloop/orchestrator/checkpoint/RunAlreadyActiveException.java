package com.forgeloop.orchestrator.checkpoint;

/**
 * Another run already holds this project's checkpoint.
 */
public class RunAlreadyActiveException extends RuntimeException {

    public RunAlreadyActiveException(String message) {
        super(message);
    }
}
