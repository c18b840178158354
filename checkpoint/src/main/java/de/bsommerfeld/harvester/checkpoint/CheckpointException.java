package de.bsommerfeld.harvester.checkpoint;

/**
 * Thrown when progress cannot be persisted. Losing a save would break the
 * resume guarantee, so callers treat this as fatal for the run.
 */
public class CheckpointException extends Exception {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
