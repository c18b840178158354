package de.bsommerfeld.harvester.harvest;

/**
 * A harvest run could not be completed: a required top-level call failed or
 * progress could not be checkpointed.
 */
public class HarvestException extends Exception {

    public HarvestException(String message) {
        super(message);
    }

    public HarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
