package de.bsommerfeld.harvester.cli;

/**
 * The command line could not be interpreted.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
