package de.bsommerfeld.harvester.frameio;

/**
 * Every candidate endpoint of an operation failed. The individual candidate
 * failures are attached as suppressed exceptions.
 */
public class EndpointProbeException extends FrameioApiException {

    private final String operation;
    private final String targetId;

    public EndpointProbeException(String operation, String targetId, int lastStatusCode, int candidates) {
        super("Operation '" + operation + "' failed for " + targetId + " on all "
                + candidates + " candidate endpoints", lastStatusCode);
        this.operation = operation;
        this.targetId = targetId;
    }

    public String getOperation() {
        return operation;
    }

    public String getTargetId() {
        return targetId;
    }
}
