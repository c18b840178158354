package de.bsommerfeld.harvester.frameio;

/**
 * A request to the review service failed for good: either with a
 * non-retryable status or after the retry budget was spent.
 */
public class FrameioApiException extends Exception {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public FrameioApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FrameioApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the final attempt, {@link #NO_STATUS} for network failures. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
