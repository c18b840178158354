package de.bsommerfeld.harvester.frameio;

import de.bsommerfeld.harvester.core.config.ClientConfig;

import java.time.Duration;

/**
 * Throttling and retry parameters of the {@link RateLimitedClient}.
 *
 * @param requestDelay   fixed pause before every attempt
 * @param maxRetries     attempts per request before the failure is surfaced
 * @param baseRetryDelay first backoff delay after an HTTP 429
 * @param multiplier     growth factor of the backoff per attempt
 * @param transientDelay fixed pause after network errors and 5xx responses
 */
public record RetryPolicy(
        Duration requestDelay,
        int maxRetries,
        Duration baseRetryDelay,
        double multiplier,
        Duration transientDelay) {

    public RetryPolicy {
        maxRetries = Math.max(1, maxRetries);
    }

    public static RetryPolicy from(ClientConfig config) {
        return new RetryPolicy(
                Duration.ofMillis(config.getRequestDelayMillis()),
                config.getMaxRetries(),
                Duration.ofMillis(config.getBaseRetryDelayMillis()),
                config.getBackoffMultiplier(),
                Duration.ofMillis(config.getTransientRetryDelayMillis()));
    }

    /**
     * Backoff after the rate-limited attempt {@code attempt} (zero-based):
     * {@code baseRetryDelay * multiplier^attempt}.
     */
    public Duration backoffDelay(int attempt) {
        double millis = baseRetryDelay.toMillis() * Math.pow(multiplier, attempt);
        return Duration.ofMillis(Math.round(millis));
    }
}
