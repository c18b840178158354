package de.bsommerfeld.harvester.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * HTTP and throttling parameters for the Frame.io client. Values are
 * persisted in config.toml and loaded at startup.
 */
public class ClientConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://api.frame.io/v2";

    /** Fixed pause before every request to stay below the provider's rate limit. */
    @JsonProperty("request-delay-millis")
    private long requestDelayMillis = 500;

    /** Attempts per request before a rate limit or transient failure becomes fatal. */
    @JsonProperty("max-retries")
    private int maxRetries = 3;

    @JsonProperty("base-retry-delay-millis")
    private long baseRetryDelayMillis = 5000;

    @JsonProperty("backoff-multiplier")
    private double backoffMultiplier = 2.0;

    @JsonProperty("transient-retry-delay-millis")
    private long transientRetryDelayMillis = 2000;

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 30;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public long getRequestDelayMillis() {
        return requestDelayMillis;
    }

    public void setRequestDelayMillis(long requestDelayMillis) {
        this.requestDelayMillis = requestDelayMillis;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBaseRetryDelayMillis() {
        return baseRetryDelayMillis;
    }

    public void setBaseRetryDelayMillis(long baseRetryDelayMillis) {
        this.baseRetryDelayMillis = baseRetryDelayMillis;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getTransientRetryDelayMillis() {
        return transientRetryDelayMillis;
    }

    public void setTransientRetryDelayMillis(long transientRetryDelayMillis) {
        this.transientRetryDelayMillis = transientRetryDelayMillis;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }
}
