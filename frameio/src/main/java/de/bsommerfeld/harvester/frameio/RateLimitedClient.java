package de.bsommerfeld.harvester.frameio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.harvester.core.config.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Authenticated JSON client for the review service. Every attempt is
 * preceded by a fixed throttle pause. HTTP 429 responses back off
 * exponentially, network errors and 5xx responses wait a fixed delay, and
 * all other non-success statuses fail immediately.
 */
public class RateLimitedClient {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimitedClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String USER_AGENT = "review-harvester/" + loadVersion();

    private final HttpClient httpClient;
    private final RetryPolicy policy;
    private final String token;
    private final Duration requestTimeout;
    private final Sleeper sleeper;

    public RateLimitedClient(HttpClient httpClient, ClientConfig config, String token, Sleeper sleeper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.policy = RetryPolicy.from(config);
        this.token = Objects.requireNonNull(token, "token");
        this.requestTimeout = config.requestTimeout();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Performs an authenticated request and returns the decoded JSON body.
     * An empty body decodes to an empty object.
     *
     * @throws FrameioApiException on a non-retryable status, an unparseable
     *                             body, interruption, or after the retry
     *                             budget is exhausted
     */
    public JsonNode request(String url, String method) throws FrameioApiException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .timeout(requestTimeout)
                .build();

        FrameioApiException lastFailure = null;
        for (int attempt = 0; attempt < policy.maxRetries(); attempt++) {
            pause(policy.requestDelay());

            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                LOG.warn("Network error on {} {} (attempt {}/{}): {}",
                        method, url, attempt + 1, policy.maxRetries(), e.getMessage());
                lastFailure = new FrameioApiException("Network error on " + method + " " + url,
                        FrameioApiException.NO_STATUS, e);
                pause(policy.transientDelay());
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FrameioApiException("Interrupted during " + method + " " + url,
                        FrameioApiException.NO_STATUS, e);
            }

            int status = response.statusCode();
            if (status == 429) {
                Duration wait = policy.backoffDelay(attempt);
                LOG.warn("Rate limited on {} (attempt {}/{}), backing off {} ms",
                        url, attempt + 1, policy.maxRetries(), wait.toMillis());
                lastFailure = new FrameioApiException("Rate limited on " + method + " " + url, status);
                pause(wait);
                continue;
            }
            if (status >= 500) {
                LOG.warn("Server error {} on {} (attempt {}/{})", status, url, attempt + 1, policy.maxRetries());
                lastFailure = new FrameioApiException("Server error " + status + " on " + method + " " + url, status);
                pause(policy.transientDelay());
                continue;
            }
            if (status < 200 || status >= 300) {
                throw new FrameioApiException("HTTP " + status + " on " + method + " " + url, status);
            }
            return decode(response.body(), url, status);
        }

        throw new FrameioApiException("Giving up on " + method + " " + url + " after "
                + policy.maxRetries() + " attempts", lastFailure.getStatusCode(), lastFailure);
    }

    public JsonNode get(String url) throws FrameioApiException {
        return request(url, "GET");
    }

    private JsonNode decode(String body, String url, int status) throws FrameioApiException {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FrameioApiException("Unparseable response from " + url, status, e);
        }
    }

    private void pause(Duration duration) throws FrameioApiException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FrameioApiException("Interrupted while waiting", FrameioApiException.NO_STATUS, e);
        }
    }

    private static String loadVersion() {
        try (InputStream in = RateLimitedClient.class.getResourceAsStream("/harvester-version.properties")) {
            if (in == null) {
                return "dev";
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("app.version", "dev");
            return version.startsWith("${") ? "dev" : version;
        } catch (IOException e) {
            LOG.debug("Could not read version properties: {}", e.getMessage());
            return "dev";
        }
    }
}
