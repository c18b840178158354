package de.bsommerfeld.harvester.frameio;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Tries an ordered list of endpoint templates for one logical operation
 * and returns the first successful response. Templates use {@code {id}}
 * as the placeholder for the target identifier.
 */
public class EndpointProber {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointProber.class);

    private final RateLimitedClient client;
    private final String baseUrl;

    public EndpointProber(RateLimitedClient client, String baseUrl) {
        this.client = client;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public JsonNode probe(String operation, String targetId, List<String> templates) throws EndpointProbeException {
        List<FrameioApiException> failures = new ArrayList<>();
        for (String template : templates) {
            String url = resolve(template, targetId);
            try {
                JsonNode result = client.get(url);
                if (!failures.isEmpty()) {
                    LOG.debug("{} for {} answered by {} after {} failed candidates",
                            operation, targetId, template, failures.size());
                }
                return result;
            } catch (FrameioApiException e) {
                LOG.debug("{} candidate {} failed for {}: {}", operation, template, targetId, e.getMessage());
                failures.add(e);
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        }

        int lastStatus = failures.isEmpty()
                ? FrameioApiException.NO_STATUS
                : failures.get(failures.size() - 1).getStatusCode();
        EndpointProbeException exception = new EndpointProbeException(operation, targetId, lastStatus, templates.size());
        failures.forEach(exception::addSuppressed);
        throw exception;
    }

    /** Absolute URL for a template and target identifier. */
    public String resolve(String template, String targetId) {
        String path = template.replace("{id}", URLEncoder.encode(targetId, StandardCharsets.UTF_8));
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        return baseUrl + (path.startsWith("/") ? path : "/" + path);
    }
}
