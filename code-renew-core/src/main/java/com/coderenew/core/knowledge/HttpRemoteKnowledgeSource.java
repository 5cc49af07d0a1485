package com.coderenew.core.knowledge;

import com.coderenew.core.model.DeprecatedItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RemoteKnowledgeSource} speaking plain JSON over HTTP.
 *
 * <p>Endpoints relative to the configured base URL:
 * <ul>
 *   <li>{@code GET /deprecations?from=..&to=..} returns a JSON array of deprecation records</li>
 *   <li>{@code GET /functions/{name}} returns a JSON object, or 404 when unknown</li>
 * </ul>
 *
 * <p>A configured credential is forwarded as a bearer token. Records that fail
 * validation are skipped individually; a non-array body fails the whole call.
 */
public class HttpRemoteKnowledgeSource implements RemoteKnowledgeSource {

    static final String USER_AGENT = "CodeRenew-MCP-Client/1.0";
    static final Duration DEFAULT_RANGE_TIMEOUT = Duration.ofSeconds(5);
    static final Duration FUNCTION_INFO_TIMEOUT = Duration.ofSeconds(3);

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteKnowledgeSource.class);

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String apiKey;
    private final Duration rangeTimeout;

    public HttpRemoteKnowledgeSource(HttpClient http, String baseUrl, String apiKey, Duration rangeTimeout) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.rangeTimeout = rangeTimeout != null ? rangeTimeout : DEFAULT_RANGE_TIMEOUT;
    }

    public HttpRemoteKnowledgeSource(String baseUrl, String apiKey) {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_RANGE_TIMEOUT).build(), baseUrl, apiKey, DEFAULT_RANGE_TIMEOUT);
    }

    @Override
    public List<DeprecatedItem> fetchDeprecations(String from, String to) throws IOException {
        URI uri = URI.create(baseUrl + "/deprecations?from=" + encode(from) + "&to=" + encode(to));
        HttpResponse<String> response = send(request(uri, rangeTimeout));
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Knowledge service error " + response.statusCode() + " for " + uri);
        }

        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed knowledge service payload: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IOException("Knowledge service payload is not a JSON array");
        }

        List<DeprecatedItem> items = new ArrayList<>();
        for (JsonNode node : root) {
            try {
                items.add(mapper.treeToValue(node, DeprecatedItem.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping invalid knowledge record {}: {}", node.path("name").asText("<unnamed>"), e.getMessage());
            }
        }
        log.debug("Knowledge service returned {} records for {}..{}", items.size(), from, to);
        return items;
    }

    @Override
    public Optional<Map<String, Object>> fetchFunctionInfo(String name) throws IOException {
        URI uri = URI.create(baseUrl + "/functions/" + encode(name));
        HttpResponse<String> response = send(request(uri, FUNCTION_INFO_TIMEOUT));
        if (response.statusCode() / 100 != 2) {
            log.debug("No function info for {} (status {})", name, response.statusCode());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(response.body(), new TypeReference<Map<String, Object>>() { }));
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed function info payload for " + name, e);
        }
    }

    private HttpRequest request(URI uri, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .timeout(timeout)
            .GET();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while calling " + request.uri());
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
