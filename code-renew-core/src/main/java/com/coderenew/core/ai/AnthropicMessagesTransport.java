package com.coderenew.core.ai;

import com.coderenew.core.exception.AnalysisServiceException;
import com.coderenew.core.exception.AnalysisServiceException.Failure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link AnalysisTransport} for the Anthropic Messages API ({@code POST /v1/messages}).
 *
 * <p>Forces structured output by declaring a single tool and setting
 * {@code tool_choice} to that tool. HTTP failures are classified:
 * <ul>
 *   <li>429 - rate limited (retryable)</li>
 *   <li>5xx, including 529 overloaded - server error (retryable)</li>
 *   <li>401, 403 - authentication (not retryable)</li>
 *   <li>other 4xx - bad request (not retryable)</li>
 *   <li>no response - connection failure or timeout (retryable)</li>
 * </ul>
 */
public class AnthropicMessagesTransport implements AnalysisTransport {

    static final String API_VERSION = "2023-06-01";

    private static final Logger log = LoggerFactory.getLogger(AnthropicMessagesTransport.class);

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public AnthropicMessagesTransport(HttpClient http, String baseUrl, String apiKey, Duration requestTimeout) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "https://api.anthropic.com"
            : baseUrl.replaceAll("/+$", "");
        this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(120);
    }

    @Override
    public AnalysisResponse send(AnalysisRequest request) throws InterruptedException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/v1/messages"))
            .header("x-api-key", apiKey)
            .header("anthropic-version", API_VERSION)
            .header("content-type", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(serialize(request)))
            .build();

        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AnalysisServiceException(Failure.TIMEOUT, -1, "Analysis service timed out", e);
        } catch (IOException e) {
            throw new AnalysisServiceException(Failure.CONNECTION, -1,
                "Analysis service unreachable: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            Failure failure = AnalysisServiceException.classify(status);
            log.debug("Analysis service returned {} ({})", status, failure);
            throw new AnalysisServiceException(failure, status,
                "Analysis service error " + status + ": " + abbreviate(response.body()));
        }
        return parse(response.body(), status);
    }

    String serialize(AnalysisRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", request.model());
        body.put("max_tokens", request.maxTokens());

        ArrayNode tools = body.putArray("tools");
        tools.add(mapper.valueToTree(request.tool()));
        body.putObject("tool_choice")
            .put("type", "tool")
            .put("name", request.tool().name());

        ArrayNode messages = body.putArray("messages");
        messages.addObject()
            .put("role", "user")
            .put("content", request.prompt());

        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AnalysisServiceException(Failure.BAD_REQUEST, -1, "Cannot serialize request", e);
        }
    }

    private AnalysisResponse parse(String body, int status) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AnalysisServiceException(Failure.MALFORMED_RESPONSE, status,
                "Analysis service returned malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisServiceException(Failure.MALFORMED_RESPONSE, status,
                "Analysis service returned a non-object body");
        }

        List<ContentBlock> blocks = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            blocks.add(new ContentBlock(
                block.path("type").asText(""),
                block.hasNonNull("text") ? block.get("text").asText() : null,
                block.hasNonNull("name") ? block.get("name").asText() : null,
                block.get("input")
            ));
        }
        JsonNode usage = root.path("usage");
        return new AnalysisResponse(
            blocks,
            root.path("stop_reason").asText(null),
            new TokenUsage(usage.path("input_tokens").asLong(0), usage.path("output_tokens").asLong(0))
        );
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
