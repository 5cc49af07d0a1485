package com.coderenew.core.ai;

import com.coderenew.core.exception.AnalysisServiceException;
import com.coderenew.core.exception.AnalysisServiceException.Failure;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnthropicMessagesTransport} against an in-process HTTP server.
 */
class AnthropicMessagesTransportTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> apiKeyHeader = new AtomicReference<>();
    private final AtomicReference<String> versionHeader = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            apiKeyHeader.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            versionHeader.set(exchange.getRequestHeaders().getFirst("anthropic-version"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private AnthropicMessagesTransport transport() {
        return new AnthropicMessagesTransport(HttpClient.newHttpClient(),
            "http://127.0.0.1:" + server.getAddress().getPort() + "/", "test-key", Duration.ofSeconds(5));
    }

    private static AnalysisRequest request() {
        return new AnalysisRequest("claude-test", 4096, "Analyze this", CompatibilityReportTool.definition());
    }

    @Test
    void send_success_postsForcedToolCallAndParsesResponse() throws Exception {
        // Given
        body = """
            {
              "content": [
                {"type": "tool_use", "name": "report_compatibility_issues",
                 "input": {"risk_level": "safe", "summary": "ok", "issues": []}}
              ],
              "stop_reason": "tool_use",
              "usage": {"input_tokens": 1500, "output_tokens": 200}
            }
            """;

        // When
        AnalysisResponse response = transport().send(request());

        // Then: the request
        JsonNode sent = MAPPER.readTree(requestBody.get());
        assertThat(sent.path("model").asText()).isEqualTo("claude-test");
        assertThat(sent.path("max_tokens").asInt()).isEqualTo(4096);
        assertThat(sent.path("tool_choice").path("name").asText()).isEqualTo(CompatibilityReportTool.NAME);
        assertThat(sent.path("tools").get(0).path("input_schema").path("required").toString()).contains("risk_level");
        assertThat(sent.path("messages").get(0).path("content").asText()).isEqualTo("Analyze this");
        assertThat(apiKeyHeader.get()).isEqualTo("test-key");
        assertThat(versionHeader.get()).isEqualTo(AnthropicMessagesTransport.API_VERSION);

        // And: the response
        assertThat(response.content()).hasSize(1);
        assertThat(response.content().get(0).isToolUse()).isTrue();
        assertThat(response.stopReason()).isEqualTo("tool_use");
        assertThat(response.usage()).isEqualTo(new TokenUsage(1500, 200));
    }

    @Test
    void send_rateLimited_throwsRetryableFailure() {
        status = 429;
        body = "{\"error\": {\"type\": \"rate_limit_error\"}}";

        assertThatThrownBy(() -> transport().send(request()))
            .isInstanceOfSatisfying(AnalysisServiceException.class, e -> {
                assertThat(e.getFailure()).isEqualTo(Failure.RATE_LIMITED);
                assertThat(e.getStatus()).isEqualTo(429);
                assertThat(e.isRetryable()).isTrue();
            });
    }

    @Test
    void send_unauthorized_throwsClientError() {
        status = 401;
        body = "{\"error\": {\"type\": \"authentication_error\"}}";

        assertThatThrownBy(() -> transport().send(request()))
            .isInstanceOfSatisfying(AnalysisServiceException.class, e -> {
                assertThat(e.getFailure()).isEqualTo(Failure.AUTHENTICATION);
                assertThat(e.isClientError()).isTrue();
            });
    }

    @Test
    void send_malformedBody_throwsMalformedResponse() {
        body = "<html>gateway</html>";

        assertThatThrownBy(() -> transport().send(request()))
            .isInstanceOfSatisfying(AnalysisServiceException.class,
                e -> assertThat(e.getFailure()).isEqualTo(Failure.MALFORMED_RESPONSE));
    }

    @Test
    void send_unreachable_throwsConnectionFailure() {
        AnthropicMessagesTransport unreachable = new AnthropicMessagesTransport(
            HttpClient.newHttpClient(), "http://127.0.0.1:1", "k", Duration.ofSeconds(2));

        assertThatThrownBy(() -> unreachable.send(request()))
            .isInstanceOfSatisfying(AnalysisServiceException.class,
                e -> assertThat(e.getFailure()).isIn(Failure.CONNECTION, Failure.TIMEOUT));
    }
}
