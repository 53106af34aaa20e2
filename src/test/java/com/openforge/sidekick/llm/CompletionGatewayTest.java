package com.openforge.sidekick.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.sidekick.config.AppConfig;
import com.openforge.sidekick.error.ErrorKind;
import com.openforge.sidekick.error.SidekickException;
import com.openforge.sidekick.ratelimit.RateLimitProperties;
import com.openforge.sidekick.ratelimit.SlidingWindowRateLimiter;
import com.openforge.sidekick.support.MutableClock;
import com.openforge.sidekick.support.StubBackend;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static com.openforge.sidekick.support.Futures.await;
import static com.openforge.sidekick.support.Futures.failureOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Exercises the gateway against a real HTTP socket so transport failures,
 * status codes and body parsing all go through the production client.
 */
class CompletionGatewayTest {

    private static final String OK_BODY = """
            {"id":"c1","object":"chat.completion","model":"qwen-test",
             "choices":[{"index":0,"message":{"role":"assistant","content":"hello back"},"finish_reason":"stop"}],
             "usage":{"prompt_tokens":3,"completion_tokens":2,"total_tokens":5}}
            """;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final MutableClock clock        = MutableClock.atEpoch();

    private StubBackend              backend;
    private SlidingWindowRateLimiter limiter;
    private CircuitBreaker           breaker;
    private CompletionGateway        gateway;

    @BeforeEach
    void setUp() throws Exception {
        backend = StubBackend.start();
        limiter = new SlidingWindowRateLimiter(clock, new RateLimitProperties(60, 3));
        breaker = CircuitBreaker.ofDefaults("test-backend");
        gateway = gatewayOn(backend.port());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private CompletionGateway gatewayOn(int port) {
        BackendProperties props = new BackendProperties("127.0.0.1", port, "", "qwen-test", 5, 5, 1);
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        return new CompletionGateway(new BackendClient(httpClient, objectMapper, props), limiter, breaker);
    }

    private static CompletionRequest request(String systemPrompt) {
        return CompletionRequest.builder()
                .prompt("hello")
                .systemPrompt(systemPrompt)
                .temperature(0.3)
                .maxTokens(64)
                .build();
    }

    @Test
    void returnsFirstChoiceContent() throws Exception {
        backend.respond("/v1/chat/completions", 200, OK_BODY);

        assertEquals("hello back", await(gateway.complete("A", request("be brief"))));

        JsonNode sent = objectMapper.readTree(backend.requests().get(0).body());
        assertEquals(2, sent.get("messages").size());
        assertEquals("system", sent.get("messages").get(0).get("role").asText());
        assertEquals("be brief", sent.get("messages").get(0).get("content").asText());
        assertEquals("user", sent.get("messages").get(1).get("role").asText());
        assertEquals(64, sent.get("max_tokens").asInt());
        assertEquals(0.3, sent.get("temperature").asDouble(), 1e-9);
        assertFalse(sent.has("model"));
    }

    @Test
    void blankSystemPromptSendsOnlyTheUserMessage() throws Exception {
        backend.respond("/v1/chat/completions", 200, OK_BODY);

        await(gateway.complete("A", request("  ")));

        JsonNode sent = objectMapper.readTree(backend.requests().get(0).body());
        assertEquals(1, sent.get("messages").size());
        assertEquals("user", sent.get("messages").get(0).get("role").asText());
    }

    @Test
    void slowBackendTimesOutAsUnreachable() {
        backend.respondSlowly("/v1/chat/completions", 200, OK_BODY, 3_000);

        SidekickException e = failureOf(gateway.complete("A", request(null)));
        assertEquals(ErrorKind.BACKEND_UNREACHABLE, e.kind());
    }

    @Test
    void refusedConnectionIsUnreachable() throws Exception {
        int closedPort = backend.port();
        backend.close();

        SidekickException e = failureOf(gatewayOn(closedPort).complete("A", request(null)));
        assertEquals(ErrorKind.BACKEND_UNREACHABLE, e.kind());
    }

    @Test
    void serverErrorCarriesItsStatusCode() {
        backend.respond("/v1/chat/completions", 500, "{\"error\":\"boom\"}");

        SidekickException e = failureOf(gateway.complete("A", request(null)));
        assertEquals(ErrorKind.BACKEND_BAD_STATUS, e.kind());
        assertEquals(500, e.statusCode());
    }

    @Test
    void emptyChoicesIsAnEmptyCompletion() {
        backend.respond("/v1/chat/completions", 200, "{\"id\":\"c1\",\"choices\":[]}");

        SidekickException e = failureOf(gateway.complete("A", request(null)));
        assertEquals(ErrorKind.EMPTY_COMPLETION, e.kind());
    }

    @Test
    void whitespaceOnlyContentIsAnEmptyCompletion() {
        backend.respond("/v1/chat/completions", 200,
                "{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"   \"}}]}");

        SidekickException e = failureOf(gateway.complete("A", request(null)));
        assertEquals(ErrorKind.EMPTY_COMPLETION, e.kind());
    }

    @Test
    void failedCallsStillSpendTheBudget() {
        backend.respond("/v1/chat/completions", 500, "{}");

        for (int i = 0; i < 3; i++) {
            assertEquals(ErrorKind.BACKEND_BAD_STATUS, failureOf(gateway.complete("A", request(null))).kind());
        }
        assertEquals(ErrorKind.RATE_LIMITED, failureOf(gateway.complete("A", request(null))).kind());
        assertEquals(3, backend.requests().size());
    }

    @Test
    void rejectedRequestNeverReachesTheBackend() throws Exception {
        backend.respond("/v1/chat/completions", 200, OK_BODY);

        for (int i = 0; i < 3; i++) await(gateway.complete("A", request(null)));
        assertEquals(ErrorKind.RATE_LIMITED, failureOf(gateway.complete("A", request(null))).kind());
        assertEquals(3, backend.requests().size());

        clock.advanceSeconds(61);
        assertEquals("hello back", await(gateway.complete("A", request(null))));
    }

    @Test
    void openCircuitFailsFastAsUnreachable() {
        backend.respond("/v1/chat/completions", 200, OK_BODY);
        breaker.transitionToOpenState();

        SidekickException e = failureOf(gateway.complete("A", request(null)));
        assertEquals(ErrorKind.BACKEND_UNREACHABLE, e.kind());
        assertTrue(backend.requests().isEmpty());
    }

    @Test
    void listsModelIds() throws Exception {
        backend.respond("/v1/models", 200, """
                {"object":"list","data":[{"id":"qwen-coder","object":"model","owned_by":"me"},{"id":"llama-3"}]}
                """);

        assertEquals(List.of("qwen-coder", "llama-3"), await(gateway.listModels()));
    }

    @Test
    void probeReportsModelOrUnknown() throws Exception {
        backend.respond("/v1/chat/completions", 200, OK_BODY);
        assertEquals("qwen-test", await(gateway.probeCurrentModel()));

        backend.respond("/v1/chat/completions", 200,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"hi\"}}]}");
        assertEquals("Unknown", await(gateway.probeCurrentModel()));

        // probes are not rate limited
        assertEquals(0, limiter.snapshot().totalAdmitted());
    }

    @Test
    void loadModelMapsStatusCodes() throws Exception {
        assertEquals(LoadOutcome.Status.UNSUPPORTED, await(gateway.loadModel("qwen")).status());

        backend.respond("/v1/models/load", 200, "{}");
        assertEquals(LoadOutcome.Status.LOADED, await(gateway.loadModel("qwen")).status());

        backend.respond("/v1/models/load", 503, "");
        LoadOutcome failed = await(gateway.loadModel("qwen"));
        assertEquals(LoadOutcome.Status.FAILED, failed.status());
        assertEquals(503, failed.statusCode());
    }
}
