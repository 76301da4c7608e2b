package dev.llmbench.server;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import dev.llmbench.LlmBench;
import dev.llmbench.backend.BackendHttpClient;
import dev.llmbench.bench.BenchmarkRunner;
import dev.llmbench.config.LlmBenchConfig;
import dev.llmbench.json.LlmBenchJsonMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BenchServerTest {
    private static final String RUN_REQUEST =
            """
            {"serverType": "openai-style", "apiUrl": "http://backend.test", "model": "test-model",
             "taskTypes": ["factual"], "maxPrompts": 1, "includeToolCalling": false}
            """;

    private final HttpClient client = HttpClient.newHttpClient();
    private BackendHttpClient.InMemoryImpl backend;
    private BenchServer server;

    @BeforeEach
    void beforeEach() throws Exception {
        backend =
                new BackendHttpClient.InMemoryImpl()
                        .respond(
                                "/v1/chat/completions",
                                "{\"choices\":[{\"message\":{\"content\":\"Paris\"}}]}");
        var config =
                LlmBenchConfig.builder()
                        .corsOriginWhitelistCsv("https://bench.example.com")
                        .build();
        var bench = new LlmBench(config, BenchmarkRunner.builder().httpClient(backend).build());
        server = BenchServer.builder().bench(bench).host("localhost").port(0).build();
        server.start();
    }

    @AfterEach
    void afterEach() {
        server.stop();
    }

    @Test
    void healthCheck() throws Exception {
        var response = send(request("/").GET());
        assertEquals(200, response.statusCode());
        assertEquals("OK", response.body());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        var response = send(request("/nope").GET());
        assertEquals(404, response.statusCode());
        assertEquals("Not Found", json(response).get("error").asText());
    }

    @Test
    void listsTaskCatalog() throws Exception {
        var response = send(request("/tasks").GET());

        assertEquals(200, response.statusCode());
        var tasks = json(response);
        assertEquals(5, tasks.size());
        assertEquals("factual", tasks.get(0).get("type").asText());
        assertEquals("exactMatch", tasks.get(0).get("evaluation_methods").get(0).asText());
        assertTrue(tasks.get(0).get("prompt_count").asInt() > 0);
    }

    @Test
    void runsBenchmarkAndRecordsHistory() throws Exception {
        var response = send(request("/benchmark").POST(HttpRequest.BodyPublishers.ofString(RUN_REQUEST)));

        assertEquals(200, response.statusCode(), response.body());
        var run = json(response);
        assertTrue(run.get("id").asText().startsWith("benchmark-"));
        assertEquals(100, run.get("overall_score").asDouble());
        assertEquals(1, run.get("summary").get("total_prompts").asInt());
        assertEquals("test-model", run.get("config").get("model").asText());
        assertEquals(
                "http://backend.test/v1/chat/completions",
                backend.exchanges().get(0).uri().toString());

        var history = json(send(request("/history").GET()));
        assertEquals(1, history.size());
        assertEquals(run.get("id"), history.get(0).get("id"));

        var cleared = send(request("/history").DELETE());
        assertEquals(200, cleared.statusCode());
        assertTrue(json(cleared).get("cleared").asBoolean());
        assertEquals(0, json(send(request("/history").GET())).size());
    }

    @Test
    void unsupportedServerTypeIsBadRequest() throws Exception {
        var response =
                send(
                        request("/benchmark")
                                .POST(
                                        HttpRequest.BodyPublishers.ofString(
                                                "{\"server_type\":\"grpc\"}")));

        assertEquals(400, response.statusCode());
        assertEquals("Unsupported server type: grpc", json(response).get("error").asText());
        assertTrue(backend.exchanges().isEmpty());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        for (var body : new String[] {"{oops", "[1, 2]", "null", "{\"maxPrompts\": -1}"}) {
            var response =
                    send(request("/benchmark").POST(HttpRequest.BodyPublishers.ofString(body)));
            assertEquals(400, response.statusCode(), body);
            assertTrue(json(response).has("error"), body);
        }
        assertTrue(backend.exchanges().isEmpty());
    }

    @Test
    void benchmarkRequiresPost() throws Exception {
        assertEquals(405, send(request("/benchmark").GET()).statusCode());
        assertEquals(
                405,
                send(request("/history").PUT(HttpRequest.BodyPublishers.noBody())).statusCode());
    }

    @Test
    void preflightAllowsLocalhostAndWhitelistedOrigins() throws Exception {
        for (var origin : new String[] {"http://localhost:5173", "https://bench.example.com"}) {
            var response = send(preflight(origin));
            assertEquals(204, response.statusCode(), origin);
            assertEquals(
                    origin,
                    response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
            assertTrue(
                    response.headers()
                            .firstValue("Access-Control-Allow-Methods")
                            .orElse("")
                            .contains("DELETE"));
        }
    }

    @Test
    void preflightRejectsOtherOrigins() throws Exception {
        assertEquals(403, send(preflight("https://evil.example.com")).statusCode());
    }

    @Test
    void actualRequestEchoesAllowedOrigin() throws Exception {
        var allowed = send(request("/tasks").header("Origin", "http://127.0.0.1:3000").GET());
        assertEquals(
                "http://127.0.0.1:3000",
                allowed.headers().firstValue("Access-Control-Allow-Origin").orElse(null));

        var other = send(request("/tasks").header("Origin", "https://evil.example.com").GET());
        assertTrue(other.headers().firstValue("Access-Control-Allow-Origin").isEmpty());
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder().uri(URI.create("http://localhost:" + server.port() + path));
    }

    private HttpRequest.Builder preflight(String origin) {
        return request("/benchmark")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .header("Origin", origin)
                .header("Access-Control-Request-Method", "POST");
    }

    private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) {
        return LlmBenchJsonMapper.fromJson(response.body(), JsonNode.class);
    }
}
