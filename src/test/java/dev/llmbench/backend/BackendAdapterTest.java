package dev.llmbench.backend;

import static org.junit.jupiter.api.Assertions.*;

import dev.llmbench.catalog.BuiltInTools;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class BackendAdapterTest {
    private final BackendHttpClient.InMemoryImpl httpClient =
            new BackendHttpClient.InMemoryImpl()
                    .respond("/chat/completions", "{\"choices\":[]}")
                    .respond("/api/chat", "{\"message\":{\"content\":\"\"}}")
                    .respond("/api/generate", "{\"response\":\"\"}");

    @Test
    void openAiStyleAppendsV1ChatCompletions() {
        var adapter = adapter(ServerType.OPENAI_STYLE, "localhost:1234/");
        assertEquals(
                URI.create("http://localhost:1234/v1/chat/completions"), adapter.endpoint(false));
        assertEquals(
                URI.create("http://localhost:1234/v1/chat/completions"), adapter.endpoint(true));
    }

    @Test
    void openAiStyleKeepsExistingV1() {
        var adapter = adapter(ServerType.OPENAI_STYLE, "https://models.internal/v1//");
        assertEquals(
                URI.create("https://models.internal/v1/chat/completions"), adapter.endpoint(false));
    }

    @Test
    void nativeUsesChatOnlyWithTools() {
        var adapter = adapter(ServerType.NATIVE, "http://localhost:11434");
        assertEquals(URI.create("http://localhost:11434/api/chat"), adapter.endpoint(true));
        assertEquals(URI.create("http://localhost:11434/api/generate"), adapter.endpoint(false));
    }

    @Test
    void openAiStyleRequestWithTools() {
        adapter(ServerType.OPENAI_STYLE, "http://localhost:1234")
                .complete("What's the weather?", BuiltInTools.all());

        var exchange = httpClient.exchanges().get(0);
        var body = exchange.body();
        assertEquals("llama3", body.get("model").asText());
        assertEquals("user", body.get("messages").get(0).get("role").asText());
        assertEquals("What's the weather?", body.get("messages").get(0).get("content").asText());
        assertEquals(0.2, body.get("temperature").asDouble());
        assertEquals(64, body.get("max_tokens").asInt());
        assertEquals(3, body.get("tools").size());
        assertEquals("get_weather", body.get("tools").get(0).get("function").get("name").asText());
        assertEquals("auto", body.get("tool_choice").asText());
        assertEquals(Duration.ofSeconds(7), exchange.timeout());
    }

    @Test
    void openAiStyleRequestWithoutToolsOmitsToolFields() {
        adapter(ServerType.OPENAI_STYLE, "http://localhost:1234").complete("Hi", List.of());

        var body = httpClient.exchanges().get(0).body();
        assertFalse(body.has("tools"));
        assertFalse(body.has("tool_choice"));
    }

    @Test
    void nativeChatRequest() {
        adapter(ServerType.NATIVE, "http://localhost:11434").complete("Hi", BuiltInTools.all());

        var exchange = httpClient.exchanges().get(0);
        assertEquals("/api/chat", exchange.uri().getPath());
        var body = exchange.body();
        assertEquals("Hi", body.get("messages").get(0).get("content").asText());
        assertEquals(64, body.get("num_predict").asInt());
        assertFalse(body.get("stream").asBoolean());
        assertEquals(3, body.get("tools").size());
        assertFalse(body.has("max_tokens"));
    }

    @Test
    void nativeGenerateRequestIsFlat() {
        adapter(ServerType.NATIVE, "http://localhost:11434").complete("Hi", null);

        var exchange = httpClient.exchanges().get(0);
        assertEquals("/api/generate", exchange.uri().getPath());
        var body = exchange.body();
        assertEquals(4, body.size(), body.toString());
        assertEquals("llama3", body.get("model").asText());
        assertEquals("Hi", body.get("prompt").asText());
        assertEquals(0.2, body.get("temperature").asDouble());
        assertEquals(64, body.get("num_predict").asInt());
    }

    @Test
    void unsupportedServerTypeFailsOnCreation() {
        var config = BackendConfig.builder().serverType("vllm").build();
        assertThrows(
                UnsupportedServerTypeException.class, () -> BackendAdapter.of(config, httpClient));
        assertTrue(httpClient.exchanges().isEmpty());
    }

    @Test
    void normalizeBaseUrl() {
        assertEquals("http://localhost:1234", BackendAdapter.normalizeBaseUrl(" localhost:1234 "));
        assertEquals("https://host", BackendAdapter.normalizeBaseUrl("https://host///"));
        assertEquals("http://host/v1", BackendAdapter.normalizeBaseUrl("http://host/v1/"));
    }

    private BackendAdapter adapter(ServerType serverType, String apiUrl) {
        var config =
                BackendConfig.builder()
                        .serverType(serverType)
                        .apiUrl(apiUrl)
                        .model("llama3")
                        .temperature(0.2)
                        .maxTokens(64)
                        .build();
        return BackendAdapter.of(config, httpClient, Duration.ofSeconds(7));
    }
}
