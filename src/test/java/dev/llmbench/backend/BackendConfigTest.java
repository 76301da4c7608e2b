package dev.llmbench.backend;

import static org.junit.jupiter.api.Assertions.*;

import dev.llmbench.json.LlmBenchJsonMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class BackendConfigTest {
    @Test
    void emptyJsonGetsDefaults() {
        var config = LlmBenchJsonMapper.fromJson("{}", BackendConfig.class);
        assertEquals("openai-style", config.serverType());
        assertEquals("http://localhost:1234", config.apiUrl());
        assertEquals("unknown", config.model());
        assertEquals(0.7, config.temperature());
        assertEquals(256, config.maxTokens());
        assertEquals(List.of("factual"), config.taskTypes());
        assertEquals(3, config.maxPrompts());
        assertTrue(config.includeToolCalling());
    }

    @Test
    void acceptsCamelCaseAndSnakeCaseKeys() {
        var camel =
                LlmBenchJsonMapper.fromJson(
                        """
                        {"serverType":"native","apiUrl":"localhost:11434","model":"llama3",
                         "maxTokens":64,"taskTypes":["coding"],"maxPrompts":1,
                         "includeFunctionCalling":false}
                        """,
                        BackendConfig.class);
        var snake =
                LlmBenchJsonMapper.fromJson(
                        """
                        {"server_type":"native","api_url":"localhost:11434","model":"llama3",
                         "max_tokens":64,"task_types":["coding"],"max_prompts":1,
                         "include_tool_calling":false}
                        """,
                        BackendConfig.class);
        assertEquals(camel, snake);
        assertEquals("native", camel.serverType());
        assertEquals(64, camel.maxTokens());
        assertEquals(List.of("coding"), camel.taskTypes());
        assertFalse(camel.includeToolCalling());
    }

    @Test
    void builderSetsEveryField() {
        var config =
                BackendConfig.builder()
                        .serverType(ServerType.NATIVE)
                        .apiUrl("http://gpu-box:11434")
                        .model("mistral")
                        .temperature(0.1)
                        .maxTokens(32)
                        .taskTypes("factual", "reasoning")
                        .maxPrompts(5)
                        .includeToolCalling(false)
                        .build();
        assertEquals(
                new BackendConfig(
                        "native",
                        "http://gpu-box:11434",
                        "mistral",
                        0.1,
                        32,
                        List.of("factual", "reasoning"),
                        5,
                        false),
                config);
    }

    @Test
    void negativeMaxPromptsIsRejected() {
        var e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> BackendConfig.builder().maxPrompts(-1).build());
        assertTrue(e.getMessage().contains("maxPrompts"));
        assertThrows(
                Exception.class,
                () -> LlmBenchJsonMapper.fromJson("{\"max_prompts\":-1}", BackendConfig.class));
        assertEquals(0, BackendConfig.builder().maxPrompts(0).build().maxPrompts());
    }

    @Test
    void unknownOrMissingServerTypeIsUnsupported() {
        assertThrows(UnsupportedServerTypeException.class, () -> ServerType.fromValue("grpc"));
        assertThrows(UnsupportedServerTypeException.class, () -> ServerType.fromValue(null));
    }

    @Test
    void serverTypeAliasesResolve() {
        assertEquals(ServerType.OPENAI_STYLE, ServerType.fromValue("openai-style"));
        assertEquals(ServerType.OPENAI_STYLE, ServerType.fromValue("lmStudio"));
        assertEquals(ServerType.NATIVE, ServerType.fromValue("native"));
        assertEquals(ServerType.NATIVE, ServerType.fromValue("ollama"));
        var e =
                assertThrows(
                        UnsupportedServerTypeException.class, () -> ServerType.fromValue("vllm"));
        assertEquals("Unsupported server type: vllm", e.getMessage());
        assertThrows(UnsupportedServerTypeException.class, () -> ServerType.fromValue(null));
    }
}
