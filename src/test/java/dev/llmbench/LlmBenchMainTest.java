package dev.llmbench;

import static org.junit.jupiter.api.Assertions.*;

import dev.llmbench.backend.BackendConfig;
import dev.llmbench.bench.BenchmarkRun;
import dev.llmbench.bench.PromptResult;
import dev.llmbench.bench.RunSummary;
import dev.llmbench.bench.TaskResult;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LlmBenchMainTest {
    @Test
    void parsesBackendConfigArguments() {
        var config =
                LlmBenchMain.parseBackendConfig(
                        "serverType=native",
                        "apiUrl=localhost:11434",
                        "model=llama3",
                        "taskTypes=factual, coding",
                        "maxPrompts=2",
                        "temperature=0.2",
                        "includeToolCalling=false");

        assertEquals("native", config.serverType());
        assertEquals("localhost:11434", config.apiUrl());
        assertEquals("llama3", config.model());
        assertEquals(List.of("factual", "coding"), config.taskTypes());
        assertEquals(2, config.maxPrompts());
        assertEquals(0.2, config.temperature());
        assertFalse(config.includeToolCalling());
        assertEquals(BackendConfig.DEFAULT_MAX_TOKENS, config.maxTokens());
    }

    @Test
    void noArgumentsSelectDefaults() {
        assertEquals(BackendConfig.builder().build(), LlmBenchMain.parseBackendConfig());
    }

    @Test
    void rejectsArgumentsWithoutKey() {
        assertThrows(IllegalArgumentException.class, () -> LlmBenchMain.parseBackendConfig("llama3"));
        assertThrows(IllegalArgumentException.class, () -> LlmBenchMain.parseBackendConfig("=x"));
    }

    @Test
    void printsReport() {
        var failed =
                new PromptResult(
                        "What year did World War II end?",
                        1200,
                        "",
                        null,
                        0,
                        Map.of(),
                        0,
                        "Request to backend timed out after 30s",
                        Instant.EPOCH);
        var run =
                new BenchmarkRun(
                        "benchmark-42",
                        BackendConfig.builder().model("llama3").build(),
                        Instant.EPOCH,
                        Instant.EPOCH.plusMillis(2_500),
                        2_500,
                        List.of(TaskResult.of("factual", "Factual Knowledge", List.of(failed))),
                        0,
                        new RunSummary(1, 0, 1200, 2.5, 0, 0, null),
                        null);
        var buffer = new ByteArrayOutputStream();

        LlmBenchMain.printReport(run, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        var report = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(report.startsWith("Benchmark benchmark-42: llama3 via openai-style"), report);
        assertTrue(report.contains("Factual Knowledge"), report);
        assertTrue(report.contains("error: Request to backend timed out after 30s"), report);
        assertTrue(report.contains("Overall score 0.0 over 1 prompts in 2.5s"), report);
    }
}
