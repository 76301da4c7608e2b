package dev.llmbench;

import dev.llmbench.backend.BackendConfig;
import dev.llmbench.backend.BackendHttpClient;
import dev.llmbench.bench.BenchmarkRun;
import dev.llmbench.bench.BenchmarkRunner;
import dev.llmbench.catalog.TaskCatalog;
import dev.llmbench.config.LlmBenchConfig;
import dev.llmbench.history.FileKeyValueStore;
import dev.llmbench.history.RunHistoryStore;
import java.time.Clock;
import java.util.List;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Main entry point for running LLM benchmarks.
 *
 * <p>Instances are plain values wired from a {@link LlmBenchConfig}: there is no global instance,
 * so independent benches (e.g. in tests) never share history or HTTP clients.
 *
 * @see BenchmarkRunner for injecting fakes
 */
public class LlmBench {
    @Getter
    @Accessors(fluent = true)
    private final LlmBenchConfig config;

    private final BenchmarkRunner runner;

    /** Create an instance that saves history under {@link LlmBenchConfig#historyDir()}. */
    public static LlmBench of(LlmBenchConfig config) {
        var historyStore =
                new RunHistoryStore(
                        new FileKeyValueStore(config.historyDir()),
                        config.historyLimit(),
                        Clock.systemUTC());
        var runner =
                BenchmarkRunner.builder()
                        .httpClient(BackendHttpClient.of(config))
                        .historyStore(historyStore)
                        .requestTimeout(config.requestTimeout())
                        .build();
        return new LlmBench(config, runner);
    }

    public LlmBench(LlmBenchConfig config, BenchmarkRunner runner) {
        this.config = config;
        this.runner = runner;
    }

    /**
     * Run the configured tasks against the configured backend and save the run to history.
     *
     * @throws dev.llmbench.backend.UnsupportedServerTypeException if the server type is unknown
     */
    public BenchmarkRun runBenchmark(@Nonnull BackendConfig backendConfig) {
        return runner.run(backendConfig);
    }

    /** Saved runs, most recent first. */
    public List<BenchmarkRun> getBenchmarkHistory() {
        return runner.history();
    }

    public boolean clearBenchmarkHistory() {
        return runner.clearHistory();
    }

    public TaskCatalog taskCatalog() {
        return runner.catalog();
    }
}
