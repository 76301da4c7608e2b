package dev.llmbench.bench;

import dev.llmbench.backend.BackendConfig;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A complete benchmark run.
 *
 * <p>{@code id} is null until the run is saved to history.
 */
public record BenchmarkRun(
        @Nullable String id,
        BackendConfig config,
        Instant startTime,
        Instant endTime,
        long totalDurationMs,
        List<TaskResult> tasks,
        double overallScore,
        RunSummary summary,
        @Nullable ToolCallingResult toolCalling) {

    public BenchmarkRun {
        tasks = List.copyOf(tasks);
    }

    public BenchmarkRun withId(String id) {
        return new BenchmarkRun(
                id,
                config,
                startTime,
                endTime,
                totalDurationMs,
                tasks,
                overallScore,
                summary,
                toolCalling);
    }
}
