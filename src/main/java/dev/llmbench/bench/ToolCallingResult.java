package dev.llmbench.bench;

import dev.llmbench.extract.ToolCall;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The tool-calling sub-benchmark: every tool-calling case run with the tool definitions attached.
 *
 * <p>A case succeeds when it scores at least {@link #SUCCESS_THRESHOLD}, i.e. the right tool was
 * called.
 */
public record ToolCallingResult(
        List<ToolCallingCase> testCases,
        double successRate,
        double accuracy,
        double averageResponseTimeMs,
        double averageScore) {

    public static final double SUCCESS_THRESHOLD = 50;

    public ToolCallingResult {
        testCases = List.copyOf(testCases);
    }

    public static ToolCallingResult of(List<ToolCallingCase> testCases) {
        if (testCases.isEmpty()) {
            return new ToolCallingResult(testCases, 0, 0, 0, 0);
        }
        var successes = testCases.stream().filter(ToolCallingCase::success).count();
        var successRate = (double) successes / testCases.size();
        return new ToolCallingResult(
                testCases,
                successRate,
                successRate,
                testCases.stream().mapToLong(ToolCallingCase::responseTimeMs).average().orElse(0),
                testCases.stream().mapToDouble(ToolCallingCase::score).average().orElse(0));
    }

    public record ToolCallingCase(
            String prompt,
            String expectedTool,
            Map<String, Object> expectedArgs,
            @Nullable List<ToolCall> actualToolCalls,
            double score,
            boolean success,
            long responseTimeMs,
            @Nullable String error) {

        static ToolCallingCase of(
                String expectedTool, Map<String, Object> expectedArgs, PromptResult result) {
            return new ToolCallingCase(
                    result.prompt(),
                    expectedTool,
                    expectedArgs,
                    result.toolCalls(),
                    result.score(),
                    result.score() >= SUCCESS_THRESHOLD,
                    result.responseTimeMs(),
                    result.error());
        }
    }
}
