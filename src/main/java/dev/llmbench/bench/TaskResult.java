package dev.llmbench.bench;

import java.util.List;

/** Results for one task type, in prompt order, with per-task averages. */
public record TaskResult(
        String type,
        String name,
        List<PromptResult> prompts,
        double averageScore,
        double averageResponseTimeMs,
        int totalTokens,
        double tokensPerSecond) {

    public TaskResult {
        prompts = List.copyOf(prompts);
    }

    /** Derive the averages from {@code prompts}. All averages are 0 for an empty list. */
    public static TaskResult of(String type, String name, List<PromptResult> prompts) {
        if (prompts.isEmpty()) {
            return new TaskResult(type, name, prompts, 0, 0, 0, 0);
        }
        var totalScore = 0.0;
        var totalTimeMs = 0L;
        var totalTokens = 0;
        for (var prompt : prompts) {
            totalScore += prompt.score();
            totalTimeMs += prompt.responseTimeMs();
            totalTokens += prompt.outputTokens();
        }
        var tokensPerSecond = totalTimeMs > 0 ? totalTokens / (totalTimeMs / 1000.0) : 0;
        return new TaskResult(
                type,
                name,
                prompts,
                totalScore / prompts.size(),
                (double) totalTimeMs / prompts.size(),
                totalTokens,
                tokensPerSecond);
    }
}
