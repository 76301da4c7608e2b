package dev.llmbench.bench;

import javax.annotation.Nullable;

/** Rounded headline numbers of a run, as shown in reports and history listings. */
public record RunSummary(
        int totalPrompts,
        /** overall weighted score, one decimal */
        double averageScore,
        /** mean of the per-task average response times */
        long averageResponseTimeMs,
        /** one decimal */
        double totalDurationSeconds,
        /** all output tokens over all response time, one decimal */
        double averageTokensPerSecond,
        int totalTokensGenerated,
        /** present when the tool-calling sub-benchmark ran */
        @Nullable ToolCallingSummary toolCalling) {

    public static RunSummary empty(double totalDurationSeconds) {
        return new RunSummary(0, 0, 0, totalDurationSeconds, 0, 0, null);
    }

    public record ToolCallingSummary(double accuracy, double responseTimeMs, double successRate) {
        static ToolCallingSummary of(ToolCallingResult result) {
            return new ToolCallingSummary(
                    result.accuracy(), result.averageResponseTimeMs(), result.successRate());
        }
    }
}
