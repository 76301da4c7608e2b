package dev.llmbench.bench;

import dev.llmbench.extract.ToolCall;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Outcome of sending one prompt case to the backend and grading the reply. */
public record PromptResult(
        String prompt,
        /** wall time of the backend call plus extraction and grading */
        long responseTimeMs,
        String content,
        @Nullable List<ToolCall> toolCalls,
        double score,
        Map<String, Object> evaluationDetails,
        /** estimated from the reply text */
        int outputTokens,
        /** failure message; when set, score is 0 */
        @Nullable String error,
        Instant timestamp) {

    public PromptResult {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? null : List.copyOf(toolCalls);
        evaluationDetails = evaluationDetails == null ? Map.of() : evaluationDetails;
    }

    public boolean failed() {
        return error != null;
    }
}
