package dev.llmbench.extract;

import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Free text and tool calls pulled out of a backend reply.
 *
 * @param content reply text, empty when the reply carried none
 * @param toolCalls requested tool calls, or null when the reply made none
 */
public record ExtractedResponse(@Nonnull String content, @Nullable List<ToolCall> toolCalls) {
    public ExtractedResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? null : List.copyOf(toolCalls);
    }

    public static ExtractedResponse ofText(String content) {
        return new ExtractedResponse(content, null);
    }
}
