package dev.llmbench.extract;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Pulls reply text and tool calls out of the reply shapes the supported backends produce.
 *
 * <p>Extraction runs in two stages. Known structured fields are tried first, in a fixed priority
 * order. Only when none of them carries tool calls is the extracted text scanned for embedded tool
 * call markup (see {@link EmbeddedToolCallParser}).
 *
 * <p>Content priority: {@code choices[0].message.content}, {@code choices[0].text}, {@code
 * response}, {@code message.content}, then {@code content}, {@code output}, {@code
 * generated_text} and {@code result}. A reply with a non-empty {@code choices} array never falls
 * through to the later fields.
 *
 * <p>Tool call priority: {@code choices[0].message.tool_calls}, {@code message.tool_calls}, then
 * the text fallback.
 *
 * <p>A streamed reply (an array of chunks) is reduced to the concatenation of each chunk's text
 * plus the first tool calls any chunk carries.
 */
public final class ResponseExtractor {
    private static final List<String> GENERIC_CONTENT_FIELDS =
            List.of("content", "output", "generated_text", "result");

    private final EmbeddedToolCallParser embeddedParser;

    public ResponseExtractor() {
        this(new EmbeddedToolCallParser());
    }

    ResponseExtractor(EmbeddedToolCallParser embeddedParser) {
        this.embeddedParser = embeddedParser;
    }

    public ExtractedResponse extract(@Nullable JsonNode reply) {
        var content = extractContent(reply);
        return new ExtractedResponse(content, extractToolCalls(reply, content));
    }

    public String extractContent(@Nullable JsonNode reply) {
        if (reply == null || reply.isNull() || reply.isMissingNode()) {
            return "";
        }
        if (reply.isArray()) {
            var text = new StringBuilder();
            reply.forEach(chunk -> text.append(extractContent(chunk)));
            return text.toString();
        }
        var choices = reply.path("choices");
        if (choices.isArray() && !choices.isEmpty()) {
            var first = choices.get(0);
            return nonEmptyText(first.path("message").path("content"))
                    .or(() -> nonEmptyText(first.path("text")))
                    .orElse("");
        }
        var direct =
                nonEmptyText(reply.path("response"))
                        .or(() -> nonEmptyText(reply.path("message").path("content")));
        if (direct.isPresent()) {
            return direct.get();
        }
        for (var field : GENERIC_CONTENT_FIELDS) {
            var text = nonEmptyText(reply.path(field));
            if (text.isPresent()) {
                return text.get();
            }
        }
        return "";
    }

    @Nullable
    public List<ToolCall> extractToolCalls(@Nullable JsonNode reply, String content) {
        return structuredToolCalls(reply)
                .or(() -> embeddedParser.parse(content))
                .orElse(null);
    }

    private Optional<List<ToolCall>> structuredToolCalls(@Nullable JsonNode reply) {
        if (reply == null || reply.isNull() || reply.isMissingNode()) {
            return Optional.empty();
        }
        if (reply.isArray()) {
            for (var chunk : reply) {
                var calls = structuredToolCalls(chunk);
                if (calls.isPresent()) {
                    return calls;
                }
            }
            return Optional.empty();
        }
        var openAiStyle = reply.path("choices").path(0).path("message").path("tool_calls");
        if (openAiStyle.isArray()) {
            return Optional.of(normalize(openAiStyle));
        }
        var nativeStyle = reply.path("message").path("tool_calls");
        if (nativeStyle.isArray()) {
            return Optional.of(normalize(nativeStyle));
        }
        return Optional.empty();
    }

    private static List<ToolCall> normalize(JsonNode toolCalls) {
        var normalized = new ArrayList<ToolCall>(toolCalls.size());
        for (var call : toolCalls) {
            var function = call.path("function");
            var id = call.path("id");
            var type = call.path("type");
            normalized.add(
                    new ToolCall(
                            id.isTextual() ? id.asText() : null,
                            type.isTextual() ? type.asText() : "function",
                            new ToolCall.Function(
                                    function.path("name").asText(null),
                                    encodeArguments(function.path("arguments")))));
        }
        return normalized;
    }

    /** Native replies carry arguments as an object, OpenAI-style ones as a JSON string. */
    @Nullable
    private static String encodeArguments(JsonNode arguments) {
        if (arguments.isMissingNode() || arguments.isNull()) {
            return null;
        }
        return arguments.isTextual() ? arguments.asText() : arguments.toString();
    }

    private static Optional<String> nonEmptyText(JsonNode node) {
        return node.isTextual() && !node.asText().isEmpty()
                ? Optional.of(node.asText())
                : Optional.empty();
    }
}
