package dev.llmbench.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.llmbench.json.LlmBenchJsonMapper;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds a tool call written into reply text by models without native tool support.
 *
 * <p>Two markups are recognized, checked in this order:
 *
 * <ol>
 *   <li>a fenced block tagged {@code json}: {@code ```json {"name": ..., "arguments": ...} ```}
 *   <li>a tag pair: {@code <tool_call>{"name": ..., "arguments": ...}</tool_call>}
 * </ol>
 *
 * Only the first brace-delimited occurrence of each markup is considered; the tag pair is tried when
 * the fenced block is absent or does not hold a usable object. The object may name the
 * function under {@code name} or {@code function} and its arguments under {@code arguments} or
 * {@code params}.
 */
@Slf4j
final class EmbeddedToolCallParser {
    private static final Pattern FENCED_JSON =
            Pattern.compile("```json\\s*(\\{.*?\\})\\s*```", Pattern.DOTALL);
    private static final Pattern TOOL_CALL_TAG =
            Pattern.compile("<tool_call>\\s*(\\{.*?\\})\\s*</tool_call>", Pattern.DOTALL);
    private static final String UNKNOWN_FUNCTION = "unknown_function";

    private final ObjectMapper objectMapper;

    EmbeddedToolCallParser() {
        this(LlmBenchJsonMapper.get());
    }

    EmbeddedToolCallParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** @return the single embedded tool call, or empty if there is none or it does not parse */
    Optional<List<ToolCall>> parse(String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        for (var pattern : List.of(FENCED_JSON, TOOL_CALL_TAG)) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find()) {
                var toolCall = toToolCall(matcher.group(1));
                if (toolCall.isPresent()) {
                    return Optional.of(List.of(toolCall.get()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ToolCall> toToolCall(String json) {
        final JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable tool call markup: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.debug("Ignoring tool call markup that is not a JSON object: {}", json);
            return Optional.empty();
        }
        var name = firstText(node, "name", "function").orElse(UNKNOWN_FUNCTION);
        var arguments = firstPresent(node, "arguments", "params");
        String encoded;
        if (arguments == null) {
            encoded = "{}";
        } else if (arguments.isTextual()) {
            encoded = arguments.asText();
        } else {
            encoded = arguments.toString();
        }
        return Optional.of(ToolCall.of(name, encoded));
    }

    private static Optional<String> firstText(JsonNode node, String... fields) {
        for (var field : fields) {
            var value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (var field : fields) {
            var value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}
