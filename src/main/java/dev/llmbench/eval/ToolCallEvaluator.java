package dev.llmbench.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import dev.llmbench.json.LlmBenchJsonMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Grades the first tool call of a reply: 50 points for calling the expected function, and the
 * other 50 shared equally between the expected arguments the call supplies.
 *
 * <p>String arguments match when either contains the other, ignoring case. Other values match on
 * JSON equality, numbers compared by value.
 */
@Slf4j
public final class ToolCallEvaluator implements Evaluator {
    static final double CORRECT_TOOL_POINTS = 50;
    static final double ARGUMENT_POINTS = 50;

    private final ObjectMapper objectMapper;

    public ToolCallEvaluator() {
        this(LlmBenchJsonMapper.get());
    }

    ToolCallEvaluator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public EvaluationMethod method() {
        return EvaluationMethod.TOOL_CALL_EVALUATION;
    }

    @Override
    public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var toolCalls = response.toolCalls();
        var expectedTool = promptCase.expectedTool();
        if (toolCalls == null || toolCalls.isEmpty() || expectedTool == null) {
            return Evaluation.zero(method().tag(), "No tool calls found");
        }

        var call = toolCalls.get(0);
        var actualTool = call.function().name();
        if (!expectedTool.equals(actualTool)) {
            var details = baseDetails(actualTool, false, false);
            details.put(
                    "reason",
                    "Wrong tool called: %s instead of %s".formatted(actualTool, expectedTool));
            return new Evaluation(0, details);
        }

        final JsonNode arguments;
        try {
            arguments = parseArguments(call.function().arguments());
        } catch (JsonProcessingException e) {
            log.debug("Tool call arguments are not valid JSON: {}", e.getOriginalMessage());
            var details = baseDetails(actualTool, true, false);
            details.put("reason", "Arguments are not valid JSON");
            return new Evaluation(CORRECT_TOOL_POINTS, details);
        }
        if (!arguments.isObject()) {
            var details = baseDetails(actualTool, true, false);
            details.put("reason", "Arguments are not a JSON object");
            return new Evaluation(CORRECT_TOOL_POINTS, details);
        }

        var expectedArgs = promptCase.expectedArgs();
        var matchedArgs = new ArrayList<String>();
        for (Map.Entry<String, Object> expected : expectedArgs.entrySet()) {
            var actual = arguments.get(expected.getKey());
            JsonNode wanted = objectMapper.valueToTree(expected.getValue());
            if (isPresent(actual) && argumentMatches(wanted, actual)) {
                matchedArgs.add(expected.getKey());
            }
        }
        var argumentPoints =
                expectedArgs.isEmpty()
                        ? 0
                        : ARGUMENT_POINTS * matchedArgs.size() / expectedArgs.size();

        var details = baseDetails(actualTool, true, matchedArgs.size() == expectedArgs.size());
        details.put("matchedArgs", matchedArgs);
        return new Evaluation(CORRECT_TOOL_POINTS + argumentPoints, details);
    }

    private JsonNode parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        var parsed = objectMapper.readTree(arguments);
        return parsed == null ? objectMapper.createObjectNode() : parsed;
    }

    /** Missing, null, empty, false and zero values never count as supplied. */
    private static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0;
        }
        return true;
    }

    static boolean argumentMatches(JsonNode expected, JsonNode actual) {
        if (expected.isTextual() && actual.isTextual()) {
            var want = expected.asText().toLowerCase(Locale.ROOT);
            var got = actual.asText().toLowerCase(Locale.ROOT);
            return got.contains(want) || want.contains(got);
        }
        return expected.equals(ToolCallEvaluator::compareLeaves, actual);
    }

    private static int compareLeaves(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return a.equals(b) ? 0 : 1;
    }

    private LinkedHashMap<String, Object> baseDetails(
            String actualTool, boolean correctTool, boolean correctArgs) {
        var details = new LinkedHashMap<String, Object>();
        details.put("method", method().tag());
        details.put("actualTool", actualTool);
        details.put("correctTool", correctTool);
        details.put("correctArgs", correctArgs);
        return details;
    }
}
