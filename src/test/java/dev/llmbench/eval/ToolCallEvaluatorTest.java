package dev.llmbench.eval;

import static org.junit.jupiter.api.Assertions.*;

import dev.llmbench.catalog.PromptCase;
import dev.llmbench.catalog.TaskCatalog;
import dev.llmbench.extract.ExtractedResponse;
import dev.llmbench.extract.ToolCall;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolCallEvaluatorTest {
    private final ToolCallEvaluator evaluator = new ToolCallEvaluator();
    private final List<PromptCase> toolCalling =
            TaskCatalog.builtIn().get(TaskCatalog.TOOL_CALLING).orElseThrow().prompts();
    private final PromptCase weather = toolCalling.get(0);
    private final PromptCase calculator = toolCalling.get(1);

    @Test
    void correctToolAndSubstringArgument() {
        var evaluation = evaluate(weather, ToolCall.of("get_weather", "{\"location\":\"new york\"}"));
        assertEquals(100, evaluation.score());
        assertEquals(true, evaluation.details().get("correctArgs"));
    }

    @Test
    void oneOfTwoArgumentsMatching() {
        var evaluation =
                evaluate(calculator, ToolCall.of("calculator", "{\"operation\":\"add\",\"operands\":[1,2]}"));
        assertEquals(75, evaluation.score());
        assertEquals(List.of("operation"), evaluation.details().get("matchedArgs"));
        assertEquals(false, evaluation.details().get("correctArgs"));
    }

    @Test
    void numbersCompareByValue() {
        var evaluation =
                evaluate(
                        calculator,
                        ToolCall.of("calculator", "{\"operation\":\"ADD\",\"operands\":[235.0,467]}"));
        assertEquals(100, evaluation.score());
    }

    @Test
    void wrongToolScoresZero() {
        var evaluation = evaluate(weather, ToolCall.of("search", "{\"query\":\"weather\"}"));
        assertEquals(0, evaluation.score());
        assertEquals(
                "Wrong tool called: search instead of get_weather",
                evaluation.details().get("reason"));
    }

    @Test
    void unparseableArgumentsScoreHalf() {
        var evaluation = evaluate(weather, ToolCall.of("get_weather", "{location: "));
        assertEquals(50, evaluation.score());
        assertEquals(true, evaluation.details().get("correctTool"));
        assertEquals(false, evaluation.details().get("correctArgs"));
    }

    @Test
    void nonObjectArgumentsScoreHalf() {
        assertEquals(50, evaluate(weather, ToolCall.of("get_weather", "[\"NYC\"]")).score());
    }

    @Test
    void missingArgumentsScoreHalf() {
        assertEquals(50, evaluate(weather, ToolCall.of("get_weather", null)).score());
        assertEquals(50, evaluate(weather, ToolCall.of("get_weather", "{\"location\":\"\"}")).score());
    }

    @Test
    void onlyTheFirstCallCounts() {
        var response =
                new ExtractedResponse(
                        "",
                        List.of(
                                ToolCall.of("search", "{}"),
                                ToolCall.of("get_weather", "{\"location\":\"NYC\"}")));
        assertEquals(0, evaluator.evaluate(weather, response).score());
    }

    @Test
    void noToolCallsScoreZero() {
        assertEquals(0, evaluator.evaluate(weather, ExtractedResponse.ofText("Sunny")).score());
        assertEquals(0, evaluator.evaluate(weather, new ExtractedResponse("", List.of())).score());
        assertEquals(
                "No tool calls found",
                evaluator.evaluate(weather, ExtractedResponse.ofText("")).details().get("reason"));
    }

    private Evaluation evaluate(PromptCase promptCase, ToolCall toolCall) {
        return evaluator.evaluate(promptCase, new ExtractedResponse("", List.of(toolCall)));
    }
}
