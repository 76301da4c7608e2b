package dev.llmbench.eval;

import static org.junit.jupiter.api.Assertions.*;

import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import org.junit.jupiter.api.Test;

class LogicalAnalysisEvaluatorTest {
    private final LogicalAnalysisEvaluator evaluator = new LogicalAnalysisEvaluator();
    private final PromptCase syllogism =
            PromptCase.logicalAnalysis(
                    "If all A are B, and some B are C, can we conclude that some A are C?",
                    "No",
                    "This is a logical fallacy. While all A are B, and some B are C, the B that"
                            + " are C might not include any A.");

    @Test
    void correctAnswerWithMatchingReasoning() {
        var evaluation =
                evaluate(
                        syllogism,
                        "No. This is a logical fallacy. While all A are B, the B that are C"
                                + " might not include any A.");
        // logical, fallacy., while, might, include
        assertEquals(30 + 5 * 5, evaluation.score());
        assertEquals(true, evaluation.details().get("correctAnswer"));
        assertEquals(5, evaluation.details().get("keywordMatches"));
    }

    @Test
    void wrongAnswerStillEarnsReasoningPoints() {
        var evaluation = evaluate(syllogism, "Yes, they might, it is logical.");
        assertEquals(10, evaluation.score());
        assertEquals(false, evaluation.details().get("correctAnswer"));
    }

    @Test
    void reasoningPointsAreCapped() {
        var verbose =
                PromptCase.logicalAnalysis("Why?", "yes", "because ".repeat(20).trim());
        var evaluation = evaluate(verbose, "yes because");
        assertEquals(100, evaluation.score());
        assertEquals(70.0, evaluation.details().get("reasoningScore"));
    }

    @Test
    void emptyReplyScoresZero() {
        assertEquals(0, evaluate(syllogism, "").score());
    }

    @Test
    void missingExpectedAnswerOnlyScoresReasoning() {
        var open = PromptCase.logicalAnalysis("Why?", null, "gravity pulls downward");
        assertEquals(15, evaluate(open, "gravity, and it pulls downward").score());
    }

    private Evaluation evaluate(PromptCase promptCase, String content) {
        return evaluator.evaluate(promptCase, ExtractedResponse.ofText(content));
    }
}
