package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Scores a reasoning answer on correctness and on how much of the reference explanation it
 * echoes.
 *
 * <p>30 points when the reply contains the expected answer, plus 5 points per reference
 * explanation word longer than four characters that the reply mentions (capped at 70). Words are
 * split on single spaces and kept with their punctuation, so repeated words count once per
 * occurrence in the explanation.
 */
public final class LogicalAnalysisEvaluator implements Evaluator {
    static final double CORRECTNESS_POINTS = 30;
    static final double POINTS_PER_KEYWORD = 5;
    static final double MAX_REASONING_POINTS = 70;

    @Override
    public EvaluationMethod method() {
        return EvaluationMethod.LOGICAL_ANALYSIS;
    }

    @Override
    public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var content = response.content().toLowerCase(Locale.ROOT);
        if (content.isEmpty()) {
            return Evaluation.zero(method().tag(), "No content");
        }

        var expected = promptCase.expectedAnswer();
        var correct = expected != null && content.contains(expected.toLowerCase(Locale.ROOT));

        var keywordHits = 0;
        if (promptCase.explanation() != null) {
            for (var word : promptCase.explanation().toLowerCase(Locale.ROOT).split(" ")) {
                if (word.length() > 4 && content.contains(word)) {
                    keywordHits++;
                }
            }
        }
        var reasoningPoints = Math.min(keywordHits * POINTS_PER_KEYWORD, MAX_REASONING_POINTS);

        var details = new LinkedHashMap<String, Object>();
        details.put("method", method().tag());
        details.put("correctAnswer", correct);
        details.put("keywordMatches", keywordHits);
        details.put("reasoningScore", reasoningPoints);
        return new Evaluation((correct ? CORRECTNESS_POINTS : 0) + reasoningPoints, details);
    }
}
