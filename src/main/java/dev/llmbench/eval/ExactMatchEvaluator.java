package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive answer matching.
 *
 * <ul>
 *   <li>100: the trimmed reply equals the expected answer
 *   <li>80: the reply contains the expected answer
 *   <li>90: the reply contains a known alias of the expected answer
 *   <li>0: otherwise
 * </ul>
 */
public final class ExactMatchEvaluator implements Evaluator {
    private static final Map<String, List<String>> ALIASES =
            Map.of("0.05", List.of("5 cent", "$0.05"));

    @Override
    public EvaluationMethod method() {
        return EvaluationMethod.EXACT_MATCH;
    }

    @Override
    public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var content = response.content();
        var expected = promptCase.expectedAnswer();
        if (content.isEmpty() || expected == null) {
            return Evaluation.zero(method().tag(), "No content or expected answer");
        }
        var actual = content.toLowerCase(Locale.ROOT).trim();
        var wanted = expected.toLowerCase(Locale.ROOT).trim();

        final double score;
        final String match;
        if (actual.equals(wanted)) {
            score = 100;
            match = "exact";
        } else if (actual.contains(wanted)) {
            score = 80;
            match = "partial";
        } else if (ALIASES.getOrDefault(wanted, List.of()).stream().anyMatch(actual::contains)) {
            score = 90;
            match = "semantic";
        } else {
            score = 0;
            match = "none";
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("method", method().tag());
        details.put("expected", expected);
        details.put("match", match);
        return new Evaluation(score, details);
    }
}
