package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Static, pattern-based grading of a code answer. Nothing is executed.
 *
 * <p>The code is the first fenced block when there is one, the whole reply otherwise. Points:
 *
 * <ul>
 *   <li>25 for a function definition
 *   <li>15 for a return statement
 *   <li>15 for error or input handling
 *   <li>up to 45 for problem-specific idioms, chosen by keywords in the prompt; prompts matching
 *       no known problem get a flat 30
 * </ul>
 */
public final class CodeEvaluator implements Evaluator {
    private static final Pattern CODE_BLOCK =
            Pattern.compile("```(?:javascript|python|js|py)?\\s*([\\s\\S]*?)```");
    private static final Pattern FUNCTION_DEFINITION =
            Pattern.compile("function\\s+\\w+\\s*\\(|def\\s+\\w+\\s*\\(");
    private static final Pattern RETURN_STATEMENT = Pattern.compile("return");
    private static final Pattern ERROR_HANDLING =
            Pattern.compile("try|catch|except|if\\s+.*?error|if\\s+.*?invalid");
    private static final double GENERIC_ALGORITHM_POINTS = 30;

    private static final List<ProblemHeuristic> HEURISTICS =
            List.of(
                    new ProblemHeuristic(
                            "palindrome",
                            List.of(
                                    new Idiom(Pattern.compile("reverse|split.*reverse.*join"), 25),
                                    new Idiom(Pattern.compile("===|==|equals|toLowerCase"), 20))),
                    new ProblemHeuristic(
                            "second largest",
                            List.of(
                                    new Idiom(Pattern.compile("sort\\(|sorted\\("), 25),
                                    new Idiom(
                                            Pattern.compile(
                                                    "\\[\\s*-2\\s*\\]|\\[\\s*1\\s*\\]|second|2nd"),
                                            20))));

    private record Idiom(Pattern pattern, double points) {}

    private record ProblemHeuristic(String promptKeyword, List<Idiom> idioms) {}

    @Override
    public EvaluationMethod method() {
        return EvaluationMethod.CODE_EVALUATION;
    }

    @Override
    public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var content = response.content();
        if (content.isEmpty() || promptCase.evaluationCriteria().isEmpty()) {
            return Evaluation.zero(method().tag(), "No content or evaluation criteria");
        }
        var code = extractCode(content);

        var hasFunction = FUNCTION_DEFINITION.matcher(code).find();
        var hasReturn = RETURN_STATEMENT.matcher(code).find();
        var hasErrorHandling = ERROR_HANDLING.matcher(code).find();
        var algorithmPoints = algorithmPoints(promptCase.prompt(), code);

        var score =
                (hasFunction ? 25 : 0)
                        + (hasReturn ? 15 : 0)
                        + (hasErrorHandling ? 15 : 0)
                        + algorithmPoints;

        var details = new LinkedHashMap<String, Object>();
        details.put("method", method().tag());
        details.put("hasFunction", hasFunction);
        details.put("hasReturn", hasReturn);
        details.put("hasErrorHandling", hasErrorHandling);
        details.put("algorithmScore", algorithmPoints);
        return new Evaluation(score, details);
    }

    static String extractCode(String content) {
        var matcher = CODE_BLOCK.matcher(content);
        return matcher.find() ? matcher.group(1) : content;
    }

    private static double algorithmPoints(String prompt, String code) {
        var lowerPrompt = prompt.toLowerCase(Locale.ROOT);
        for (var heuristic : HEURISTICS) {
            if (lowerPrompt.contains(heuristic.promptKeyword())) {
                var points = 0.0;
                for (var idiom : heuristic.idioms()) {
                    if (idiom.pattern().matcher(code).find()) {
                        points += idiom.points();
                    }
                }
                return points;
            }
        }
        return GENERIC_ALGORITHM_POINTS;
    }
}
