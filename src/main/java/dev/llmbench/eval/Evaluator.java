package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import java.util.function.BiFunction;

/**
 * Grades an extracted reply against its prompt case with a score between 0 (inclusive) and 100
 * (inclusive).
 *
 * <p>Evaluators are pure: the same case and reply always produce the same evaluation.
 */
public interface Evaluator {
    EvaluationMethod method();

    Evaluation evaluate(PromptCase promptCase, ExtractedResponse response);

    static Evaluator of(
            EvaluationMethod method,
            BiFunction<PromptCase, ExtractedResponse, Evaluation> evaluateFn) {
        return new Evaluator() {
            @Override
            public EvaluationMethod method() {
                return method;
            }

            @Override
            public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
                return evaluateFn.apply(promptCase, response);
            }
        };
    }
}
