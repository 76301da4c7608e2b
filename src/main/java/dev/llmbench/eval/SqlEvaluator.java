package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks a SQL answer for the clauses the prompt case expects.
 *
 * <p>Each expected element present (case-insensitive) is worth an equal share of 100. A query that
 * has both SELECT and FROM gets a 10 point bonus, capped at 100.
 */
public final class SqlEvaluator implements Evaluator {
    private static final Pattern SQL_BLOCK = Pattern.compile("```(?:sql)?\\s*([\\s\\S]*?)```");
    static final double WELL_FORMED_BONUS = 10;

    @Override
    public EvaluationMethod method() {
        return EvaluationMethod.SQL_EVALUATION;
    }

    @Override
    public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var content = response.content();
        var elements = promptCase.expectedElements();
        if (content.isEmpty() || elements.isEmpty()) {
            return Evaluation.zero(method().tag(), "No content or expected elements");
        }
        var matcher = SQL_BLOCK.matcher(content);
        var sql = (matcher.find() ? matcher.group(1) : content).toUpperCase(Locale.ROOT);

        var found = new ArrayList<String>();
        var missing = new ArrayList<String>();
        for (var element : elements) {
            (sql.contains(element.toUpperCase(Locale.ROOT)) ? found : missing).add(element);
        }
        var score = 100.0 * found.size() / elements.size();
        var wellFormed = sql.contains("SELECT") && sql.contains("FROM");
        if (wellFormed) {
            score = Math.min(score + WELL_FORMED_BONUS, 100);
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("method", method().tag());
        details.put("foundElements", found);
        details.put("missingElements", missing);
        details.put("wellFormed", wellFormed);
        return new Evaluation(score, details);
    }
}
