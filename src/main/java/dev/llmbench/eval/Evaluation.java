package dev.llmbench.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome of grading one reply. */
public record Evaluation(
        /**
         * Quality of the reply.
         *
         * <p>Always between 0.0 (inclusive) and 100.0 (inclusive).
         */
        double score,
        /** Evaluator-specific breakdown of how the score was reached. Always carries "method". */
        Map<String, Object> details) {

    public Evaluation {
        score = clamp(score);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Evaluation zero(String method, String reason) {
        var details = new LinkedHashMap<String, Object>();
        details.put("method", method);
        details.put("reason", reason);
        return new Evaluation(0, details);
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(100, score));
    }
}
