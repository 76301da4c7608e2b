package dev.llmbench.eval;

import static org.junit.jupiter.api.Assertions.*;

import dev.llmbench.catalog.PromptCase;
import dev.llmbench.catalog.TaskCatalog;
import dev.llmbench.extract.ExtractedResponse;
import java.util.List;
import org.junit.jupiter.api.Test;

class SqlEvaluatorTest {
    private final SqlEvaluator evaluator = new SqlEvaluator();
    private final PromptCase topCustomers =
            TaskCatalog.builtIn().get(TaskCatalog.CODING).orElseThrow().prompts().get(2);

    @Test
    void allElementsPresentIsCappedAtHundred() {
        var evaluation =
                evaluate(
                        """
                        ```sql
                        SELECT customer_id, SUM(amount) AS total
                        FROM orders
                        GROUP BY customer_id
                        ORDER BY total DESC
                        LIMIT 5;
                        ```
                        """);
        assertEquals(100, evaluation.score());
        assertEquals(List.of(), evaluation.details().get("missingElements"));
    }

    @Test
    void partialQueryGetsShareAndBonus() {
        var evaluation = evaluate("SELECT name FROM customers");
        assertEquals(40 + 10, evaluation.score());
        assertEquals(
                List.of("GROUP BY", "ORDER BY", "LIMIT"),
                evaluation.details().get("missingElements"));
    }

    @Test
    void noBonusWithoutSelectAndFrom() {
        var evaluation = evaluate("GROUP BY x ORDER BY y LIMIT 5");
        assertEquals(60, evaluation.score());
        assertEquals(false, evaluation.details().get("wellFormed"));
    }

    @Test
    void matchingIgnoresCase() {
        assertEquals(60 + 10, evaluate("select * from orders limit 1").score());
    }

    @Test
    void emptyReplyScoresZero() {
        assertEquals(0, evaluate("").score());
    }

    private Evaluation evaluate(String content) {
        return evaluator.evaluate(topCustomers, ExtractedResponse.ofText(content));
    }
}
