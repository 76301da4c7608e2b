package dev.llmbench.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One scripted prompt plus the data its {@link EvaluationMethod} grades against.
 *
 * <p>Only the fields relevant to the evaluation method are populated. Collections are never null.
 */
public record PromptCase(
        @Nonnull String prompt,
        @Nonnull EvaluationMethod evaluationMethod,
        /** exactMatch and logicalAnalysis answer */
        @Nullable String expectedAnswer,
        /** worked explanation, keyword source for logicalAnalysis */
        @Nullable String explanation,
        @Nonnull List<String> evaluationCriteria,
        @Nonnull List<CodeTestCase> testCases,
        /** substrings a SQL answer must contain */
        @Nonnull List<String> expectedElements,
        /** function name a tool-calling answer must invoke */
        @Nullable String expectedTool,
        @Nonnull Map<String, Object> expectedArgs) {

    public PromptCase {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(evaluationMethod, "evaluationMethod");
        evaluationCriteria = evaluationCriteria == null ? List.of() : List.copyOf(evaluationCriteria);
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
        expectedElements = expectedElements == null ? List.of() : List.copyOf(expectedElements);
        expectedArgs =
                expectedArgs == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(expectedArgs));
    }

    public static PromptCase exactMatch(String prompt, String expectedAnswer) {
        return exactMatch(prompt, expectedAnswer, null);
    }

    public static PromptCase exactMatch(
            String prompt, String expectedAnswer, @Nullable String explanation) {
        return new PromptCase(
                prompt,
                EvaluationMethod.EXACT_MATCH,
                expectedAnswer,
                explanation,
                List.of(),
                List.of(),
                List.of(),
                null,
                Map.of());
    }

    public static PromptCase logicalAnalysis(
            String prompt, String expectedAnswer, String explanation) {
        return new PromptCase(
                prompt,
                EvaluationMethod.LOGICAL_ANALYSIS,
                expectedAnswer,
                explanation,
                List.of(),
                List.of(),
                List.of(),
                null,
                Map.of());
    }

    public static PromptCase code(
            String prompt, List<String> evaluationCriteria, List<CodeTestCase> testCases) {
        return new PromptCase(
                prompt,
                EvaluationMethod.CODE_EVALUATION,
                null,
                null,
                evaluationCriteria,
                testCases,
                List.of(),
                null,
                Map.of());
    }

    public static PromptCase sql(
            String prompt, List<String> evaluationCriteria, List<String> expectedElements) {
        return new PromptCase(
                prompt,
                EvaluationMethod.SQL_EVALUATION,
                null,
                null,
                evaluationCriteria,
                List.of(),
                expectedElements,
                null,
                Map.of());
    }

    public static PromptCase creativity(String prompt, List<String> evaluationCriteria) {
        return new PromptCase(
                prompt,
                EvaluationMethod.CREATIVITY_EVALUATION,
                null,
                null,
                evaluationCriteria,
                List.of(),
                List.of(),
                null,
                Map.of());
    }

    public static PromptCase toolCall(
            String prompt, String expectedTool, Map<String, Object> expectedArgs) {
        return new PromptCase(
                prompt,
                EvaluationMethod.TOOL_CALL_EVALUATION,
                null,
                null,
                List.of(),
                List.of(),
                List.of(),
                expectedTool,
                expectedArgs);
    }
}
