package dev.llmbench.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Selects the scoring strategy applied to a {@link PromptCase}. */
public enum EvaluationMethod {
    EXACT_MATCH("exactMatch"),
    LOGICAL_ANALYSIS("logicalAnalysis"),
    CODE_EVALUATION("codeEvaluation"),
    SQL_EVALUATION("sqlEvaluation"),
    CREATIVITY_EVALUATION("creativityEvaluation"),
    TOOL_CALL_EVALUATION("toolCallEvaluation");

    private final String tag;

    EvaluationMethod(String tag) {
        this.tag = tag;
    }

    /** wire/persistence tag, e.g. {@code exactMatch} */
    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static EvaluationMethod fromTag(String tag) {
        return Arrays.stream(values())
                .filter(method -> method.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown evaluation method: " + tag));
    }
}
