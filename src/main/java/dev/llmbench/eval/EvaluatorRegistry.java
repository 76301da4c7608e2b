package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Looks up the evaluator for an {@link EvaluationMethod}. */
public final class EvaluatorRegistry {
    private final Map<EvaluationMethod, Evaluator> evaluators;

    private EvaluatorRegistry(Map<EvaluationMethod, Evaluator> evaluators) {
        this.evaluators = Collections.unmodifiableMap(new EnumMap<>(evaluators));
    }

    /** One evaluator for every method. */
    public static EvaluatorRegistry defaults() {
        return builder()
                .register(new ExactMatchEvaluator())
                .register(new LogicalAnalysisEvaluator())
                .register(new CodeEvaluator())
                .register(new SqlEvaluator())
                .register(new CreativityEvaluator())
                .register(new ToolCallEvaluator())
                .build();
    }

    public Optional<Evaluator> get(EvaluationMethod method) {
        return Optional.ofNullable(evaluators.get(method));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<EvaluationMethod, Evaluator> evaluators =
                new EnumMap<>(EvaluationMethod.class);

        /** Registers {@code evaluator}, replacing any earlier one for the same method. */
        public Builder register(Evaluator evaluator) {
            evaluators.put(evaluator.method(), evaluator);
            return this;
        }

        public EvaluatorRegistry build() {
            return new EvaluatorRegistry(evaluators);
        }
    }
}
