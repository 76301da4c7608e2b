package dev.llmbench.catalog;

import java.util.List;
import java.util.Objects;

/** An ordered group of prompt cases sharing a task type, e.g. {@code factual}. */
public record BenchmarkTask(String type, String name, List<PromptCase> prompts) {
    public BenchmarkTask {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        prompts = List.copyOf(prompts);
    }

    /** The first {@code maxPrompts} cases, in catalog order. */
    public List<PromptCase> firstPrompts(int maxPrompts) {
        return prompts.subList(0, Math.max(0, Math.min(maxPrompts, prompts.size())));
    }
}
