package dev.llmbench.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of benchmark tasks keyed by task type.
 *
 * <p>Catalogs are immutable. Adding a task type only requires registering another {@link
 * BenchmarkTask}; the runner weights unknown types at 1.0 and the evaluators are selected per
 * prompt case.
 */
public final class TaskCatalog {
    public static final String FACTUAL = "factual";
    public static final String REASONING = "reasoning";
    public static final String CODING = "coding";
    public static final String CREATIVITY = "creativity";
    public static final String TOOL_CALLING = "toolCalling";

    private static final TaskCatalog BUILT_IN =
            builder()
                    .task(factual())
                    .task(reasoning())
                    .task(coding())
                    .task(creativity())
                    .task(toolCalling())
                    .build();

    private final Map<String, BenchmarkTask> tasks;

    private TaskCatalog(Map<String, BenchmarkTask> tasks) {
        this.tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    /** The five task types that ship with llm-bench. */
    public static TaskCatalog builtIn() {
        return BUILT_IN;
    }

    public Optional<BenchmarkTask> get(String type) {
        return Optional.ofNullable(tasks.get(type));
    }

    /** task types in registration order */
    public Set<String> types() {
        return tasks.keySet();
    }

    public Collection<BenchmarkTask> tasks() {
        return tasks.values();
    }

    /** A copy of this catalog with {@code task} added, replacing any task of the same type. */
    public TaskCatalog with(BenchmarkTask task) {
        var copy = new LinkedHashMap<>(tasks);
        copy.put(task.type(), task);
        return new TaskCatalog(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, BenchmarkTask> tasks = new LinkedHashMap<>();

        public Builder task(BenchmarkTask task) {
            if (tasks.containsKey(task.type())) {
                throw new IllegalArgumentException("Duplicate task type: " + task.type());
            }
            tasks.put(task.type(), task);
            return this;
        }

        public TaskCatalog build() {
            return new TaskCatalog(tasks);
        }
    }

    private static BenchmarkTask factual() {
        return new BenchmarkTask(
                FACTUAL,
                "Factual Knowledge",
                List.of(
                        PromptCase.exactMatch("What is the capital of France?", "Paris"),
                        PromptCase.exactMatch("Who wrote 'Pride and Prejudice'?", "Jane Austen"),
                        PromptCase.exactMatch("What year did World War II end?", "1945"),
                        PromptCase.exactMatch("What is the chemical symbol for gold?", "Au"),
                        PromptCase.exactMatch(
                                "What is the largest planet in our solar system?", "Jupiter")));
    }

    private static BenchmarkTask reasoning() {
        return new BenchmarkTask(
                REASONING,
                "Logical Reasoning",
                List.of(
                        PromptCase.logicalAnalysis(
                                "If all A are B, and some B are C, can we conclude that some A"
                                        + " are C?",
                                "No",
                                "This is a logical fallacy. While all A are B, and some B are C,"
                                        + " the B that are C might not include any A."),
                        PromptCase.exactMatch(
                                "A bat and ball cost $1.10 in total. The bat costs $1.00 more than"
                                        + " the ball. How much does the ball cost?",
                                "0.05",
                                "If the ball costs x, then the bat costs x + 1.00. Together they"
                                        + " cost 1.10, so x + (x + 1.00) = 1.10. Solving for x: 2x"
                                        + " + 1.00 = 1.10, 2x = 0.10, x = 0.05."),
                        PromptCase.exactMatch(
                                "If it takes 5 machines 5 minutes to make 5 widgets, how long"
                                        + " would it take 100 machines to make 100 widgets?",
                                "5",
                                "Each machine makes 1 widget in 5 minutes. So 100 machines would"
                                        + " make 100 widgets in 5 minutes."),
                        PromptCase.exactMatch(
                                "Mary's father has five daughters: 1. Nana, 2. Nene, 3. Nini, 4."
                                        + " Nono. What is the name of the fifth daughter?",
                                "Mary",
                                "The question states that Mary's father has five daughters, so"
                                        + " Mary must be one of them."),
                        PromptCase.exactMatch(
                                "A farmer has 15 sheep, and all but 8 die. How many sheep are"
                                        + " left?",
                                "8",
                                "The phrase 'all but 8' means that 8 sheep remain.")));
    }

    private static BenchmarkTask coding() {
        return new BenchmarkTask(
                CODING,
                "Code Generation",
                List.of(
                        PromptCase.code(
                                "Write a JavaScript function that checks if a string is a"
                                        + " palindrome.",
                                List.of(
                                        "Function correctly identifies palindromes",
                                        "Handles case sensitivity",
                                        "Handles spaces and special characters",
                                        "Has proper error handling"),
                                List.of(
                                        new CodeTestCase("racecar", true),
                                        new CodeTestCase("hello", false),
                                        new CodeTestCase("A man a plan a canal Panama", true))),
                        PromptCase.code(
                                "Write a Python function to find the second largest number in a"
                                        + " list.",
                                List.of(
                                        "Function correctly finds the second largest number",
                                        "Handles duplicate values",
                                        "Handles empty lists or lists with one element",
                                        "Has proper error handling"),
                                List.of(
                                        new CodeTestCase("[1, 2, 3, 4, 5]", 4),
                                        new CodeTestCase("[5, 5, 4, 3, 2]", 4),
                                        new CodeTestCase("[1]", "Error or None"))),
                        PromptCase.sql(
                                "Write a SQL query to find the top 5 customers who have spent the"
                                        + " most money.",
                                List.of(
                                        "Query correctly selects top 5 customers",
                                        "Uses appropriate aggregation functions",
                                        "Includes proper sorting",
                                        "Handles ties appropriately"),
                                List.of("SELECT", "FROM", "GROUP BY", "ORDER BY", "LIMIT"))));
    }

    private static BenchmarkTask creativity() {
        return new BenchmarkTask(
                CREATIVITY,
                "Creativity & Writing",
                List.of(
                        PromptCase.creativity(
                                "Write a short poem about artificial intelligence.",
                                List.of(
                                        "Relevance to the topic",
                                        "Creative use of language",
                                        "Coherence and structure",
                                        "Originality")),
                        PromptCase.creativity(
                                "Write a brief story about a time traveler who accidentally"
                                        + " changes history.",
                                List.of(
                                        "Narrative coherence",
                                        "Character development",
                                        "Creative plot elements",
                                        "Engagement and interest")),
                        PromptCase.creativity(
                                "Describe a new invention that could solve a common everyday"
                                        + " problem.",
                                List.of(
                                        "Innovation and originality",
                                        "Practicality and feasibility",
                                        "Clear description of the problem and solution",
                                        "Consideration of potential impacts"))));
    }

    private static BenchmarkTask toolCalling() {
        return new BenchmarkTask(
                TOOL_CALLING,
                "Tool Calling",
                List.of(
                        PromptCase.toolCall(
                                "What's the weather like in New York City today?",
                                "get_weather",
                                Map.of("location", "New York City")),
                        PromptCase.toolCall(
                                "Calculate 235 + 467 and then multiply by 3.",
                                "calculator",
                                orderedArgs("operation", "add", "operands", List.of(235, 467))),
                        PromptCase.toolCall(
                                "Search for information about SpaceX Starship.",
                                "search",
                                Map.of("query", "SpaceX Starship"))));
    }

    private static Map<String, Object> orderedArgs(
            String k1, Object v1, String k2, Object v2) {
        var args = new LinkedHashMap<String, Object>();
        args.put(k1, v1);
        args.put(k2, v2);
        return args;
    }
}
