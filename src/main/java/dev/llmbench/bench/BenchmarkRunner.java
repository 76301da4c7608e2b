package dev.llmbench.bench;

import dev.llmbench.LlmBenchUtils;
import dev.llmbench.backend.BackendAdapter;
import dev.llmbench.backend.BackendConfig;
import dev.llmbench.backend.BackendHttpClient;
import dev.llmbench.catalog.BenchmarkTask;
import dev.llmbench.catalog.BuiltInTools;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.catalog.TaskCatalog;
import dev.llmbench.catalog.ToolDefinition;
import dev.llmbench.eval.Evaluation;
import dev.llmbench.eval.EvaluatorRegistry;
import dev.llmbench.extract.ExtractedResponse;
import dev.llmbench.extract.ResponseExtractor;
import dev.llmbench.history.KeyValueStore;
import dev.llmbench.history.RunHistoryStore;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the selected tasks of a catalog against one backend, strictly one prompt at a time, then
 * aggregates and saves the run.
 *
 * <p>A prompt that fails (transport error, timeout, grading error) is recorded with its error and
 * a score of 0 and the run carries on. A config naming an unsupported server type fails the run
 * before any prompt is sent.
 */
@Slf4j
public final class BenchmarkRunner {
    public static final String TRACER_NAME = "llm-bench";

    private final @Nonnull TaskCatalog catalog;
    private final @Nonnull List<ToolDefinition> tools;
    private final @Nonnull BackendHttpClient httpClient;
    private final @Nonnull EvaluatorRegistry evaluators;
    private final @Nonnull ResponseExtractor extractor;
    private final @Nonnull RunHistoryStore historyStore;
    private final @Nonnull Tracer tracer;
    private final @Nonnull Clock clock;
    private final @Nonnull Duration requestTimeout;

    private BenchmarkRunner(Builder builder) {
        this.catalog = Objects.requireNonNull(builder.catalog);
        this.tools = List.copyOf(builder.tools);
        this.httpClient = Objects.requireNonNull(builder.httpClient);
        this.evaluators = Objects.requireNonNull(builder.evaluators);
        this.extractor = Objects.requireNonNull(builder.extractor);
        this.historyStore = Objects.requireNonNull(builder.historyStore);
        this.tracer = Objects.requireNonNull(builder.tracer);
        this.clock = Objects.requireNonNull(builder.clock);
        this.requestTimeout = Objects.requireNonNull(builder.requestTimeout);
    }

    /**
     * Run a benchmark and save it to history.
     *
     * @return the saved run
     * @throws dev.llmbench.backend.UnsupportedServerTypeException if the server type is unknown
     */
    public BenchmarkRun run(@Nonnull BackendConfig config) {
        var adapter = BackendAdapter.of(config, httpClient, requestTimeout);
        var selectedTasks = selectTasks(config);

        var rootSpan =
                tracer.spanBuilder("benchmark")
                        .setNoParent()
                        .setAttribute("llmbench.model", config.model())
                        .setAttribute("llmbench.server_type", adapter.serverType().value())
                        .startSpan();
        try (var unused = rootSpan.makeCurrent()) {
            log.info(
                    "Starting benchmark of {} on {} backend {} ({} tasks)",
                    config.model(),
                    adapter.serverType().value(),
                    adapter.baseUrl(),
                    selectedTasks.size());
            var startMillis = clock.millis();
            var startTime = Instant.ofEpochMilli(startMillis);

            var taskResults = new ArrayList<TaskResult>(selectedTasks.size());
            for (var task : selectedTasks) {
                log.info("Running {} task", task.name());
                var taskTools = TaskCatalog.TOOL_CALLING.equals(task.type()) ? tools : null;
                var promptResults = new ArrayList<PromptResult>(task.prompts().size());
                for (var promptCase : task.prompts()) {
                    promptResults.add(runPrompt(adapter, task.type(), promptCase, taskTools));
                }
                taskResults.add(TaskResult.of(task.type(), task.name(), promptResults));
            }

            ToolCallingResult toolCalling = null;
            var toolCallingTask = catalog.get(TaskCatalog.TOOL_CALLING);
            if (config.includeToolCalling() && toolCallingTask.isPresent()) {
                toolCalling = runToolCalling(adapter, toolCallingTask.get());
            }

            var endMillis = clock.millis();
            var totalDurationMs = endMillis - startMillis;
            var overallScore = TaskWeights.overallScore(taskResults);
            var run =
                    new BenchmarkRun(
                            null,
                            config,
                            startTime,
                            Instant.ofEpochMilli(endMillis),
                            totalDurationMs,
                            taskResults,
                            overallScore,
                            summarize(taskResults, overallScore, totalDurationMs, toolCalling),
                            toolCalling);
            rootSpan.setAttribute("llmbench.overall_score", overallScore);
            log.info(
                    "Finished benchmark of {}: overall score {} in {}s",
                    config.model(),
                    run.summary().averageScore(),
                    run.summary().totalDurationSeconds());
            return historyStore.save(run);
        } catch (RuntimeException e) {
            rootSpan.setStatus(StatusCode.ERROR, e.getMessage());
            rootSpan.recordException(e);
            throw e;
        } finally {
            rootSpan.end();
        }
    }

    public List<BenchmarkRun> history() {
        return historyStore.list();
    }

    public boolean clearHistory() {
        return historyStore.clear();
    }

    public TaskCatalog catalog() {
        return catalog;
    }

    private List<BenchmarkTask> selectTasks(BackendConfig config) {
        var selected = new ArrayList<BenchmarkTask>();
        for (var type : config.taskTypes()) {
            var task = catalog.get(type);
            if (task.isEmpty()) {
                log.warn("Skipping unknown task type '{}'", type);
                continue;
            }
            selected.add(
                    new BenchmarkTask(
                            type, task.get().name(), task.get().firstPrompts(config.maxPrompts())));
        }
        return selected;
    }

    private ToolCallingResult runToolCalling(BackendAdapter adapter, BenchmarkTask task) {
        log.info("Running tool calling benchmark ({} cases)", task.prompts().size());
        var cases = new ArrayList<ToolCallingResult.ToolCallingCase>(task.prompts().size());
        for (var promptCase : task.prompts()) {
            var result = runPrompt(adapter, task.type(), promptCase, tools);
            cases.add(
                    ToolCallingResult.ToolCallingCase.of(
                            promptCase.expectedTool(), promptCase.expectedArgs(), result));
        }
        return ToolCallingResult.of(cases);
    }

    private PromptResult runPrompt(
            BackendAdapter adapter,
            String taskType,
            PromptCase promptCase,
            @Nullable List<ToolDefinition> promptTools) {
        var span =
                tracer.spanBuilder("prompt")
                        .setAttribute("llmbench.task_type", taskType)
                        .setAttribute(
                                "llmbench.evaluation_method", promptCase.evaluationMethod().tag())
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            log.debug("Testing prompt: {}", abbreviate(promptCase.prompt()));
            var startMillis = clock.millis();
            var response = ExtractedResponse.ofText("");
            Evaluation evaluation = null;
            String error = null;
            try {
                var reply = adapter.complete(promptCase.prompt(), promptTools);
                response = extractor.extract(reply);
                evaluation = evaluate(promptCase, response);
            } catch (Exception e) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Prompt failed: {}: {}", abbreviate(promptCase.prompt()), error);
                span.setStatus(StatusCode.ERROR, error);
                span.recordException(e);
            }
            var responseTimeMs = clock.millis() - startMillis;
            var score = evaluation == null ? 0 : evaluation.score();
            recordOutcome(span, score, responseTimeMs);
            return new PromptResult(
                    promptCase.prompt(),
                    responseTimeMs,
                    response.content(),
                    response.toolCalls(),
                    score,
                    evaluation == null ? null : evaluation.details(),
                    LlmBenchUtils.estimateTokenCount(response.content()),
                    error,
                    Instant.now(clock));
        } finally {
            span.end();
        }
    }

    private Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var evaluator =
                evaluators
                        .get(promptCase.evaluationMethod())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No evaluator registered for "
                                                        + promptCase.evaluationMethod().tag()));
        return evaluator.evaluate(promptCase, response);
    }

    private static void recordOutcome(Span span, double score, long responseTimeMs) {
        span.setAttribute("llmbench.score", score);
        span.setAttribute("llmbench.response_time_ms", responseTimeMs);
    }

    static RunSummary summarize(
            List<TaskResult> tasks,
            double overallScore,
            long totalDurationMs,
            @Nullable ToolCallingResult toolCalling) {
        var totalDurationSeconds = LlmBenchUtils.roundToTenth(totalDurationMs / 1000.0);
        if (tasks.isEmpty()) {
            return RunSummary.empty(totalDurationSeconds);
        }
        var totalPrompts = tasks.stream().mapToInt(task -> task.prompts().size()).sum();
        var meanResponseTime =
                tasks.stream().mapToDouble(TaskResult::averageResponseTimeMs).average().orElse(0);
        var totalTokens = tasks.stream().mapToInt(TaskResult::totalTokens).sum();
        var totalResponseTimeMs =
                tasks.stream()
                        .flatMap(task -> task.prompts().stream())
                        .mapToLong(PromptResult::responseTimeMs)
                        .sum();
        var tokensPerSecond =
                totalResponseTimeMs > 0 ? totalTokens / (totalResponseTimeMs / 1000.0) : 0;
        return new RunSummary(
                totalPrompts,
                LlmBenchUtils.roundToTenth(overallScore),
                Math.round(meanResponseTime),
                totalDurationSeconds,
                LlmBenchUtils.roundToTenth(tokensPerSecond),
                totalTokens,
                toolCalling == null ? null : RunSummary.ToolCallingSummary.of(toolCalling));
    }

    private static String abbreviate(String prompt) {
        return prompt.length() <= 30 ? prompt : prompt.substring(0, 30) + "...";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nonnull TaskCatalog catalog = TaskCatalog.builtIn();
        private @Nonnull List<ToolDefinition> tools = BuiltInTools.all();
        private @Nullable BackendHttpClient httpClient;
        private @Nonnull EvaluatorRegistry evaluators = EvaluatorRegistry.defaults();
        private @Nonnull ResponseExtractor extractor = new ResponseExtractor();
        private @Nullable RunHistoryStore historyStore;
        private @Nullable Tracer tracer;
        private @Nonnull Clock clock = Clock.systemUTC();
        private @Nonnull Duration requestTimeout = BackendAdapter.DEFAULT_TIMEOUT;

        public BenchmarkRunner build() {
            if (tracer == null) {
                tracer = GlobalOpenTelemetry.getTracer(TRACER_NAME);
            }
            if (historyStore == null) {
                historyStore = new RunHistoryStore(new KeyValueStore.InMemoryImpl());
            }
            Objects.requireNonNull(httpClient, "httpClient");
            return new BenchmarkRunner(this);
        }

        public Builder catalog(@Nonnull TaskCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog);
            return this;
        }

        public Builder tools(@Nonnull List<ToolDefinition> tools) {
            this.tools = List.copyOf(tools);
            return this;
        }

        public Builder httpClient(@Nonnull BackendHttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient);
            return this;
        }

        public Builder evaluators(@Nonnull EvaluatorRegistry evaluators) {
            this.evaluators = Objects.requireNonNull(evaluators);
            return this;
        }

        public Builder extractor(@Nonnull ResponseExtractor extractor) {
            this.extractor = Objects.requireNonNull(extractor);
            return this;
        }

        public Builder historyStore(@Nonnull RunHistoryStore historyStore) {
            this.historyStore = Objects.requireNonNull(historyStore);
            return this;
        }

        public Builder tracer(@Nonnull Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        public Builder clock(@Nonnull Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder requestTimeout(@Nonnull Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout);
            return this;
        }
    }
}
