package dev.llmbench;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.llmbench.backend.BackendConfig;
import dev.llmbench.bench.BenchmarkRun;
import dev.llmbench.config.LlmBenchConfig;
import dev.llmbench.json.LlmBenchJsonMapper;
import dev.llmbench.server.BenchServer;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * llm-bench run [key=value ...]   run one benchmark and print a report
 * llm-bench serve                 start the HTTP surface
 * </pre>
 *
 * Run keys are backend config fields, e.g. {@code serverType=native apiUrl=localhost:11434
 * model=llama3 taskTypes=factual,coding maxPrompts=2}.
 */
public class LlmBenchMain {
    private static final String USAGE =
            "usage: llm-bench run [key=value ...] | llm-bench serve";

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.err.println(USAGE);
            System.exit(2);
        }
        var config = LlmBenchConfig.fromEnvironment();
        switch (args[0]) {
            case "run" -> {
                var backendConfig = parseBackendConfig(Arrays.copyOfRange(args, 1, args.length));
                var run = LlmBench.of(config).runBenchmark(backendConfig);
                printReport(run, System.out);
            }
            case "serve" -> serve(config);
            default -> {
                System.err.println(USAGE);
                System.exit(2);
            }
        }
    }

    static BackendConfig parseBackendConfig(String... keyValues) {
        ObjectNode json = LlmBenchJsonMapper.get().createObjectNode();
        for (var keyValue : keyValues) {
            var separator = keyValue.indexOf('=');
            if (separator < 1) {
                throw new IllegalArgumentException("expected key=value but got: " + keyValue);
            }
            var key = keyValue.substring(0, separator).trim();
            var value = keyValue.substring(separator + 1).trim();
            if ("taskTypes".equals(key) || "task_types".equals(key)) {
                var taskTypes = json.putArray(key);
                LlmBenchUtils.parseCsv(value).forEach(taskTypes::add);
            } else {
                json.put(key, value);
            }
        }
        return LlmBenchJsonMapper.fromJson(json.toString(), BackendConfig.class);
    }

    static void printReport(BenchmarkRun run, PrintStream out) {
        var summary = run.summary();
        out.printf(
                Locale.ROOT,
                "Benchmark %s: %s via %s (%s)%n",
                run.id(), run.config().model(), run.config().serverType(), run.config().apiUrl());
        for (var task : run.tasks()) {
            out.printf(
                    Locale.ROOT,
                    "  %-28s score %6.1f  avg %6.0f ms  %6.1f tok/s%n",
                    task.name(),
                    task.averageScore(),
                    task.averageResponseTimeMs(),
                    task.tokensPerSecond());
            for (var prompt : task.prompts()) {
                if (prompt.failed()) {
                    out.printf(Locale.ROOT, "    error: %s%n", prompt.error());
                }
            }
        }
        if (summary.toolCalling() != null) {
            out.printf(
                    Locale.ROOT,
                    "  Tool calling: success rate %.0f%%, avg %.0f ms%n",
                    summary.toolCalling().successRate() * 100,
                    summary.toolCalling().responseTimeMs());
        }
        out.printf(
                Locale.ROOT,
                "Overall score %.1f over %d prompts in %.1fs%n",
                summary.averageScore(), summary.totalPrompts(), summary.totalDurationSeconds());
    }

    private static void serve(LlmBenchConfig config) throws Exception {
        var server = BenchServer.builder().bench(LlmBench.of(config)).build();
        server.start();
        var latch = new CountDownLatch(1);
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    server.stop();
                                    latch.countDown();
                                }));
        latch.await();
    }
}
