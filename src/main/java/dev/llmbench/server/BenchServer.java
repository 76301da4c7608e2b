package dev.llmbench.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import dev.llmbench.LlmBench;
import dev.llmbench.LlmBenchUtils;
import dev.llmbench.backend.BackendConfig;
import dev.llmbench.backend.UnsupportedServerTypeException;
import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.json.LlmBenchJsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Local HTTP surface for the browser control panel.
 *
 * <ul>
 *   <li>{@code GET /} health check
 *   <li>{@code POST /benchmark} run a benchmark; body is a backend config, reply is the saved run
 *   <li>{@code GET /history} saved runs, most recent first
 *   <li>{@code DELETE /history} clear saved runs
 *   <li>{@code GET /tasks} the task catalog
 * </ul>
 *
 * Requests are handled on a single worker thread, so benchmark runs never overlap.
 */
@Slf4j
public class BenchServer {
    private static final Pattern LOCALHOST_ORIGIN_PATTERN =
            Pattern.compile("^https?://(localhost|127\\.0\\.0\\.1)(:\\d+)?$");
    private static final String ALLOWED_HEADERS = "Content-Type, Accept, Authorization";

    private final LlmBench bench;
    private final List<String> corsOriginWhitelist;

    @Getter
    @Accessors(fluent = true)
    private final String host;

    private final int port;
    private @Nullable HttpServer server;
    private @Nullable ExecutorService executor;

    private BenchServer(Builder builder) {
        this.bench = Objects.requireNonNull(builder.bench);
        this.host = builder.host == null ? bench.config().serverHost() : builder.host;
        this.port = builder.port == null ? bench.config().serverPort() : builder.port;
        this.corsOriginWhitelist =
                List.copyOf(LlmBenchUtils.parseCsv(bench.config().corsOriginWhitelistCsv()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server is already running");
        }

        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        executor = Executors.newSingleThreadExecutor();
        server.setExecutor(executor);

        server.createContext("/", withCors(this::handleHealthCheck));
        server.createContext("/benchmark", withCors(this::handleBenchmark));
        server.createContext("/history", withCors(this::handleHistory));
        server.createContext("/tasks", withCors(this::handleTasks));

        server.start();
        log.info("llm-bench server started on http://{}:{}", host, port());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            executor.shutdownNow();
            executor = null;
            log.info("llm-bench server stopped");
        }
    }

    /** The bound port while running, otherwise the configured one. */
    public synchronized int port() {
        return server == null ? port : server.getAddress().getPort();
    }

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendErrorResponse(exchange, 404, "Not Found");
            return;
        }
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
            return;
        }
        sendResponse(exchange, 200, "text/plain", "OK");
    }

    private void handleBenchmark(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
            return;
        }
        final BackendConfig backendConfig;
        try {
            backendConfig = readBackendConfig(exchange.getRequestBody());
        } catch (JsonProcessingException e) {
            sendErrorResponse(exchange, 400, "Invalid request body: " + e.getOriginalMessage());
            return;
        } catch (IllegalArgumentException e) {
            sendErrorResponse(exchange, 400, e.getMessage());
            return;
        }
        try {
            var run = bench.runBenchmark(backendConfig);
            sendResponse(exchange, 200, "application/json", LlmBenchJsonMapper.toJson(run));
        } catch (UnsupportedServerTypeException e) {
            sendErrorResponse(exchange, 400, e.getMessage());
        } catch (Exception e) {
            log.error("Error running benchmark", e);
            sendErrorResponse(exchange, 500, "Internal Server Error: " + e.getMessage());
        }
    }

    private void handleHistory(HttpExchange exchange) throws IOException {
        try {
            switch (exchange.getRequestMethod()) {
                case "GET" -> sendResponse(
                        exchange,
                        200,
                        "application/json",
                        LlmBenchJsonMapper.toJson(bench.getBenchmarkHistory()));
                case "DELETE" -> sendResponse(
                        exchange,
                        200,
                        "application/json",
                        LlmBenchJsonMapper.toJson(
                                Map.of("cleared", bench.clearBenchmarkHistory())));
                default -> sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
            }
        } catch (Exception e) {
            log.error("Error handling /history", e);
            sendErrorResponse(exchange, 500, "Internal Server Error: " + e.getMessage());
        }
    }

    private void handleTasks(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
            return;
        }
        var listing =
                bench.taskCatalog().tasks().stream()
                        .map(
                                task ->
                                        new TaskListing(
                                                task.type(),
                                                task.name(),
                                                task.prompts().size(),
                                                task.prompts().stream()
                                                        .map(PromptCase::evaluationMethod)
                                                        .distinct()
                                                        .toList()))
                        .toList();
        sendResponse(exchange, 200, "application/json", LlmBenchJsonMapper.toJson(listing));
    }

    /** An empty body selects every default. */
    private static BackendConfig readBackendConfig(InputStream body) throws IOException {
        var json = new String(body.readAllBytes(), StandardCharsets.UTF_8);
        if (json.isBlank()) {
            json = "{}";
        }
        var config = LlmBenchJsonMapper.get().readValue(json, BackendConfig.class);
        if (config == null) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        return config;
    }

    record TaskListing(
            String type, String name, int promptCount, List<EvaluationMethod> evaluationMethods) {}

    private void sendResponse(
            HttpExchange exchange, int statusCode, String contentType, String body)
            throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }

    private void sendErrorResponse(HttpExchange exchange, int statusCode, String message)
            throws IOException {
        sendResponse(
                exchange,
                statusCode,
                "application/json",
                LlmBenchJsonMapper.toJson(Map.of("error", String.valueOf(message))));
    }

    private boolean isOriginAllowed(@Nullable String origin) {
        if (origin == null || origin.isEmpty()) {
            return true;
        }
        return corsOriginWhitelist.contains(origin)
                || LOCALHOST_ORIGIN_PATTERN.matcher(origin).matches();
    }

    private void applyCorsHeaders(HttpExchange exchange) {
        String origin = exchange.getRequestHeaders().getFirst("Origin");
        if (origin != null && !origin.isEmpty() && isOriginAllowed(origin)) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", origin);
            exchange.getResponseHeaders().set("Vary", "Origin");
        }
    }

    private void handlePreflightRequest(HttpExchange exchange) throws IOException {
        String origin = exchange.getRequestHeaders().getFirst("Origin");
        if (!isOriginAllowed(origin)) {
            exchange.sendResponseHeaders(403, -1);
            return;
        }
        var headers = exchange.getResponseHeaders();
        if (origin != null && !origin.isEmpty()) {
            headers.set("Access-Control-Allow-Origin", origin);
        }
        headers.set("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
        headers.set("Access-Control-Allow-Headers", ALLOWED_HEADERS);
        headers.set("Access-Control-Max-Age", "86400");
        exchange.sendResponseHeaders(204, -1);
    }

    private HttpHandler withCors(HttpHandler handler) {
        return exchange -> {
            if ("OPTIONS".equals(exchange.getRequestMethod())) {
                handlePreflightRequest(exchange);
                return;
            }
            applyCorsHeaders(exchange);
            handler.handle(exchange);
        };
    }

    public static class Builder {
        private @Nullable LlmBench bench;
        private @Nullable String host;
        private @Nullable Integer port;

        public BenchServer build() {
            if (bench == null) {
                throw new IllegalStateException("bench is required");
            }
            return new BenchServer(this);
        }

        public Builder bench(LlmBench bench) {
            this.bench = bench;
            return this;
        }

        /** Defaults to {@code LLMBENCH_SERVER_HOST}. */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Defaults to {@code LLMBENCH_SERVER_PORT}; 0 binds an ephemeral port. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }
    }
}
