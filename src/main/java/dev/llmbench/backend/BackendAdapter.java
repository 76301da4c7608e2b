package dev.llmbench.backend;

import com.fasterxml.jackson.databind.JsonNode;
import dev.llmbench.catalog.ToolDefinition;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates a prompt (and optional tool definitions) into exactly one call against the configured
 * backend protocol and returns the raw reply.
 *
 * <ul>
 *   <li>openai-style: {@code POST {base}/v1/chat/completions}, or {@code {base}/chat/completions}
 *       when the base URL already contains {@code /v1}
 *   <li>native with tools: {@code POST {base}/api/chat}
 *   <li>native without tools: {@code POST {base}/api/generate}. The generate endpoint takes a flat
 *       prompt and has no tool support.
 * </ul>
 *
 * <p>Failures are not retried here.
 */
@Slf4j
public final class BackendAdapter {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    @Getter
    @Accessors(fluent = true)
    private final ServerType serverType;

    @Getter
    @Accessors(fluent = true)
    private final String baseUrl;

    private final BackendConfig config;
    private final BackendHttpClient httpClient;
    private final Duration timeout;

    private BackendAdapter(
            ServerType serverType,
            BackendConfig config,
            BackendHttpClient httpClient,
            Duration timeout) {
        this.serverType = serverType;
        this.baseUrl = normalizeBaseUrl(config.apiUrl());
        this.config = config;
        this.httpClient = Objects.requireNonNull(httpClient);
        this.timeout = Objects.requireNonNull(timeout);
    }

    /**
     * Create an adapter for {@code config}.
     *
     * @throws UnsupportedServerTypeException if {@code config.serverType()} is not a known protocol
     */
    public static BackendAdapter of(
            BackendConfig config, BackendHttpClient httpClient, Duration timeout) {
        return new BackendAdapter(
                ServerType.fromValue(config.serverType()), config, httpClient, timeout);
    }

    public static BackendAdapter of(BackendConfig config, BackendHttpClient httpClient) {
        return of(config, httpClient, DEFAULT_TIMEOUT);
    }

    /**
     * Send {@code prompt} to the backend.
     *
     * @param tools tool definitions to offer; null or empty for a plain completion
     * @return the backend's reply body
     * @throws BackendException if the call fails for any reason
     */
    public JsonNode complete(@Nonnull String prompt, @Nullable List<ToolDefinition> tools) {
        var withTools = tools != null && !tools.isEmpty();
        var uri = endpoint(withTools);
        log.debug("Calling {} backend at {}", serverType.value(), uri);
        return httpClient.postJson(uri, requestBody(prompt, withTools ? tools : null), timeout);
    }

    URI endpoint(boolean withTools) {
        return switch (serverType) {
            case OPENAI_STYLE -> URI.create(
                    baseUrl
                            + (baseUrl.contains("/v1")
                                    ? "/chat/completions"
                                    : "/v1/chat/completions"));
            case NATIVE -> URI.create(baseUrl + (withTools ? "/api/chat" : "/api/generate"));
        };
    }

    Object requestBody(String prompt, @Nullable List<ToolDefinition> tools) {
        var messages = List.of(new ChatMessage("user", prompt));
        return switch (serverType) {
            case OPENAI_STYLE -> new ChatCompletionRequest(
                    config.model(),
                    messages,
                    config.temperature(),
                    config.maxTokens(),
                    tools,
                    tools == null ? null : "auto");
            case NATIVE -> tools == null
                    ? new GenerateRequest(
                            config.model(), prompt, config.temperature(), config.maxTokens())
                    : new NativeChatRequest(
                            config.model(),
                            messages,
                            config.temperature(),
                            config.maxTokens(),
                            tools,
                            false);
        };
    }

    /** Prepend {@code http://} when no scheme is given and strip trailing slashes. */
    static String normalizeBaseUrl(String apiUrl) {
        var trimmed = apiUrl.trim();
        var withScheme = trimmed.startsWith("http") ? trimmed : "http://" + trimmed;
        return withScheme.replaceAll("/+$", "");
    }

    // Request DTOs. Field names are written in snake_case by LlmBenchJsonMapper.

    record ChatMessage(String role, String content) {}

    record ChatCompletionRequest(
            String model,
            List<ChatMessage> messages,
            double temperature,
            int maxTokens,
            @Nullable List<ToolDefinition> tools,
            @Nullable String toolChoice) {}

    record NativeChatRequest(
            String model,
            List<ChatMessage> messages,
            double temperature,
            int numPredict,
            List<ToolDefinition> tools,
            boolean stream) {}

    record GenerateRequest(String model, String prompt, double temperature, int numPredict) {}
}
