package dev.llmbench.backend;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Parameters of one benchmark run: which backend to call and what to ask it.
 *
 * <p>Missing values fall back to the defaults below, so a partial JSON body is a valid config.
 * {@code serverType} is kept as given and resolved when the run starts; see {@link
 * ServerType#fromValue(String)}.
 */
public record BackendConfig(
        @JsonAlias("serverType") String serverType,
        @JsonAlias("apiUrl") String apiUrl,
        String model,
        Double temperature,
        @JsonAlias("maxTokens") Integer maxTokens,
        @JsonAlias("taskTypes") List<String> taskTypes,
        @JsonAlias("maxPrompts") Integer maxPrompts,
        @JsonAlias({"includeToolCalling", "includeFunctionCalling"}) Boolean includeToolCalling) {
    public static final String DEFAULT_SERVER_TYPE = ServerType.OPENAI_STYLE.value();
    public static final String DEFAULT_API_URL = "http://localhost:1234";
    public static final String DEFAULT_MODEL = "unknown";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 256;
    public static final List<String> DEFAULT_TASK_TYPES = List.of("factual");
    public static final int DEFAULT_MAX_PROMPTS = 3;

    public BackendConfig {
        serverType = serverType == null ? DEFAULT_SERVER_TYPE : serverType;
        apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
        model = model == null ? DEFAULT_MODEL : model;
        temperature = temperature == null ? DEFAULT_TEMPERATURE : temperature;
        maxTokens = maxTokens == null ? DEFAULT_MAX_TOKENS : maxTokens;
        taskTypes = taskTypes == null ? DEFAULT_TASK_TYPES : List.copyOf(taskTypes);
        maxPrompts = maxPrompts == null ? DEFAULT_MAX_PROMPTS : maxPrompts;
        if (maxPrompts < 0) {
            throw new IllegalArgumentException("maxPrompts must not be negative: " + maxPrompts);
        }
        includeToolCalling = includeToolCalling == null || includeToolCalling;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable String serverType;
        private @Nullable String apiUrl;
        private @Nullable String model;
        private @Nullable Double temperature;
        private @Nullable Integer maxTokens;
        private @Nullable List<String> taskTypes;
        private @Nullable Integer maxPrompts;
        private @Nullable Boolean includeToolCalling;

        public Builder serverType(String serverType) {
            this.serverType = serverType;
            return this;
        }

        public Builder serverType(ServerType serverType) {
            return serverType(serverType.value());
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder taskTypes(List<String> taskTypes) {
            this.taskTypes = List.copyOf(taskTypes);
            return this;
        }

        public Builder taskTypes(String... taskTypes) {
            this.taskTypes = List.of(taskTypes);
            return this;
        }

        public Builder maxPrompts(int maxPrompts) {
            this.maxPrompts = maxPrompts;
            return this;
        }

        public Builder includeToolCalling(boolean includeToolCalling) {
            this.includeToolCalling = includeToolCalling;
            return this;
        }

        public BackendConfig build() {
            return new BackendConfig(
                    serverType,
                    apiUrl,
                    model,
                    temperature,
                    maxTokens,
                    taskTypes,
                    maxPrompts,
                    includeToolCalling);
        }
    }
}
