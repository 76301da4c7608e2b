package dev.llmbench.config;

import dev.llmbench.history.RunHistoryStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Process-level configuration for llm-bench with sane defaults.
 *
 * <p>Every setting is read from an {@code LLMBENCH_*} envar. Any envar can be overridden during
 * config construction, either with {@link #of(String...)} or with the {@link Builder}.
 *
 * <p>Per-run backend settings (server type, model, task selection) are not part of this config.
 * See {@link dev.llmbench.backend.BackendConfig}.
 */
@Getter
@Accessors(fluent = true)
public final class LlmBenchConfig extends BaseConfig {
    private final Duration requestTimeout =
            Duration.ofSeconds(getConfig("LLMBENCH_REQUEST_TIMEOUT", 30));
    private final Duration connectTimeout =
            Duration.ofSeconds(getConfig("LLMBENCH_CONNECT_TIMEOUT", 10));
    private final Path historyDir =
            Path.of(
                    getConfig(
                            "LLMBENCH_HISTORY_DIR",
                            Path.of(System.getProperty("user.home"), ".llmbench").toString()));
    /** at most {@link RunHistoryStore#DEFAULT_LIMIT} */
    private final int historyLimit = getConfig("LLMBENCH_HISTORY_LIMIT", 20);
    private final String serverHost = getConfig("LLMBENCH_SERVER_HOST", "localhost");
    private final int serverPort = getConfig("LLMBENCH_SERVER_PORT", 8400);
    private final String corsOriginWhitelistCsv =
            getConfig("LLMBENCH_CORS_ORIGIN_WHITELIST_CSV", "");

    public static LlmBenchConfig fromEnvironment() {
        return of();
    }

    public static LlmBenchConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new RuntimeException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new LlmBenchConfig(overridesMap);
    }

    private LlmBenchConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (historyLimit < 1 || historyLimit > RunHistoryStore.DEFAULT_LIMIT) {
            throw new RuntimeException(
                    "LLMBENCH_HISTORY_LIMIT must be between 1 and %d: %d"
                            .formatted(RunHistoryStore.DEFAULT_LIMIT, historyLimit));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder requestTimeout(Duration value) {
            envOverrides.put("LLMBENCH_REQUEST_TIMEOUT", String.valueOf(value.getSeconds()));
            return this;
        }

        public Builder connectTimeout(Duration value) {
            envOverrides.put("LLMBENCH_CONNECT_TIMEOUT", String.valueOf(value.getSeconds()));
            return this;
        }

        public Builder historyDir(Path value) {
            envOverrides.put("LLMBENCH_HISTORY_DIR", value.toString());
            return this;
        }

        public Builder historyLimit(int value) {
            envOverrides.put("LLMBENCH_HISTORY_LIMIT", String.valueOf(value));
            return this;
        }

        public Builder serverHost(String value) {
            envOverrides.put("LLMBENCH_SERVER_HOST", value);
            return this;
        }

        public Builder serverPort(int value) {
            envOverrides.put("LLMBENCH_SERVER_PORT", String.valueOf(value));
            return this;
        }

        public Builder corsOriginWhitelistCsv(String value) {
            if (value != null) {
                envOverrides.put("LLMBENCH_CORS_ORIGIN_WHITELIST_CSV", value);
            } else {
                envOverrides.put("LLMBENCH_CORS_ORIGIN_WHITELIST_CSV", NULL_OVERRIDE);
            }
            return this;
        }

        public LlmBenchConfig build() {
            return new LlmBenchConfig(envOverrides);
        }
    }
}
