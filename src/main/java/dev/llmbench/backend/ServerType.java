package dev.llmbench.backend;

import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;

/** The two backend wire protocols llm-bench speaks. */
public enum ServerType {
    /** OpenAI-compatible {@code /v1/chat/completions}, e.g. LM Studio */
    OPENAI_STYLE("openai-style", List.of("openai", "lmStudio")),
    /** Ollama-style {@code /api/chat} and {@code /api/generate} */
    NATIVE("native", List.of("ollama"));

    private final String value;
    private final List<String> aliases;

    ServerType(String value, List<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a configured server type.
     *
     * @throws UnsupportedServerTypeException if the value names neither protocol
     */
    public static ServerType fromValue(@Nullable String value) {
        if (value == null) {
            throw new UnsupportedServerTypeException(null);
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value) || type.aliases.contains(value))
                .findFirst()
                .orElseThrow(() -> new UnsupportedServerTypeException(value));
    }
}
