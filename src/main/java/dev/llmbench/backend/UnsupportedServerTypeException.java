package dev.llmbench.backend;

import javax.annotation.Nullable;

/**
 * Thrown when a {@link BackendConfig} names a server type llm-bench cannot speak. Aborts the whole
 * run rather than being recorded against individual prompts.
 */
public class UnsupportedServerTypeException extends IllegalArgumentException {
    public UnsupportedServerTypeException(@Nullable String serverType) {
        super("Unsupported server type: " + serverType);
    }
}
