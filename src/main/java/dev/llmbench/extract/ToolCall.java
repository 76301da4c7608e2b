package dev.llmbench.extract;

import javax.annotation.Nullable;

/**
 * A normalized function invocation requested by a model reply.
 *
 * <p>{@code function.arguments} is always the JSON-encoded argument object as a string, whatever
 * shape the backend used.
 */
public record ToolCall(@Nullable String id, String type, Function function) {

    public static ToolCall of(String name, @Nullable String arguments) {
        return new ToolCall(null, "function", new Function(name, arguments));
    }

    public record Function(String name, @Nullable String arguments) {}
}
