package dev.llmbench.catalog;

import java.util.Map;

/**
 * A callable capability offered to the backend, in the OpenAI function-tool shape that both
 * supported protocols accept: {@code {type:"function", function:{name, description, parameters}}}.
 */
public record ToolDefinition(String type, FunctionSpec function) {

    public static ToolDefinition function(
            String name, String description, Map<String, Object> parameters) {
        return new ToolDefinition("function", new FunctionSpec(name, description, parameters));
    }

    public String name() {
        return function.name();
    }

    /** Function metadata. {@code parameters} is a JSON schema object. */
    public record FunctionSpec(String name, String description, Map<String, Object> parameters) {}
}
