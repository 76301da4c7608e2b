package dev.llmbench.catalog;

import java.util.List;
import java.util.Map;

/** The tool definitions offered to the backend during tool-calling prompts. */
public final class BuiltInTools {
    public static final ToolDefinition GET_WEATHER =
            ToolDefinition.function(
                    "get_weather",
                    "Get the current weather in a given location",
                    objectSchema(
                            Map.of(
                                    "location",
                                    Map.of(
                                            "type",
                                            "string",
                                            "description",
                                            "The city and state, e.g. San Francisco, CA"),
                                    "unit",
                                    Map.of(
                                            "type",
                                            "string",
                                            "enum",
                                            List.of("celsius", "fahrenheit"),
                                            "description",
                                            "The temperature unit to use")),
                            List.of("location")));

    public static final ToolDefinition CALCULATOR =
            ToolDefinition.function(
                    "calculator",
                    "Perform mathematical calculations",
                    objectSchema(
                            Map.of(
                                    "operation",
                                    Map.of(
                                            "type",
                                            "string",
                                            "enum",
                                            List.of("add", "subtract", "multiply", "divide"),
                                            "description",
                                            "The operation to perform"),
                                    "operands",
                                    Map.of(
                                            "type",
                                            "array",
                                            "items",
                                            Map.of("type", "number"),
                                            "description",
                                            "The numbers to operate on")),
                            List.of("operation", "operands")));

    public static final ToolDefinition SEARCH =
            ToolDefinition.function(
                    "search",
                    "Search for information on a topic",
                    objectSchema(
                            Map.of(
                                    "query",
                                    Map.of("type", "string", "description", "The search query"),
                                    "limit",
                                    Map.of(
                                            "type",
                                            "integer",
                                            "description",
                                            "Maximum number of results to return")),
                            List.of("query")));

    private BuiltInTools() {}

    public static List<ToolDefinition> all() {
        return List.of(GET_WEATHER, CALCULATOR, SEARCH);
    }

    private static Map<String, Object> objectSchema(
            Map<String, Object> properties, List<String> required) {
        return Map.of("type", "object", "properties", properties, "required", required);
    }
}
