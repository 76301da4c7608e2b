package dev.llmbench.config;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Reads settings from environment variables, with per-instance overrides taking precedence.
 *
 * <p>Subclasses declare their settings as final fields initialized through the {@code getConfig}
 * family, which run after this constructor has captured the overrides.
 */
abstract class BaseConfig {
    /** Override value that forces a setting to be absent even if the envar is set. */
    static final String NULL_OVERRIDE = "__LLMBENCH_NULL_OVERRIDE__";

    private final Map<String, String> envOverrides;

    protected BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected String getConfig(String name, String defaultValue) {
        var value = getEnvValue(name);
        return value == null ? defaultValue : value;
    }

    @SuppressWarnings("unchecked")
    protected <T> T getConfig(String name, T defaultValue) {
        Objects.requireNonNull(defaultValue, "typed config requires a non-null default: " + name);
        return getConfig(name, defaultValue, (Class<T>) defaultValue.getClass());
    }

    protected <T> T getConfig(String name, @Nullable T defaultValue, Class<T> type) {
        var value = getEnvValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return type.cast(parse(value.trim(), type));
        } catch (IllegalArgumentException e) {
            throw new RuntimeException(
                    "invalid value for %s: '%s' (expected %s)"
                            .formatted(name, value, type.getSimpleName()),
                    e);
        }
    }

    @Nullable
    private String getEnvValue(String name) {
        if (envOverrides.containsKey(name)) {
            var override = envOverrides.get(name);
            return NULL_OVERRIDE.equals(override) ? null : override;
        }
        return System.getenv(name);
    }

    private static Object parse(String value, Class<?> type) {
        if (type == String.class) {
            return value;
        } else if (type == Integer.class) {
            return Integer.valueOf(value);
        } else if (type == Long.class) {
            return Long.valueOf(value);
        } else if (type == Double.class) {
            return Double.valueOf(value);
        } else if (type == Boolean.class) {
            return Boolean.valueOf(value);
        }
        throw new IllegalArgumentException("unsupported config type: " + type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return envOverrides.equals(((BaseConfig) o).envOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), envOverrides);
    }
}
