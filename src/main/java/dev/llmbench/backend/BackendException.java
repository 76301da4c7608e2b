package dev.llmbench.backend;

import java.util.OptionalInt;
import javax.annotation.Nullable;

/**
 * A backend call failed: transport error, timeout, non-2xx status or an unreadable body.
 *
 * <p>The benchmark runner records these against the prompt being evaluated and moves on.
 */
public class BackendException extends RuntimeException {
    private final @Nullable Integer statusCode;

    public BackendException(String message) {
        this(message, null, null);
    }

    public BackendException(String message, @Nullable Throwable cause) {
        this(message, null, cause);
    }

    public BackendException(
            String message, @Nullable Integer statusCode, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed response, if the backend answered at all */
    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
