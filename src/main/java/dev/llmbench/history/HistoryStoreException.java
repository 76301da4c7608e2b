package dev.llmbench.history;

/** Run history could not be read from or written to its backing store. */
public class HistoryStoreException extends RuntimeException {
    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
