package dev.llmbench.history;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;

/**
 * Durable string values under string keys.
 *
 * <p>Every method throws {@link HistoryStoreException} when the backing medium fails.
 */
public interface KeyValueStore {
    Optional<String> get(@Nonnull String key);

    void set(@Nonnull String key, @Nonnull String value);

    void remove(@Nonnull String key);

    /** Implementation for test doubling */
    class InMemoryImpl implements KeyValueStore {
        private final Map<String, String> values = new ConcurrentHashMap<>();

        @Override
        public Optional<String> get(@Nonnull String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public void set(@Nonnull String key, @Nonnull String value) {
            values.put(key, value);
        }

        @Override
        public void remove(@Nonnull String key) {
            values.remove(key);
        }
    }
}
