package dev.llmbench.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.llmbench.bench.BenchmarkRun;
import dev.llmbench.json.LlmBenchJsonMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded, most-recent-first history of completed runs, kept as one JSON list under {@link #KEY}.
 */
@Slf4j
public class RunHistoryStore {
    public static final String KEY = "benchmarkHistory";
    public static final int DEFAULT_LIMIT = 20;

    private static final TypeReference<List<BenchmarkRun>> RUN_LIST = new TypeReference<>() {};

    private final KeyValueStore store;
    private final int limit;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private long lastIdMillis = Long.MIN_VALUE;

    public RunHistoryStore(KeyValueStore store) {
        this(store, DEFAULT_LIMIT, Clock.systemUTC());
    }

    public RunHistoryStore(KeyValueStore store, int limit, Clock clock) {
        if (limit < 1) {
            throw new IllegalArgumentException("history limit must be positive: " + limit);
        }
        this.store = Objects.requireNonNull(store);
        this.limit = limit;
        this.clock = Objects.requireNonNull(clock);
        this.objectMapper = LlmBenchJsonMapper.get();
    }

    /**
     * Assign an id to {@code run}, prepend it and drop the oldest runs beyond the limit.
     *
     * @return the run as stored, with its id
     */
    public synchronized BenchmarkRun save(BenchmarkRun run) {
        var saved = run.withId(nextId());
        var runs = new ArrayList<BenchmarkRun>(limit + 1);
        runs.add(saved);
        runs.addAll(list());
        var retained = runs.subList(0, Math.min(limit, runs.size()));
        store.set(KEY, LlmBenchJsonMapper.toJson(retained));
        log.info("Saved benchmark run {} ({} runs in history)", saved.id(), retained.size());
        return saved;
    }

    /** Stored runs, most recent first. Unreadable history is reported and treated as empty. */
    public synchronized List<BenchmarkRun> list() {
        var json = store.get(KEY);
        if (json.isEmpty()) {
            return List.of();
        }
        try {
            var runs = objectMapper.readValue(json.get(), RUN_LIST);
            return runs == null ? List.of() : runs;
        } catch (JsonProcessingException e) {
            log.warn("Failed to load benchmark history, treating it as empty", e);
            return List.of();
        }
    }

    public synchronized boolean clear() {
        store.remove(KEY);
        log.info("Cleared benchmark history");
        return true;
    }

    /** Timestamp based, strictly increasing within this store. */
    private String nextId() {
        lastIdMillis = Math.max(clock.millis(), lastIdMillis + 1);
        return "benchmark-" + lastIdMillis;
    }
}
