package dev.llmbench.history;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores each key as {@code <dir>/<key>.json}.
 *
 * <p>Writes go to a temp file in the same directory which is then moved over the target, so a
 * reader never sees a half-written value.
 */
@Slf4j
public class FileKeyValueStore implements KeyValueStore {
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path dir;

    public FileKeyValueStore(Path dir) {
        this.dir = dir;
    }

    @Override
    public Optional<String> get(@Nonnull String key) {
        try {
            return Optional.of(Files.readString(fileFor(key), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to read " + fileFor(key), e);
        }
    }

    @Override
    public void set(@Nonnull String key, @Nonnull String value) {
        var target = fileFor(key);
        try {
            Files.createDirectories(dir);
            var temp = Files.createTempFile(dir, key, ".tmp");
            try {
                Files.writeString(temp, value, StandardCharsets.UTF_8);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to write " + target, e);
        }
        log.debug("Wrote {} ({} chars)", target, value.length());
    }

    @Override
    public void remove(@Nonnull String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to delete " + fileFor(key), e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(
                    source,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, replacing in place", target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path fileFor(String key) {
        if (!SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("invalid store key: " + key);
        }
        return dir.resolve(key + ".json");
    }
}
