package io.fleetward.manager.persistence;

import io.fleetward.manager.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stores one JSON document per definition under a directory.
 *
 * <p>Writes go to a temporary file in the same directory which is then
 * renamed over the target, so a crash never leaves a half-written
 * document behind.</p>
 *
 * <p>Keys are URL-encoded into file names, so distinct keys never share a
 * document. The key itself is not read back; each definition carries its
 * own name.</p>
 *
 * @param <T> definition type
 */
public class JsonDefinitionStore<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonDefinitionStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Class<T> type;

    public JsonDefinitionStore(@Nonnull Path directory, @Nonnull Class<T> type) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Nonnull
    public Path getDirectory() {
        return directory;
    }

    /**
     * Write a definition, replacing any previous document with the same key.
     *
     * @param key definition name
     * @param value definition
     * @throws IOException if the document cannot be written
     */
    public void save(@Nonnull String key, @Nonnull T value) throws IOException {
        Objects.requireNonNull(value, "value");
        Files.createDirectories(directory);
        Path target = pathFor(key);
        Path temp = Files.createTempFile(directory, fileName(key), ".tmp");
        try {
            Jsons.mapper().writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOGGER.debug("Saved {} '{}' to {}", type.getSimpleName(), key, target);
    }

    /**
     * Delete the document for a key, if present.
     *
     * @param key definition name
     * @throws IOException if deletion fails
     */
    public void delete(@Nonnull String key) throws IOException {
        Files.deleteIfExists(pathFor(key));
    }

    /**
     * Load every readable document. Unreadable documents are logged and skipped.
     *
     * @return definitions, ordered by file name
     * @throws IOException if the directory cannot be listed
     */
    @Nonnull
    public List<T> loadAll() throws IOException {
        List<T> values = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return values;
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));

        for (Path file : files) {
            try {
                values.add(Jsons.mapper().readValue(file.toFile(), type));
            } catch (IOException e) {
                LOGGER.warn("Skipping unreadable {} document {}: {}", type.getSimpleName(), file, e.getMessage());
            }
        }
        return values;
    }

    private Path pathFor(String key) {
        return directory.resolve(fileName(key) + SUFFIX);
    }

    private static String fileName(String key) {
        Objects.requireNonNull(key, "key");
        return URLEncoder.encode(key, StandardCharsets.UTF_8);
    }
}
