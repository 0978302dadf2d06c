package com.williamcallahan.actdb.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.actdb.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Blob store for JSON values, gzipped on disk under {@code <root>/<key>.json.gz}.
 *
 * <p>Writes go to a temporary file in the target directory and are moved into place, so readers
 * never observe a partial blob. Stored and loaded values go through {@link ActCache}; values
 * must therefore be immutable.</p>
 */
@Component
public class Persistence {

    private static final Logger log = LoggerFactory.getLogger(Persistence.class);
    private static final String SUFFIX = ".json.gz";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final ContentHasher contentHasher;
    private final ActCache cache;

    @Autowired
    public Persistence(AppProperties appProperties, ObjectMapper objectMapper, ContentHasher contentHasher,
            ActCache cache) {
        this(Paths.get(appProperties.getStorage().getRoot()), objectMapper, contentHasher, cache);
    }

    public Persistence(Path root, ObjectMapper objectMapper, ContentHasher contentHasher, ActCache cache) {
        this.root = root;
        this.objectMapper = objectMapper;
        this.contentHasher = contentHasher;
        this.cache = cache;
    }

    /**
     * Stores a value. Concurrent stores are safe, but their order is not defined.
     *
     * @param keyType forced key, or prefix of a content-derived key
     * @param value immutable value to store
     * @return the storage key
     * @throws PersistenceException if encoding or writing fails
     */
    public String store(KeyType keyType, Object value) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PersistenceException("Encoding to JSON failed for " + keyType + ", value type="
                    + value.getClass().getName(), e);
        }
        String key;
        if (keyType instanceof KeyType.Forced forced) {
            key = forced.key();
        } else {
            key = contentHasher.storageKey(((KeyType.Calculated) keyType).prefix(), json);
        }
        cache.put(key, value);

        Path path = pathFor(key);
        if (keyType instanceof KeyType.Calculated && Files.exists(path)) {
            log.debug("Blob {} already stored", key);
            return key;
        }
        try {
            atomicWrite(path, json);
        } catch (IOException e) {
            cache.invalidate(key);
            throw new PersistenceException("Writing file data failed for " + key, e);
        }
        return key;
    }

    /**
     * Loads a value, from the cache if possible.
     *
     * @param key storage key
     * @param type expected value type
     * @param <T> value type
     * @return the value
     * @throws PersistenceException if the blob is missing, unreadable or of another type
     */
    public <T> T load(String key, Class<T> type) {
        try {
            return loadAsync(key, type).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof PersistenceException persistenceException) {
                throw persistenceException;
            }
            throw new PersistenceException("Could not load " + key, e.getCause());
        }
    }

    /**
     * Loads a value through the cache. Concurrent first loads of a key read the blob once.
     *
     * @param key storage key
     * @param type expected value type
     * @param <T> value type
     * @return future completing with the value, or exceptionally with a {@link PersistenceException}
     */
    public <T> CompletableFuture<T> loadAsync(String key, Class<T> type) {
        return cache.get(key, k -> loadFromDisk(k, type)).thenApply(value -> {
            if (!type.isInstance(value)) {
                throw new PersistenceException("Invalid type in cache at key " + key + ": expected "
                        + type.getSimpleName() + ", found " + value.getClass().getSimpleName());
            }
            return type.cast(value);
        });
    }

    public boolean exists(String key) {
        return cache.contains(key) || Files.exists(pathFor(key));
    }

    public boolean isLink(String key) {
        return Files.isSymbolicLink(pathFor(key));
    }

    /**
     * Makes {@code to} a relative symbolic link to the blob of {@code from}, replacing whatever
     * was stored at {@code to}.
     *
     * @param from existing key
     * @param to key to (re)point
     * @throws PersistenceException if {@code from} does not exist or the link cannot be created
     */
    public void link(String from, String to) {
        Path fromPath = pathFor(from);
        if (!Files.exists(fromPath)) {
            throw new PersistenceException("Error linking " + from + " to " + to + ": file does not exist");
        }
        Path toPath = pathFor(to);
        try {
            Files.createDirectories(toPath.getParent());
            Files.deleteIfExists(toPath);
            Path target = toPath.getParent().toRealPath().relativize(fromPath.toRealPath());
            Files.createSymbolicLink(toPath, target);
        } catch (IOException e) {
            throw new PersistenceException("Error linking " + from + " to " + to, e);
        }
        cache.invalidate(to);
    }

    Path pathFor(String key) {
        return root.resolve(key + SUFFIX);
    }

    private <T> T loadFromDisk(String key, Class<T> type) {
        Path path = pathFor(key);
        try (InputStream in = Files.newInputStream(path);
                GZIPInputStream gzip = new GZIPInputStream(in)) {
            return objectMapper.readValue(gzip, type);
        } catch (IOException e) {
            throw new PersistenceException("Could not load " + type.getSimpleName() + " from " + key, e);
        }
    }

    private static void atomicWrite(Path path, byte[] json) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp);
                    GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                gzip.write(json);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
