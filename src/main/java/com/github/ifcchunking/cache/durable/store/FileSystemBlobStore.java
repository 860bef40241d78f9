package com.github.ifcchunking.cache.durable.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link BlobStore} on the local file system.
 *
 * <p>Layout: one directory per bucket under the root, and per key a {@code .blob} file holding the
 * payload plus a {@code .meta} properties file holding the metadata. Bucket and key names are
 * URL-encoded to form file names. Payloads are written to a temporary file and moved into place,
 * so a reader never sees a half-written payload.
 *
 * <p>File I/O runs on the supplied executor ({@link ForkJoinPool#commonPool()} by default);
 * {@link IOException}s surface as {@link BlobStoreException}s in the returned futures.
 */
public class FileSystemBlobStore implements BlobStore {
    private static final Logger LOGGER = Logger.getLogger("com.github.ifcchunking.cache.DurableCache");

    static final String DATA_SUFFIX = ".blob";
    static final String META_SUFFIX = ".meta";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;
    private final Executor executor;

    public FileSystemBlobStore(Path root) {
        this(root, ForkJoinPool.commonPool());
    }

    public FileSystemBlobStore(Path root, Executor executor) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Supported when the root directory exists (or can be created) and is writable.
     */
    @Override
    public boolean isSupported() {
        try {
            Files.createDirectories(root);
            return Files.isDirectory(root) && Files.isWritable(root);
        } catch (IOException | SecurityException e) {
            LOGGER.log(Level.FINE, "File system store not usable at " + root, e);
            return false;
        }
    }

    @Override
    public CompletableFuture<BlobBucket> open(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return CompletableFuture.supplyAsync(() -> {
            Path dir = root.resolve(encode(name));
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new BlobStoreException("Cannot open bucket " + name + " at " + dir, e);
            }
            return new DirectoryBucket(name, dir);
        }, executor);
    }

    static String encode(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8);
    }

    static String decode(String fileName) {
        return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
    }

    private final class DirectoryBucket implements BlobBucket {
        private final String name;
        private final Path dir;

        DirectoryBucket(String name, Path dir) {
            this.name = name;
            this.dir = dir;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletableFuture<Void> put(String key, Blob blob) {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(blob, "blob cannot be null");
            return CompletableFuture.runAsync(() -> {
                String base = encode(key);
                try {
                    Properties properties = new Properties();
                    properties.putAll(blob.metadata());
                    Path metaTemp = dir.resolve(base + META_SUFFIX + TEMP_SUFFIX);
                    try (OutputStream out = Files.newOutputStream(metaTemp)) {
                        properties.store(out, null);
                    }
                    moveIntoPlace(metaTemp, dir.resolve(base + META_SUFFIX));

                    Path dataTemp = dir.resolve(base + DATA_SUFFIX + TEMP_SUFFIX);
                    Files.write(dataTemp, blob.data());
                    moveIntoPlace(dataTemp, dir.resolve(base + DATA_SUFFIX));
                } catch (IOException e) {
                    throw new BlobStoreException("Cannot write " + key + " to bucket " + name, e);
                }
            }, executor);
        }

        @Override
        public CompletableFuture<Optional<Blob>> get(String key) {
            Objects.requireNonNull(key, "key cannot be null");
            return CompletableFuture.supplyAsync(() -> {
                String base = encode(key);
                try {
                    byte[] data = Files.readAllBytes(dir.resolve(base + DATA_SUFFIX));
                    return Optional.of(new Blob(data, readMetadata(dir.resolve(base + META_SUFFIX))));
                } catch (NoSuchFileException e) {
                    return Optional.<Blob>empty();
                } catch (IOException e) {
                    throw new BlobStoreException("Cannot read " + key + " from bucket " + name, e);
                }
            }, executor);
        }

        @Override
        public CompletableFuture<List<String>> keys() {
            return CompletableFuture.supplyAsync(() -> {
                List<String> keys = new ArrayList<>();
                try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + DATA_SUFFIX)) {
                    for (Path file : files) {
                        String fileName = file.getFileName().toString();
                        keys.add(decode(fileName.substring(0, fileName.length() - DATA_SUFFIX.length())));
                    }
                } catch (IOException e) {
                    throw new BlobStoreException("Cannot list bucket " + name, e);
                }
                keys.sort(null);
                return keys;
            }, executor);
        }

        @Override
        public CompletableFuture<Boolean> delete(String key) {
            Objects.requireNonNull(key, "key cannot be null");
            return CompletableFuture.supplyAsync(() -> {
                String base = encode(key);
                try {
                    boolean existed = Files.deleteIfExists(dir.resolve(base + DATA_SUFFIX));
                    Files.deleteIfExists(dir.resolve(base + META_SUFFIX));
                    return existed;
                } catch (IOException e) {
                    throw new BlobStoreException("Cannot delete " + key + " from bucket " + name, e);
                }
            }, executor);
        }

        private Map<String, String> readMetadata(Path metaFile) throws IOException {
            Map<String, String> metadata = new LinkedHashMap<>();
            if (!Files.exists(metaFile)) {
                return metadata;
            }
            Properties properties = new Properties();
            try (InputStream in = Files.newInputStream(metaFile)) {
                properties.load(in);
            }
            for (String property : properties.stringPropertyNames()) {
                metadata.put(property, properties.getProperty(property));
            }
            return metadata;
        }

        private void moveIntoPlace(Path source, Path target) throws IOException {
            try {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }
}
