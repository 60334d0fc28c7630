package com.tracepile.store.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link MetadataCache} per cache directory.
 *
 * Owners create one manager per process (or per test) and pass it to whatever builds
 * piles; caches live as long as the manager does.
 */
public class MetadataCacheManager {

    private final Map<Path, MetadataCache> caches = new ConcurrentHashMap<>();

    /**
     * Get the cache for a directory, creating it on first use.
     */
    public MetadataCache getCache(Path cacheDir) {
        Path key = cacheDir.toAbsolutePath().normalize();
        return caches.computeIfAbsent(key, dir -> {
            try {
                return new MetadataCache(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create cache directory " + dir, e);
            }
        });
    }

    /**
     * Flush every cache handed out so far.
     */
    public void flushAll() throws IOException {
        for (MetadataCache cache : List.copyOf(caches.values())) {
            cache.flushDirty();
        }
    }

    public List<Path> getCacheDirs() {
        return new ArrayList<>(caches.keySet());
    }
}
