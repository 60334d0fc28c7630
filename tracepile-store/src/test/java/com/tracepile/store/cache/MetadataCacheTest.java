package com.tracepile.store.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracepile.store.file.TraceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.tracepile.store.TraceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetadataCache.
 */
class MetadataCacheTest {

    @TempDir
    Path tempDir;

    private Path cacheDir;
    private Path dataDir;

    @BeforeEach
    void setUp() {
        cacheDir = tempDir.resolve("cache");
        dataDir = tempDir.resolve("data");
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTripTests {

        @Test
        @DisplayName("Should restore identical metadata from disk")
        void restoresMetadata() throws IOException {
            // Given
            Path file = writeFile(dataDir, "a.txt", trace("APE", JAN_2001, 10), trace("BFO", JAN_2001 + 5, 20));
            TraceFile traceFile = open(file);
            CachedFile entry = traceFile.toCachedFile();
            MetadataCache cache = new MetadataCache(cacheDir);
            cache.put(file, entry);
            cache.flushDirty();

            // When
            Optional<CachedFile> restored = new MetadataCache(cacheDir).get(file);

            // Then
            assertTrue(restored.isPresent());
            assertEquals(entry, restored.get());
            TraceFile rebuilt = TraceFile.fromCache(restored.get(), TEXT);
            assertEquals(traceFile.getIds(), rebuilt.getIds());
            assertEquals(traceFile.getStations(), rebuilt.getStations());
            assertEquals(traceFile.getTmin(), rebuilt.getTmin());
            assertEquals(traceFile.getTmax(), rebuilt.getTmax());
            assertFalse(rebuilt.isDataLoaded());
        }

        @Test
        @DisplayName("Should drop entries of deleted files on load")
        void dropsDeletedFiles() throws IOException {
            Path kept = writeFile(dataDir, "kept.txt", trace("APE", JAN_2001, 10));
            Path gone = writeFile(dataDir, "gone.txt", trace("BFO", JAN_2001, 10));
            MetadataCache cache = new MetadataCache(cacheDir);
            cache.put(kept, open(kept).toCachedFile());
            cache.put(gone, open(gone).toCachedFile());
            cache.flushDirty();

            Files.delete(gone);
            MetadataCache reloaded = new MetadataCache(cacheDir);

            assertTrue(reloaded.get(kept).isPresent());
            assertTrue(reloaded.get(gone).isEmpty());
        }

        @Test
        @DisplayName("Files of one directory share a shard")
        void oneShardPerDirectory() throws IOException {
            Path a = writeFile(dataDir, "a.txt", trace("APE", JAN_2001, 10));
            Path b = writeFile(dataDir, "b.txt", trace("BFO", JAN_2001, 10));
            Path c = writeFile(tempDir.resolve("other"), "c.txt", trace("APE", JAN_2001, 10));
            MetadataCache cache = new MetadataCache(cacheDir);

            assertEquals(cache.shardPath(a), cache.shardPath(b));
            assertNotEquals(cache.shardPath(a), cache.shardPath(c));
        }
    }

    @Nested
    @DisplayName("Corruption")
    class CorruptionTests {

        @Test
        @DisplayName("Should treat an unreadable shard as a miss")
        void garbageIsMiss() throws IOException {
            Path file = writeFile(dataDir, "a.txt", trace("APE", JAN_2001, 10));
            MetadataCache cache = new MetadataCache(cacheDir);
            Files.write(cache.shardPath(file), new byte[]{(byte) 0xc1, 0x00, 0x13, 0x37});

            assertTrue(cache.get(file).isEmpty());
        }

        @Test
        @DisplayName("Should treat a shard of another format version as a miss")
        void versionMismatchIsMiss() throws IOException {
            Path file = writeFile(dataDir, "a.txt", trace("APE", JAN_2001, 10));
            MetadataCache cache = new MetadataCache(cacheDir);
            CacheShard foreign = new CacheShard(MetadataCache.FORMAT_VERSION + 1,
                Map.of(file.toString(), open(file).toCachedFile()));
            new ObjectMapper(new MessagePackFactory()).writeValue(cache.shardPath(file).toFile(), foreign);

            assertTrue(cache.get(file).isEmpty());
        }

        @Test
        @DisplayName("Should drop entries with impossible values and keep the rest of the shard")
        void brokenEntriesAreMisses() throws IOException {
            // Given
            Path good = writeFile(dataDir, "good.txt", trace("APE", JAN_2001, 10));
            Path bad = writeFile(dataDir, "bad.txt", trace("BFO", JAN_2001, 10));
            CachedFile broken = new CachedFile(bad.toString(), "text", 1_000L, JAN_2001, JAN_2001,
                List.of(new TraceHeader("GE", "BFO", "", "BHZ", JAN_2001, 0.0, 10)));
            MetadataCache cache = new MetadataCache(cacheDir);
            CacheShard shard = new CacheShard(MetadataCache.FORMAT_VERSION,
                Map.of(good.toString(), open(good).toCachedFile(), bad.toString(), broken));
            new ObjectMapper(new MessagePackFactory()).writeValue(cache.shardPath(good).toFile(), shard);

            // When / Then
            assertTrue(cache.get(good).isPresent());
            assertTrue(cache.get(bad).isEmpty());
        }
    }

    @Test
    @DisplayName("Prune should delete shards whose files are all gone")
    void pruneDeletesEmptyShards() throws IOException {
        Path a = writeFile(dataDir, "a.txt", trace("APE", JAN_2001, 10));
        Path b = writeFile(tempDir.resolve("other"), "b.txt", trace("BFO", JAN_2001, 10));
        MetadataCache cache = new MetadataCache(cacheDir);
        cache.put(a, open(a).toCachedFile());
        cache.put(b, open(b).toCachedFile());
        cache.flushDirty();
        Path shardA = cache.shardPath(a);
        Path shardB = cache.shardPath(b);

        Files.delete(b);
        new MetadataCache(cacheDir).prune();

        assertTrue(Files.exists(shardA));
        assertFalse(Files.exists(shardB));
    }

    @Test
    @DisplayName("Manager should hand out one cache per directory")
    void managerMemoizes() {
        MetadataCacheManager manager = new MetadataCacheManager();

        MetadataCache first = manager.getCache(cacheDir);
        MetadataCache second = manager.getCache(cacheDir.resolve("..").resolve("cache"));

        assertSame(first, second);
        assertEquals(1, manager.getCacheDirs().size());
    }
}
