package com.tracepile.store.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.core.MessagePackException;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Disk cache of trace file metadata.
 *
 * <p>For each directory containing trace files, one shard file holds the metadata of
 * all files in that directory. The shard name is a stable hash of the directory path.
 * Shards are MessagePack documents written through Jackson.</p>
 *
 * <p>The cache is advisory. A missing or unreadable shard is a plain cache miss, and
 * there is no locking between processes sharing a cache directory.</p>
 */
public class MetadataCache {
    private static final Logger LOG = LoggerFactory.getLogger(MetadataCache.class);

    static final int FORMAT_VERSION = 1;

    private final Path cacheDir;
    private final ObjectMapper msgpackMapper = new ObjectMapper(new MessagePackFactory());
    private final Map<Path, Map<String, CachedFile>> shards = new HashMap<>();
    private final Set<Path> dirty = new HashSet<>();

    /**
     * Create a cache stored in {@code cacheDir}, creating the directory if needed.
     */
    public MetadataCache(Path cacheDir) throws IOException {
        this.cacheDir = cacheDir.toAbsolutePath().normalize();
        Files.createDirectories(this.cacheDir);
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    /**
     * Look up the metadata of a file. Entries with impossible values are a miss.
     *
     * @param abspath absolute path of the trace file
     */
    public synchronized Optional<CachedFile> get(Path abspath) {
        Map<String, CachedFile> shard = getShard(shardPath(abspath));
        return Optional.ofNullable(shard.get(abspath.toString())).filter(MetadataCache::isUsable);
    }

    /**
     * Store the metadata of a file. The shard is written on the next {@link #flushDirty()}.
     */
    public synchronized void put(Path abspath, CachedFile entry) {
        Path shardPath = shardPath(abspath);
        getShard(shardPath).put(abspath.toString(), entry);
        dirty.add(shardPath);
    }

    /**
     * Write every modified shard to disk.
     */
    public synchronized void flushDirty() throws IOException {
        Iterator<Path> it = dirty.iterator();
        while (it.hasNext()) {
            Path shardPath = it.next();
            writeShard(shards.get(shardPath), shardPath);
            it.remove();
        }
    }

    /**
     * Flush, then drop entries of vanished files from every shard on disk.
     * Shards left empty are deleted.
     */
    public synchronized void prune() throws IOException {
        flushDirty();

        List<Path> shardPaths = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir)) {
            for (Path shardPath : stream) {
                if (isShardName(shardPath.getFileName().toString())) {
                    shardPaths.add(shardPath);
                }
            }
        }

        for (Path shardPath : shardPaths) {
            Map<String, CachedFile> shard = loadShard(shardPath);
            writeShard(shard, shardPath);
            shards.put(shardPath, shard);
        }
    }

    /**
     * Number of shards currently held in memory.
     */
    public synchronized int getLoadedShardCount() {
        return shards.size();
    }

    Path shardPath(Path abspath) {
        Path dir = abspath.getParent();
        String key = dir != null ? dir.toString() : "";
        return cacheDir.resolve(Integer.toUnsignedString(key.hashCode()));
    }

    private Map<String, CachedFile> getShard(Path shardPath) {
        return shards.computeIfAbsent(shardPath, p -> Files.isRegularFile(p) ? loadShard(p) : new HashMap<>());
    }

    private Map<String, CachedFile> loadShard(Path shardPath) {
        CacheShard stored;
        try (InputStream in = Files.newInputStream(shardPath)) {
            stored = msgpackMapper.readValue(in, CacheShard.class);
        } catch (IOException | MessagePackException e) {
            LOG.warn("Ignoring unreadable cache shard {}: {}", shardPath, e.getMessage());
            return new HashMap<>();
        }

        if (stored == null || stored.version() != FORMAT_VERSION || stored.entries() == null) {
            LOG.warn("Ignoring cache shard {} with unsupported format", shardPath);
            return new HashMap<>();
        }

        Map<String, CachedFile> shard = new HashMap<>(stored.entries());
        int before = shard.size();
        shard.values().removeIf(entry -> !isUsable(entry));
        if (shard.size() < before) {
            LOG.warn("Ignoring {} broken entries of cache shard {}", before - shard.size(), shardPath);
        }
        shard.keySet().removeIf(path -> !Files.isRegularFile(Path.of(path)));
        return shard;
    }

    static boolean isUsable(CachedFile entry) {
        if (entry == null || entry.path() == null || entry.format() == null) {
            return false;
        }
        for (TraceHeader header : entry.traces()) {
            if (header.size() < 1 || !(header.deltat() > 0)
                || !Double.isFinite(header.tmin()) || !Double.isFinite(header.deltat())) {
                return false;
            }
        }
        return true;
    }

    private void writeShard(Map<String, CachedFile> shard, Path shardPath) throws IOException {
        if (shard == null || shard.isEmpty()) {
            Files.deleteIfExists(shardPath);
            return;
        }

        Path tmp = shardPath.resolveSibling(shardPath.getFileName() + "." + ProcessHandle.current().pid() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
            msgpackMapper.writeValue(out, new CacheShard(FORMAT_VERSION, shard));
        }
        try {
            Files.move(tmp, shardPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, shardPath, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.debug("Wrote cache shard {} ({} entries)", shardPath, shard.size());
    }

    private static boolean isShardName(String name) {
        try {
            Integer.parseUnsignedInt(name);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
