package com.tracepile.store.scan;

import com.tracepile.core.io.FileLoadException;
import com.tracepile.core.io.TraceLoader;
import com.tracepile.store.cache.CachedFile;
import com.tracepile.store.cache.MetadataCache;
import com.tracepile.store.file.TraceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns paths into {@link TraceFile}s, using the metadata cache where possible.
 *
 * <p>A cached entry is used when its modification time matches the file on disk and
 * no filename attributes apply. Otherwise the file headers are read and, without
 * filename attributes, stored in the cache. Failing paths are skipped and reported
 * together once the whole list has been processed. Dirty cache shards are written at
 * the end of each {@link #load(List)}.</p>
 */
public class TraceFileLoader {
    private static final Logger LOG = LoggerFactory.getLogger(TraceFileLoader.class);

    private final TraceLoader loader;
    private final String format;
    private final MetadataCache cache;
    private final FilenameAttributes attributes;

    /**
     * @param loader     reads files of {@code format}
     * @param format     format name stored with each file
     * @param cache      metadata cache, or null to always read headers
     * @param attributes filename attributes, or null
     */
    public TraceFileLoader(TraceLoader loader, String format, MetadataCache cache, FilenameAttributes attributes) {
        this.loader = loader;
        this.format = format;
        this.cache = cache;
        this.attributes = attributes;
    }

    public ScanReport load(List<String> paths) {
        if (paths.isEmpty()) {
            LOG.warn("No files to load");
        }

        List<TraceFile> files = new ArrayList<>();
        List<ScanReport.Failure> failures = new ArrayList<>();
        int cacheHits = 0;

        for (String p : paths) {
            Path abspath = Path.of(p).toAbsolutePath().normalize();
            try {
                Map<String, String> substitutions = attributes != null ? attributes.extract(abspath) : null;
                if (substitutions != null && substitutions.isEmpty()) {
                    substitutions = null;
                }

                long mtime = Files.getLastModifiedTime(abspath).toMillis();
                Optional<CachedFile> cached = substitutions == null && cache != null
                    ? cache.get(abspath)
                    : Optional.empty();

                if (cached.isPresent() && cached.get().mtime() == mtime && format.equals(cached.get().format())) {
                    files.add(TraceFile.fromCache(cached.get(), loader));
                    cacheHits++;
                    continue;
                }

                TraceFile file = TraceFile.open(abspath, format, loader, substitutions, mtime);
                if (substitutions == null && cache != null) {
                    cache.put(abspath, file.toCachedFile());
                }
                files.add(file);
            } catch (FileLoadException e) {
                LOG.debug("Cannot load {}: {}", p, e.getMessage());
                failures.add(new ScanReport.Failure(p, e));
            } catch (FilenameAttributeException | IOException e) {
                failures.add(new ScanReport.Failure(p, e));
            }
        }

        if (!failures.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (ScanReport.Failure failure : failures) {
                sb.append("\n  ").append(failure.path()).append(": ").append(failure.error().getMessage());
            }
            LOG.warn("Failed to load {} of {} file(s):{}", failures.size(), paths.size(), sb);
        }

        if (cache != null) {
            try {
                cache.flushDirty();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write metadata cache " + cache.getCacheDir(), e);
            }
        }

        LOG.debug("Loaded {} file(s), {} from cache", files.size(), cacheHits);
        return new ScanReport(files, failures, cacheHits);
    }
}
