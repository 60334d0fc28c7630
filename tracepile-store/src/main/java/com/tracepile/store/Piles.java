package com.tracepile.store;

import com.tracepile.core.io.TraceFormatRegistry;
import com.tracepile.store.cache.MetadataCache;
import com.tracepile.store.cache.MetadataCacheManager;
import com.tracepile.store.config.PileConfig;
import com.tracepile.store.pile.TracePile;
import com.tracepile.store.scan.FileSelector;
import com.tracepile.store.scan.TraceFileLoader;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds piles from files and directories.
 */
public final class Piles {

    private Piles() {
    }

    /**
     * Build a pile with default window policy and degapper.
     *
     * @param paths    files and directories (walked recursively)
     * @param regex    pattern selecting files by absolute path, or null for all files
     * @param format   format name registered in {@link TraceFormatRegistry#withDefaults()}
     * @param cacheDir metadata cache directory, or null to run without cache
     * @param caches   owner of the metadata caches
     */
    public static TracePile makePile(List<String> paths, String regex, String format, Path cacheDir,
                                     MetadataCacheManager caches) {
        return makePile(paths, regex, format, cacheDir, caches, new TracePile());
    }

    /**
     * Build a pile from {@code paths} using the settings of {@code config}.
     */
    public static TracePile makePile(List<String> paths, String regex, PileConfig config,
                                     MetadataCacheManager caches) {
        TracePile pile = new TracePile(config.createDegapper(), config.getWindowPolicy());
        return makePile(paths, regex, config.getFormat(), config.getCacheDir(), caches, pile);
    }

    private static TracePile makePile(List<String> paths, String regex, String format, Path cacheDir,
                                      MetadataCacheManager caches, TracePile pile) {
        List<String> files = FileSelector.select(paths, regex, null);
        MetadataCache cache = cacheDir != null ? caches.getCache(cacheDir) : null;
        TraceFileLoader loader = new TraceFileLoader(TraceFormatRegistry.withDefaults().get(format), format, cache, null);
        pile.loadFiles(files, loader);
        return pile;
    }
}
