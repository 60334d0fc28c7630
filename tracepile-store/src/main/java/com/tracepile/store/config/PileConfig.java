package com.tracepile.store.config;

import com.tracepile.core.degap.SampleDegapper;
import com.tracepile.store.pile.WindowPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Settings for building and chopping piles.
 */
public class PileConfig {
    private static final String DEFAULT_CACHE_DIR =
        System.getProperty("java.io.tmpdir") + "/tracepile_cache_" + System.getProperty("user.name");
    private static final String DEFAULT_FORMAT = "text";

    private final Path cacheDir;
    private final String format;
    private final double exactTolerance;
    private final double fillTolerance;
    private final int maxGap;

    public PileConfig(Path cacheDir, String format, double exactTolerance, double fillTolerance, int maxGap) {
        this.cacheDir = cacheDir;
        this.format = format;
        this.exactTolerance = exactTolerance;
        this.fillTolerance = fillTolerance;
        this.maxGap = maxGap;
    }

    public static PileConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    /**
     * Read settings from {@code props}, falling back to {@code env}, then to defaults.
     */
    static PileConfig load(Properties props, Map<String, String> env) {
        Path cacheDir = Paths.get(props.getProperty("tracepile.cache.dir",
            env.getOrDefault("TRACEPILE_CACHE_DIR", DEFAULT_CACHE_DIR)));

        String format = props.getProperty("tracepile.format",
            env.getOrDefault("TRACEPILE_FORMAT", DEFAULT_FORMAT));

        double exact = Double.parseDouble(props.getProperty("tracepile.window.exact_tolerance",
            env.getOrDefault("TRACEPILE_EXACT_TOLERANCE", "0.5")));

        double fill = Double.parseDouble(props.getProperty("tracepile.window.fill_tolerance",
            env.getOrDefault("TRACEPILE_FILL_TOLERANCE", "5.0")));

        int maxGap = Integer.parseInt(props.getProperty("tracepile.degap.max_gap",
            env.getOrDefault("TRACEPILE_MAX_GAP", String.valueOf(SampleDegapper.DEFAULT_MAX_GAP))));

        return new PileConfig(cacheDir, format, exact, fill, maxGap);
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public String getFormat() {
        return format;
    }

    public double getExactTolerance() {
        return exactTolerance;
    }

    public double getFillTolerance() {
        return fillTolerance;
    }

    public int getMaxGap() {
        return maxGap;
    }

    public WindowPolicy getWindowPolicy() {
        return new WindowPolicy(exactTolerance, fillTolerance);
    }

    public SampleDegapper createDegapper() {
        return new SampleDegapper(maxGap);
    }
}
