package com.tracepile.core.io;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps format names to loaders.
 */
public class TraceFormatRegistry {

    private final Map<String, TraceLoader> loaders = new ConcurrentHashMap<>();

    /**
     * Registry with the built-in formats.
     */
    public static TraceFormatRegistry withDefaults() {
        TraceFormatRegistry registry = new TraceFormatRegistry();
        registry.register(TextTraceFormat.NAME, new TextTraceFormat());
        return registry;
    }

    public void register(String format, TraceLoader loader) {
        loaders.put(format, loader);
    }

    /**
     * Get the loader for a format.
     *
     * @throws IllegalArgumentException for unknown formats
     */
    public TraceLoader get(String format) {
        TraceLoader loader = loaders.get(format);
        if (loader == null) {
            throw new IllegalArgumentException("Unknown trace format: " + format + " (known: " + loaders.keySet() + ")");
        }
        return loader;
    }

    public Set<String> getFormats() {
        return Set.copyOf(loaders.keySet());
    }
}
