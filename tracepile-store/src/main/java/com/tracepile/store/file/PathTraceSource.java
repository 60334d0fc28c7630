package com.tracepile.store.file;

import com.tracepile.core.io.TraceLoader;
import com.tracepile.core.model.Trace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Traces read from a file on disk through a format loader.
 */
public class PathTraceSource implements TraceSource {

    private final Path abspath;
    private final String format;
    private final TraceLoader loader;
    private final Map<String, String> substitutions;

    public PathTraceSource(Path abspath, String format, TraceLoader loader, Map<String, String> substitutions) {
        this.abspath = abspath;
        this.format = format;
        this.loader = loader;
        this.substitutions = substitutions == null ? null : Map.copyOf(substitutions);
    }

    @Override
    public List<Trace> loadHeaders() throws IOException {
        return loader.load(abspath, false, substitutions);
    }

    @Override
    public List<Trace> loadData() throws IOException {
        return loader.load(abspath, true, substitutions);
    }

    @Override
    public long currentMtime() throws IOException {
        return Files.getLastModifiedTime(abspath).toMillis();
    }

    @Override
    public boolean isResident() {
        return false;
    }

    @Override
    public Path getPath() {
        return abspath;
    }

    @Override
    public String getFormat() {
        return format;
    }

    public Map<String, String> getSubstitutions() {
        return substitutions;
    }

    @Override
    public String describe() {
        return abspath.toString();
    }
}
