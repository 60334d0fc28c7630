package com.tracepile.store.scan;

import com.tracepile.store.file.TraceFile;

import java.util.List;

/**
 * Outcome of loading a list of paths.
 *
 * @param files     files loaded, in input order
 * @param failures  paths which could not be loaded
 * @param cacheHits number of files restored from the metadata cache
 */
public record ScanReport(List<TraceFile> files, List<Failure> failures, int cacheHits) {

    public ScanReport {
        files = List.copyOf(files);
        failures = List.copyOf(failures);
    }

    /**
     * A path that was skipped, with the reason.
     */
    public record Failure(String path, Exception error) {
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
