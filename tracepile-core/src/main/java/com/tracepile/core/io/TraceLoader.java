package com.tracepile.core.io;

import com.tracepile.core.model.Trace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads the traces contained in one file.
 */
public interface TraceLoader {

    /**
     * Load traces from a file.
     *
     * @param path          file to read
     * @param wantData      false to read headers only
     * @param substitutions identity overrides keyed by "network", "station", "location"
     *                      or "channel"; may be null
     * @throws FileLoadException if the file content cannot be parsed
     * @throws IOException       on read failure
     */
    List<Trace> load(Path path, boolean wantData, Map<String, String> substitutions) throws IOException;
}
