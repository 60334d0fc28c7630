package com.tracepile.store.file;

import com.tracepile.core.model.Trace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Where a {@link TraceFile} gets its traces from.
 */
public interface TraceSource {

    /**
     * Read identity and timing of all traces, without samples.
     */
    List<Trace> loadHeaders() throws IOException;

    /**
     * Read all traces including samples.
     */
    List<Trace> loadData() throws IOException;

    /**
     * Modification time of the backing file in millis.
     */
    long currentMtime() throws IOException;

    /**
     * True if traces live in memory only; such data is never dropped.
     */
    boolean isResident();

    /**
     * Backing file, or null for resident sources.
     */
    Path getPath();

    String getFormat();

    /**
     * Path or synthetic name, used in logs and summaries.
     */
    String describe();
}
