package com.tracepile.store.pile;

import com.tracepile.core.model.Trace;
import com.tracepile.store.file.TraceFile;

import java.util.List;
import java.util.Set;

/**
 * Traces chopped from several files plus the files whose data was used.
 */
public record ChopBatch(List<Trace> traces, Set<TraceFile> usedFiles) {
}
