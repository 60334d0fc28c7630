package com.tracepile.store.file;

import com.tracepile.core.model.Trace;

import java.util.List;

/**
 * Traces chopped out of one file, and whether the file's data had to be materialised.
 */
public record ChopResult(List<Trace> traces, boolean used) {

    public static final ChopResult EMPTY = new ChopResult(List.of(), false);
}
