package com.tracepile.store.pile;

import com.tracepile.core.model.SnapPolicy;
import com.tracepile.core.model.Trace;
import com.tracepile.store.file.ChopResult;
import com.tracepile.store.file.TraceFile;
import com.tracepile.store.index.TraceGroup;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Files of one calendar month.
 */
public class TimeBucket extends TraceGroup {

    private final TimeKey key;
    private final List<TraceFile> files = new ArrayList<>();

    TimeBucket(TracePile pile, TimeKey key) {
        super(pile);
        this.key = key;
    }

    public TimeKey getKey() {
        return key;
    }

    @Override
    public void recursiveFullUpdate() {
        rebuildFrom(files);
        if (getParent() != null) {
            getParent().recursiveFullUpdate();
        }
    }

    public void addFile(TraceFile file) {
        files.add(file);
        file.setParent(this);
        growFrom(List.of(file));
    }

    public void removeFile(TraceFile file) {
        removeFiles(List.of(file));
    }

    /**
     * Detach files and rebuild from the remaining ones.
     */
    public void removeFiles(Collection<TraceFile> removed) {
        for (TraceFile file : removed) {
            if (files.remove(file)) {
                file.setParent(null);
            }
        }
        rebuildFrom(files);
    }

    public OptionalLong getNewestMtime(double tmin, double tmax,
                                       Predicate<? super TraceGroup> groupSelector,
                                       Predicate<? super Trace> traceSelector) {
        OptionalLong newest = OptionalLong.empty();
        for (TraceFile file : files) {
            if (!file.isRelevant(tmin, tmax, groupSelector)) continue;
            OptionalLong mtime = file.getNewestMtime(tmin, tmax, traceSelector);
            if (mtime.isPresent() && (newest.isEmpty() || mtime.getAsLong() > newest.getAsLong())) {
                newest = mtime;
            }
        }
        return newest;
    }

    /**
     * Chop the relevant files of this bucket.
     */
    public ChopBatch chop(double tmin, double tmax,
                          Predicate<? super TraceGroup> groupSelector,
                          Predicate<? super Trace> traceSelector,
                          SnapPolicy snap, boolean loadData) throws IOException {
        List<Trace> chopped = new ArrayList<>();
        Set<TraceFile> used = new LinkedHashSet<>();
        for (TraceFile file : files) {
            if (!file.isRelevant(tmin, tmax, groupSelector)) continue;
            ChopResult result = file.chop(tmin, tmax, traceSelector, snap, loadData);
            chopped.addAll(result.traces());
            if (result.used()) {
                used.add(file);
            }
        }
        return new ChopBatch(chopped, used);
    }

    @Override
    public <K> Set<K> gatherKeys(Function<? super Trace, ? extends K> gather, Predicate<? super Trace> selector) {
        Set<K> keys = new HashSet<>();
        for (TraceFile file : files) {
            keys.addAll(file.gatherKeys(gather, selector));
        }
        return keys;
    }

    public Set<Double> getDeltats() {
        Set<Double> deltats = new HashSet<>();
        for (TraceFile file : files) {
            deltats.addAll(file.getDeltats());
        }
        return deltats;
    }

    /**
     * Visit traces file by file. With {@code loadData}, each file's data is held only
     * while its traces are visited.
     */
    public void forEachTrace(boolean loadData, Predicate<? super TraceGroup> groupSelector,
                             Predicate<? super Trace> traceSelector,
                             BiConsumer<TraceFile, Trace> visitor) throws IOException {
        for (TraceFile file : List.copyOf(files)) {
            if (groupSelector != null && !groupSelector.test(file)) continue;

            if (loadData) {
                file.loadData(false);
                file.retain();
            }
            try {
                for (Trace trace : file.getTraces()) {
                    if (traceSelector == null || traceSelector.test(trace)) {
                        visitor.accept(file, trace);
                    }
                }
            } finally {
                if (loadData) {
                    file.release();
                }
            }
        }
    }

    /**
     * Reload files changed on disk.
     *
     * @return true if any file was reloaded
     */
    public boolean reloadModified() throws IOException {
        boolean modified = false;
        IOException failure = null;
        for (TraceFile file : files) {
            try {
                modified |= file.reloadIfModified();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (modified) {
            rebuildFrom(files);
        }
        if (failure != null) {
            throw failure;
        }
        return modified;
    }

    public List<TraceFile> getFiles() {
        return Collections.unmodifiableList(files);
    }

    @Override
    public String toString() {
        return "TimeBucket " + key + "\n"
            + "number of files: " + files.size() + "\n"
            + describeContent();
    }
}
