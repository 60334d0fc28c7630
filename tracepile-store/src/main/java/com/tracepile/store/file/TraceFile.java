package com.tracepile.store.file;

import com.tracepile.core.io.TraceLoader;
import com.tracepile.core.model.NoDataException;
import com.tracepile.core.model.SnapPolicy;
import com.tracepile.core.model.Trace;
import com.tracepile.core.util.Times;
import com.tracepile.store.cache.CachedFile;
import com.tracepile.store.cache.TraceHeader;
import com.tracepile.store.index.TraceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Leaf of the pile hierarchy: the traces of one file.
 *
 * <p>Headers are kept all the time. Sample data is loaded on demand and held as long
 * as at least one consumer has retained it; the last {@link #release()} drops it.
 * Files backed by a {@link ResidentTraceSource} are always loaded and never drop data.</p>
 */
public class TraceFile extends TraceGroup {
    private static final Logger LOG = LoggerFactory.getLogger(TraceFile.class);

    private final TraceSource source;
    private List<Trace> traces = new ArrayList<>();
    private long mtime;
    private boolean dataLoaded;
    private int useCount;

    private TraceFile(TraceSource source) {
        super(null);
        this.source = source;
    }

    /**
     * Open a file on disk and read its headers.
     *
     * @param mtime modification time already known to the caller, or null to stat the file
     */
    public static TraceFile open(Path abspath, String format, TraceLoader loader,
                                 Map<String, String> substitutions, Long mtime) throws IOException {
        TraceFile file = new TraceFile(new PathTraceSource(abspath, format, loader, substitutions));
        file.loadHeaders(mtime);
        return file;
    }

    /**
     * Wrap traces which exist in memory only.
     */
    public static TraceFile resident(List<? extends Trace> traces) {
        ResidentTraceSource source = new ResidentTraceSource(traces);
        TraceFile file = new TraceFile(source);
        file.traces = new ArrayList<>(source.loadData());
        file.mtime = source.currentMtime();
        file.dataLoaded = true;
        file.rebuildFrom(file.traces);
        return file;
    }

    /**
     * Recreate a file from cached metadata without touching the file itself.
     */
    public static TraceFile fromCache(CachedFile entry, TraceLoader loader) {
        TraceFile file = new TraceFile(new PathTraceSource(Path.of(entry.path()), entry.format(), loader, null));
        for (TraceHeader header : entry.traces()) {
            file.traces.add(header.toTrace());
        }
        file.mtime = entry.mtime();
        file.rebuildFrom(file.traces);
        return file;
    }

    /**
     * Snapshot of the metadata worth caching.
     */
    public CachedFile toCachedFile() {
        if (source.isResident()) {
            throw new IllegalStateException("In-memory trace files are not cached: " + source.describe());
        }
        List<TraceHeader> headers = traces.stream().map(TraceHeader::of).toList();
        return new CachedFile(source.getPath().toString(), source.getFormat(), mtime, getTmin(), getTmax(), headers);
    }

    /**
     * Read trace headers, discarding any loaded data.
     */
    public void loadHeaders(Long knownMtime) throws IOException {
        if (source.isResident()) return;
        LOG.debug("Loading headers from file: {}", source.describe());
        long loadedMtime = knownMtime != null ? knownMtime : source.currentMtime();
        this.traces = new ArrayList<>(source.loadHeaders());
        this.mtime = loadedMtime;
        this.dataLoaded = false;
        this.useCount = 0;
        rebuildFrom(traces);
    }

    /**
     * Materialise the samples of all traces. No-op if already loaded, unless forced.
     */
    public void loadData(boolean force) throws IOException {
        if (source.isResident()) return;
        if (!dataLoaded || force) {
            LOG.debug("Loading data from file: {}", source.describe());
            this.traces = new ArrayList<>(source.loadData());
            this.dataLoaded = true;
        }
    }

    /**
     * Register a consumer of the loaded data.
     *
     * @throws IllegalStateException if data is not loaded
     */
    public void retain() {
        if (!dataLoaded) {
            throw new IllegalStateException("Data not loaded: " + source.describe());
        }
        useCount++;
    }

    /**
     * Unregister a consumer. The last release drops the sample data.
     * Releasing a file nobody retained is tolerated.
     */
    public void release() {
        if (useCount > 0) {
            useCount--;
        } else {
            useCount = 0;
        }
        if (useCount == 0 && dataLoaded && !source.isResident()) {
            LOG.debug("Forgetting data of file: {}", source.describe());
            for (Trace trace : traces) {
                trace.dropData();
            }
            dataLoaded = false;
        }
    }

    /**
     * Re-read the file if its modification time changed since the last load.
     * Loaded data is reloaded as data, unloaded files get fresh headers. A failed read
     * leaves traces and modification time untouched, so the next call tries again.
     *
     * @return true if the file was reloaded
     */
    public boolean reloadIfModified() throws IOException {
        if (source.isResident()) return false;

        long current = source.currentMtime();
        if (current == mtime) return false;

        LOG.debug("mtime={}, reloading file: {}", current, source.describe());
        if (dataLoaded) {
            loadData(true);
            this.mtime = current;
        } else {
            loadHeaders(current);
        }
        rebuildFrom(traces);
        return true;
    }

    /**
     * Add traces to an in-memory file and propagate the growth to the root.
     */
    public void addTraces(List<? extends Trace> added) {
        if (!source.isResident()) {
            throw new IllegalStateException("Traces can only be added to in-memory files");
        }
        traces.addAll(added);
        recursiveGrowUpdate(added);
    }

    @Override
    public void recursiveFullUpdate() {
        rebuildFrom(traces);
        if (getParent() != null) {
            getParent().recursiveFullUpdate();
        }
    }

    /**
     * Chop all traces passing {@code traceSelector} to {@code [tmin, tmax]}.
     * Traces without samples in the window are skipped.
     *
     * @param loadData materialise data before chopping; otherwise header-only traces are chopped
     */
    public ChopResult chop(double tmin, double tmax, Predicate<? super Trace> traceSelector,
                           SnapPolicy snap, boolean loadData) throws IOException {
        if (traces.stream().noneMatch(t -> traceSelector == null || traceSelector.test(t))) {
            return ChopResult.EMPTY;
        }

        boolean used = false;
        if (loadData) {
            loadData(false);
            used = true;
        }

        List<Trace> chopped = new ArrayList<>();
        for (Trace trace : traces) {
            if (traceSelector != null && !traceSelector.test(trace)) continue;
            try {
                chopped.add(trace.chop(tmin, tmax, snap));
            } catch (NoDataException e) {
                LOG.trace("Skipping trace: {}", e.getMessage());
            }
        }
        return new ChopResult(chopped, used);
    }

    /**
     * Modification time, if any trace passes the selector.
     */
    public OptionalLong getNewestMtime(double tmin, double tmax, Predicate<? super Trace> traceSelector) {
        for (Trace trace : traces) {
            if (traceSelector == null || traceSelector.test(trace)) {
                return OptionalLong.of(mtime);
            }
        }
        return OptionalLong.empty();
    }

    public Set<Double> getDeltats() {
        Set<Double> deltats = new HashSet<>();
        for (Trace trace : traces) {
            deltats.add(trace.deltat());
        }
        return deltats;
    }

    @Override
    public <K> Set<K> gatherKeys(Function<? super Trace, ? extends K> gather, Predicate<? super Trace> selector) {
        Set<K> keys = new HashSet<>();
        for (Trace trace : traces) {
            if (selector == null || selector.test(trace)) {
                keys.add(gather.apply(trace));
            }
        }
        return keys;
    }

    public List<Trace> getTraces() {
        return Collections.unmodifiableList(traces);
    }

    public TraceSource getSource() {
        return source;
    }

    /**
     * Backing file, or null for in-memory files.
     */
    public Path getAbspath() {
        return source.getPath();
    }

    public long getMtime() {
        return mtime;
    }

    public boolean isDataLoaded() {
        return dataLoaded;
    }

    public int getUseCount() {
        return useCount;
    }

    @Override
    public String toString() {
        return (source.isResident() ? "MemTraceFile\n" : "TraceFile\n")
            + "abspath: " + source.describe() + "\n"
            + "file mtime: " + Times.format(mtime / 1000.0) + "\n"
            + "number of traces: " + traces.size() + "\n"
            + describeContent();
    }
}
