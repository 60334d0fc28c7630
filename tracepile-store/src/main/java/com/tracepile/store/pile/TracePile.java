package com.tracepile.store.pile;

import com.tracepile.core.degap.Degapper;
import com.tracepile.core.degap.SampleDegapper;
import com.tracepile.core.model.SnapPolicy;
import com.tracepile.core.model.Trace;
import com.tracepile.store.file.TraceFile;
import com.tracepile.store.index.ChangeEvent;
import com.tracepile.store.index.TraceGroup;
import com.tracepile.store.scan.ScanReport;
import com.tracepile.store.scan.TraceFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Root of the pile hierarchy: trace files sorted into monthly {@link TimeBucket}s.
 *
 * <p>Windowed access goes through {@link #chopper(ChopRequest)}. Every chopper belongs to
 * an accessor id; files retained for one accessor are tracked separately from those of
 * other accessors, so independent iterations may run side by side.</p>
 *
 * <p>Listeners are referenced weakly. A pile never keeps a listener alive; owners must
 * hold on to the listener themselves for as long as they want events.</p>
 */
public class TracePile extends TraceGroup {
    private static final Logger LOG = LoggerFactory.getLogger(TracePile.class);

    private static final String DEFAULT_ACCESSOR = "default";

    private final Map<TimeKey, TimeBucket> buckets = new TreeMap<>();
    private final Map<String, Set<TraceFile>> openFiles = new HashMap<>();
    private final List<WeakReference<PileListener>> listeners = new CopyOnWriteArrayList<>();
    private final Degapper degapper;
    private final WindowPolicy windowPolicy;

    public TracePile() {
        this(new SampleDegapper(), WindowPolicy.DEFAULT);
    }

    public TracePile(Degapper degapper, WindowPolicy windowPolicy) {
        super(null);
        this.degapper = degapper;
        this.windowPolicy = windowPolicy;
    }

    // ========== Structure ==========

    /**
     * Bucket key of a file, from the start of its first trace.
     */
    public TimeKey dispatchKey(TraceFile file) {
        if (!file.hasSpan()) {
            throw new IllegalArgumentException("File has no traces: " + file.getSource().describe());
        }
        return TimeKey.of(file.getTmin());
    }

    private TimeBucket dispatch(TraceFile file) {
        return buckets.computeIfAbsent(dispatchKey(file), key -> new TimeBucket(this, key));
    }

    public void addFile(TraceFile file) {
        addFiles(List.of(file));
    }

    /**
     * Sort files into their buckets and grow the touched buckets and the pile.
     * Files without any trace are skipped.
     */
    public void addFiles(Collection<TraceFile> files) {
        Set<TimeBucket> touched = new LinkedHashSet<>();
        for (TraceFile file : files) {
            if (!file.hasSpan()) {
                LOG.warn("Skipping file without traces: {}", file.getSource().describe());
                continue;
            }
            TimeBucket bucket = dispatch(file);
            bucket.addFile(file);
            touched.add(bucket);
        }
        growFrom(touched);
        notifyListeners(ChangeEvent.ADD);
    }

    /**
     * Add the files a loader produces for {@code paths}.
     */
    public ScanReport loadFiles(List<String> paths, TraceFileLoader loader) {
        ScanReport report = loader.load(paths);
        addFiles(report.files());
        return report;
    }

    public void removeFile(TraceFile file) {
        removeFiles(List.of(file));
    }

    /**
     * Detach files from their buckets and rebuild the pile. Buckets left empty are dropped.
     * Accessors still holding a removed file release it.
     */
    public void removeFiles(Collection<TraceFile> files) {
        Map<TimeBucket, List<TraceFile>> byBucket = new LinkedHashMap<>();
        for (TraceFile file : files) {
            if (file.getParent() instanceof TimeBucket bucket && bucket.getParent() == this) {
                byBucket.computeIfAbsent(bucket, b -> new ArrayList<>()).add(file);
            }
        }

        for (Map.Entry<TimeBucket, List<TraceFile>> entry : byBucket.entrySet()) {
            TimeBucket bucket = entry.getKey();
            bucket.removeFiles(entry.getValue());
            if (bucket.getFiles().isEmpty()) {
                buckets.remove(bucket.getKey());
                bucket.setParent(null);
            }
        }

        // removed files are no longer held by any accessor
        Iterator<Set<TraceFile>> accessors = openFiles.values().iterator();
        while (accessors.hasNext()) {
            Set<TraceFile> open = accessors.next();
            for (List<TraceFile> removed : byBucket.values()) {
                for (TraceFile file : removed) {
                    if (open.remove(file)) {
                        file.release();
                    }
                }
            }
            if (open.isEmpty()) {
                accessors.remove();
            }
        }

        rebuildFrom(buckets.values());
        notifyListeners(ChangeEvent.REMOVE);
    }

    @Override
    public void recursiveFullUpdate() {
        rebuildFrom(buckets.values());
        notifyListeners(ChangeEvent.FULLUPDATE);
    }

    // ========== Listeners ==========

    public void addListener(PileListener listener) {
        listeners.add(new WeakReference<>(listener));
    }

    public void removeListener(PileListener listener) {
        listeners.removeIf(ref -> {
            PileListener l = ref.get();
            return l == null || l == listener;
        });
    }

    @Override
    protected void notifyListeners(ChangeEvent event) {
        List<WeakReference<PileListener>> cleared = new ArrayList<>();
        for (WeakReference<PileListener> ref : listeners) {
            PileListener listener = ref.get();
            if (listener == null) {
                cleared.add(ref);
            } else {
                listener.pileChanged(event);
            }
        }
        listeners.removeAll(cleared);
    }

    /**
     * Number of listeners still alive.
     */
    public int getListenerCount() {
        int count = 0;
        for (WeakReference<PileListener> ref : listeners) {
            if (ref.get() != null) count++;
        }
        return count;
    }

    // ========== Chopping ==========

    /**
     * Chop every relevant file to {@code [tmin, tmax]} in one go.
     */
    public ChopBatch chop(double tmin, double tmax,
                          Predicate<? super TraceGroup> groupSelector,
                          Predicate<? super Trace> traceSelector,
                          SnapPolicy snap, boolean loadData) throws IOException {
        List<Trace> chopped = new ArrayList<>();
        Set<TraceFile> used = new LinkedHashSet<>();
        for (TimeBucket bucket : buckets.values()) {
            if (!bucket.isRelevant(tmin, tmax, groupSelector)) continue;
            ChopBatch batch = bucket.chop(tmin, tmax, groupSelector, traceSelector, snap, loadData);
            chopped.addAll(batch.traces());
            used.addAll(batch.usedFiles());
        }
        return new ChopBatch(chopped, used);
    }

    /**
     * Start a windowed iteration.
     *
     * <p>Missing bounds default to the pile span shrunk by {@code tpad}; a missing window
     * length gives a single window. A range the pile does not touch yields no windows.</p>
     *
     * @throws IllegalArgumentException if the window length is not positive
     */
    public WindowChopper chopper(ChopRequest request) {
        ChopRequest req = request.copy();
        if (!hasSpan()) {
            return WindowChopper.empty(this, req);
        }

        double tpad = req.getTpad();
        double tmin = req.getTmin() != null ? req.getTmin() : getTmin() + tpad;
        double tmax = req.getTmax() != null ? req.getTmax() : getTmax() - tpad;
        if (tmax <= tmin) {
            return WindowChopper.empty(this, req);
        }

        double tinc = req.getTinc() != null ? req.getTinc() : tmax - tmin;
        if (!(tinc > 0)) {
            throw new IllegalArgumentException("Window length must be > 0: " + tinc);
        }

        if (!isRelevant(tmin - tpad, tmax + tpad, req.getGroupSelector())) {
            return WindowChopper.empty(this, req);
        }

        return new WindowChopper(this, req, tmin, tmax, tinc);
    }

    /**
     * Run one chopper per distinct key of {@code gather}, in key order.
     */
    public <K extends Comparable<? super K>> GroupedChopper<K> chopperGrouped(
            Function<? super Trace, ? extends K> gather, ChopRequest request) {
        return new GroupedChopper<>(this, gather, request);
    }

    /**
     * All traces of all windows of {@code request}, collected into one list.
     */
    public List<Trace> all(ChopRequest request) {
        List<Trace> traces = new ArrayList<>();
        try (WindowChopper chopper = chopper(request)) {
            while (chopper.hasNext()) {
                traces.addAll(chopper.next());
            }
        }
        return traces;
    }

    /**
     * Lazily flattened traces of all windows of {@code request}.
     */
    public Iterator<Trace> iterAll(ChopRequest request) {
        WindowChopper chopper = chopper(request);
        return new Iterator<>() {
            private Iterator<Trace> window = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!window.hasNext()) {
                    if (!chopper.hasNext()) return false;
                    window = chopper.next().iterator();
                }
                return true;
            }

            @Override
            public Trace next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return window.next();
            }
        };
    }

    /**
     * Release every file still held for an accessor.
     */
    public void releaseAccessor(String accessorId) {
        Set<TraceFile> open = openFiles.remove(accessorKey(accessorId));
        if (open == null) return;
        LOG.debug("Releasing {} file(s) of accessor {}", open.size(), accessorId);
        for (TraceFile file : open) {
            file.release();
        }
        open.clear();
    }

    /**
     * Live set of files held for an accessor, created on first use.
     */
    Set<TraceFile> openFilesOf(String accessorId) {
        return openFiles.computeIfAbsent(accessorKey(accessorId), k -> new LinkedHashSet<>());
    }

    /**
     * Forget an accessor holding no file anymore.
     */
    void dropIdleAccessor(String accessorId) {
        String key = accessorKey(accessorId);
        Set<TraceFile> open = openFiles.get(key);
        if (open != null && open.isEmpty()) {
            openFiles.remove(key);
        }
    }

    /**
     * Number of accessors currently holding files.
     */
    public int getAccessorCount() {
        return openFiles.size();
    }

    /**
     * Files currently held for an accessor.
     */
    public Set<TraceFile> getOpenFiles(String accessorId) {
        Set<TraceFile> open = openFiles.get(accessorKey(accessorId));
        return open == null ? Set.of() : Collections.unmodifiableSet(open);
    }

    private static String accessorKey(String accessorId) {
        return accessorId != null ? accessorId : DEFAULT_ACCESSOR;
    }

    // ========== Queries ==========

    @Override
    public <K> Set<K> gatherKeys(Function<? super Trace, ? extends K> gather, Predicate<? super Trace> selector) {
        Set<K> keys = new HashSet<>();
        for (TimeBucket bucket : buckets.values()) {
            keys.addAll(bucket.gatherKeys(gather, selector));
        }
        return keys;
    }

    /**
     * Distinct keys in natural order.
     */
    public <K extends Comparable<? super K>> List<K> gatherSortedKeys(Function<? super Trace, ? extends K> gather,
                                                                      Predicate<? super Trace> selector) {
        Set<K> found = gatherKeys(gather, selector);
        List<K> keys = new ArrayList<>(found);
        Collections.sort(keys);
        return keys;
    }

    /**
     * Distinct sample intervals, ascending.
     */
    public List<Double> getDeltats() {
        Set<Double> deltats = new HashSet<>();
        for (TimeBucket bucket : buckets.values()) {
            deltats.addAll(bucket.getDeltats());
        }
        List<Double> sorted = new ArrayList<>(deltats);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * Newest modification time of the files holding matching traces in {@code [tmin, tmax]}.
     */
    public OptionalLong getNewestMtime(double tmin, double tmax,
                                       Predicate<? super TraceGroup> groupSelector,
                                       Predicate<? super Trace> traceSelector) {
        OptionalLong newest = OptionalLong.empty();
        for (TimeBucket bucket : buckets.values()) {
            if (!bucket.isRelevant(tmin, tmax, groupSelector)) continue;
            OptionalLong mtime = bucket.getNewestMtime(tmin, tmax, groupSelector, traceSelector);
            if (mtime.isPresent() && (newest.isEmpty() || mtime.getAsLong() > newest.getAsLong())) {
                newest = mtime;
            }
        }
        return newest;
    }

    /**
     * Newest modification time over the whole pile.
     */
    public OptionalLong getNewestMtime() {
        if (!hasSpan()) return OptionalLong.empty();
        return getNewestMtime(getTmin(), getTmax(), null, null);
    }

    public void forEachTrace(boolean loadData, Predicate<? super TraceGroup> groupSelector,
                             Predicate<? super Trace> traceSelector,
                             BiConsumer<TraceFile, Trace> visitor) throws IOException {
        for (TimeBucket bucket : List.copyOf(buckets.values())) {
            if (groupSelector != null && !groupSelector.test(bucket)) continue;
            bucket.forEachTrace(loadData, groupSelector, traceSelector, visitor);
        }
    }

    public Iterator<TraceFile> iterFiles() {
        return buckets.values().stream()
            .flatMap(bucket -> bucket.getFiles().stream())
            .iterator();
    }

    public List<TraceFile> getFiles() {
        List<TraceFile> files = new ArrayList<>();
        iterFiles().forEachRemaining(files::add);
        return files;
    }

    /**
     * Reload files changed on disk. Files whose start moved to another month change bucket.
     *
     * <p>Files failing to reload keep their previous state. The others are still
     * re-dispatched and the pile rebuilt before the first failure is rethrown.</p>
     *
     * @return true if any file was reloaded
     * @throws IOException the first reload failure, with later ones suppressed
     */
    public boolean reloadModified() throws IOException {
        boolean modified = false;
        IOException failure = null;
        for (TimeBucket bucket : List.copyOf(buckets.values())) {
            try {
                modified |= bucket.reloadModified();
            } catch (IOException e) {
                // the bucket may have reloaded some of its files before failing
                modified = true;
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (!modified) return false;

        List<TraceFile> moved = new ArrayList<>();
        for (TimeBucket bucket : buckets.values()) {
            for (TraceFile file : bucket.getFiles()) {
                if (!file.hasSpan() || !dispatchKey(file).equals(bucket.getKey())) {
                    moved.add(file);
                }
            }
        }
        if (!moved.isEmpty()) {
            LOG.debug("Re-dispatching {} modified file(s)", moved.size());
            detach(moved);
            for (TraceFile file : moved) {
                if (file.hasSpan()) {
                    dispatch(file).addFile(file);
                } else {
                    LOG.warn("Dropping file without traces after reload: {}", file.getSource().describe());
                }
            }
        }

        rebuildFrom(buckets.values());
        notifyListeners(ChangeEvent.MODIFIED);
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    private void detach(List<TraceFile> files) {
        for (TraceFile file : files) {
            TimeBucket bucket = (TimeBucket) file.getParent();
            bucket.removeFile(file);
            if (bucket.getFiles().isEmpty()) {
                buckets.remove(bucket.getKey());
                bucket.setParent(null);
            }
        }
    }

    public Map<TimeKey, TimeBucket> getBuckets() {
        return Collections.unmodifiableMap(buckets);
    }

    public TimeBucket getBucket(TimeKey key) {
        return buckets.get(key);
    }

    Degapper getDegapper() {
        return degapper;
    }

    WindowPolicy getWindowPolicy() {
        return windowPolicy;
    }

    @Override
    public String toString() {
        return "Pile\n"
            + "number of subpiles: " + buckets.size() + "\n"
            + describeContent();
    }
}
