package com.tracepile.store.pile;

import com.tracepile.core.model.FillMethod;
import com.tracepile.core.model.Trace;
import com.tracepile.store.file.TraceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy sequence of time windows over a pile.
 *
 * <p>Window {@code i} spans {@code [tmin + i*tinc, min(tmin + (i+1)*tinc, tmax)]}; each
 * window's traces are collected with {@code tpad} extra on both sides. Nothing is read
 * until {@link #hasNext()} is called.</p>
 *
 * <p>Files whose data a window used are retained under the request's accessor id and
 * stay retained while following windows keep using them. When the sequence is exhausted,
 * all of them are released unless {@code keepCurrentFilesOpen} was requested. Callers
 * abandoning the sequence early should {@link #close()} it.</p>
 */
public class WindowChopper implements Iterator<List<Trace>>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WindowChopper.class);

    static final Comparator<Trace> TRACE_ORDER = Comparator
        .comparing(Trace::id)
        .thenComparingDouble(Trace::tmin)
        .thenComparingDouble(Trace::tmax);

    // Window boundaries closer than tinc * EPSILON_FACTOR to tmax end the sequence
    private static final double EPSILON_FACTOR = 1e-6;

    private final TracePile pile;
    private final ChopRequest request;
    private final double tmin;
    private final double tmax;
    private final double tinc;

    private int iwin;
    private List<Trace> pending;
    private Set<TraceFile> lastUsed = Set.of();
    private boolean yielded;
    private boolean finished;

    WindowChopper(TracePile pile, ChopRequest request, double tmin, double tmax, double tinc) {
        this.pile = pile;
        this.request = request;
        this.tmin = tmin;
        this.tmax = tmax;
        this.tinc = tinc;
    }

    /**
     * Sequence without any window.
     */
    static WindowChopper empty(TracePile pile, ChopRequest request) {
        WindowChopper chopper = new WindowChopper(pile, request, 0, 0, 0);
        chopper.finished = true;
        return chopper;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (finished) return false;

        if (yielded) {
            releaseUnused();
            yielded = false;
            iwin++;
        }

        double wmin = tmin + iwin * tinc;
        double wmax = Math.min(tmin + (iwin + 1) * tinc, tmax);
        double eps = tinc * EPSILON_FACTOR;
        if (wmin >= tmax - eps) {
            finish();
            return false;
        }

        double tpad = request.getTpad();
        ChopBatch batch;
        try {
            batch = pile.chop(wmin - tpad, wmax + tpad, request.getGroupSelector(),
                request.getTraceSelector(), request.getSnap(), request.isLoadData());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read data for window " + iwin, e);
        }

        Set<TraceFile> openFiles = pile.openFilesOf(request.getAccessorId());
        for (TraceFile file : batch.usedFiles()) {
            if (!openFiles.contains(file)) {
                file.retain();
                openFiles.add(file);
            }
        }
        lastUsed = batch.usedFiles();

        pending = process(batch.traces(), wmin, wmax);
        return true;
    }

    @Override
    public List<Trace> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        List<Trace> window = pending;
        pending = null;
        yielded = true;
        return window;
    }

    /**
     * Index of the window returned last (or about to be returned).
     */
    public int getWindowIndex() {
        return iwin;
    }

    /**
     * Stop iterating and release files still held for this accessor, unless the
     * request asked to keep them open.
     */
    @Override
    public void close() {
        pending = null;
        if (!finished) {
            finish();
        }
    }

    private List<Trace> process(List<Trace> chopped, double wmin, double wmax) {
        List<Trace> traces = new ArrayList<>(chopped);
        traces.sort(TRACE_ORDER);

        boolean degap = request.isDegap();
        if (degap) {
            traces = pile.getDegapper().degap(traces);
        }

        if (!request.isWantIncomplete()) {
            double tpad = request.getTpad();
            traces = keepComplete(traces, wmin - tpad, wmax + tpad, degap);
        }

        for (Trace trace : traces) {
            trace.setWindow(wmin, wmax);
        }
        return traces;
    }

    /**
     * Keep traces covering {@code [lo, hi)}. With degapping, traces short of an edge by a
     * few samples are padded by repeating their edge samples.
     */
    private List<Trace> keepComplete(List<Trace> traces, double lo, double hi, boolean degap) {
        WindowPolicy policy = pile.getWindowPolicy();
        List<Trace> kept = new ArrayList<>();
        for (Trace trace : traces) {
            double deltat = trace.deltat();
            double exact = policy.exactTolerance() * deltat;
            double fill = policy.fillTolerance() * deltat;
            double emin = trace.tmin() - lo;
            double emax = trace.tmax() + deltat - hi;

            if (Math.abs(emin) <= exact && Math.abs(emax) <= exact) {
                kept.add(trace);
            } else if (degap) {
                boolean minOk = Math.abs(emin) <= exact || (emin > 0 && emin <= fill);
                boolean maxOk = Math.abs(emax) <= exact || (emax < 0 && emax >= -fill);
                if (!minOk || !maxOk) continue;

                trace.extend(lo, hi - deltat, FillMethod.REPEAT);
                if (Math.abs(trace.tmin() - lo) <= exact && Math.abs(trace.tmax() + deltat - hi) <= exact) {
                    kept.add(trace);
                }
            }
        }
        return kept;
    }

    private void releaseUnused() {
        Iterator<TraceFile> it = pile.openFilesOf(request.getAccessorId()).iterator();
        while (it.hasNext()) {
            TraceFile file = it.next();
            if (!lastUsed.contains(file)) {
                file.release();
                it.remove();
            }
        }
    }

    private void finish() {
        finished = true;
        if (yielded) {
            releaseUnused();
            yielded = false;
        }
        if (!request.isKeepCurrentFilesOpen()) {
            Set<TraceFile> openFiles = pile.openFilesOf(request.getAccessorId());
            LOG.debug("Chopper for accessor {} done, releasing {} file(s)", request.getAccessorId(), openFiles.size());
            for (TraceFile file : openFiles) {
                file.release();
            }
            openFiles.clear();
        }
        pile.dropIdleAccessor(request.getAccessorId());
    }
}
