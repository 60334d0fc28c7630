package com.tracepile.store.pile;

import com.tracepile.core.model.SnapPolicy;
import com.tracepile.core.model.Trace;
import com.tracepile.store.index.TraceGroup;

import java.util.function.Predicate;

/**
 * Parameters of a windowed iteration over a {@link TracePile}.
 *
 * <pre>
 * pile.chopper(ChopRequest.window(t0, t1).tinc(3600.0).tpad(10).wantIncomplete(false))
 * </pre>
 */
public class ChopRequest {

    private Double tmin;                                 // null = pile start + tpad
    private Double tmax;                                 // null = pile end - tpad
    private Double tinc;                                 // null = one window over the whole range
    private double tpad;
    private Predicate<? super TraceGroup> groupSelector;
    private Predicate<? super Trace> traceSelector;
    private boolean wantIncomplete = true;
    private boolean degap = true;
    private boolean keepCurrentFilesOpen;
    private String accessorId;
    private SnapPolicy snap = SnapPolicy.ROUND;
    private boolean loadData = true;

    /**
     * Request covering the whole pile in one window.
     */
    public static ChopRequest all() {
        return new ChopRequest();
    }

    public static ChopRequest window(double tmin, double tmax) {
        return new ChopRequest().tmin(tmin).tmax(tmax);
    }

    public ChopRequest copy() {
        ChopRequest c = new ChopRequest();
        c.tmin = tmin;
        c.tmax = tmax;
        c.tinc = tinc;
        c.tpad = tpad;
        c.groupSelector = groupSelector;
        c.traceSelector = traceSelector;
        c.wantIncomplete = wantIncomplete;
        c.degap = degap;
        c.keepCurrentFilesOpen = keepCurrentFilesOpen;
        c.accessorId = accessorId;
        c.snap = snap;
        c.loadData = loadData;
        return c;
    }

    public ChopRequest tmin(Double tmin) {
        this.tmin = tmin;
        return this;
    }

    public ChopRequest tmax(Double tmax) {
        this.tmax = tmax;
        return this;
    }

    public ChopRequest tinc(Double tinc) {
        this.tinc = tinc;
        return this;
    }

    public ChopRequest tpad(double tpad) {
        this.tpad = tpad;
        return this;
    }

    public ChopRequest groupSelector(Predicate<? super TraceGroup> groupSelector) {
        this.groupSelector = groupSelector;
        return this;
    }

    public ChopRequest traceSelector(Predicate<? super Trace> traceSelector) {
        this.traceSelector = traceSelector;
        return this;
    }

    public ChopRequest wantIncomplete(boolean wantIncomplete) {
        this.wantIncomplete = wantIncomplete;
        return this;
    }

    public ChopRequest degap(boolean degap) {
        this.degap = degap;
        return this;
    }

    public ChopRequest keepCurrentFilesOpen(boolean keepCurrentFilesOpen) {
        this.keepCurrentFilesOpen = keepCurrentFilesOpen;
        return this;
    }

    public ChopRequest accessorId(String accessorId) {
        this.accessorId = accessorId;
        return this;
    }

    public ChopRequest snap(SnapPolicy snap) {
        this.snap = snap;
        return this;
    }

    public ChopRequest loadData(boolean loadData) {
        this.loadData = loadData;
        return this;
    }

    public Double getTmin() {
        return tmin;
    }

    public Double getTmax() {
        return tmax;
    }

    public Double getTinc() {
        return tinc;
    }

    public double getTpad() {
        return tpad;
    }

    public Predicate<? super TraceGroup> getGroupSelector() {
        return groupSelector;
    }

    public Predicate<? super Trace> getTraceSelector() {
        return traceSelector;
    }

    public boolean isWantIncomplete() {
        return wantIncomplete;
    }

    public boolean isDegap() {
        return degap;
    }

    public boolean isKeepCurrentFilesOpen() {
        return keepCurrentFilesOpen;
    }

    public String getAccessorId() {
        return accessorId;
    }

    public SnapPolicy getSnap() {
        return snap;
    }

    public boolean isLoadData() {
        return loadData;
    }
}
