package com.tracepile.core.model;

/**
 * A single contiguous time series.
 *
 * <p>Times are seconds since the epoch (UTC). {@link #tmax()} is the time of the
 * last sample, so a trace covers {@code [tmin, tmax + deltat)}.</p>
 *
 * <p>A trace may be header-only: identity, span and sample interval are known but
 * the sample buffer has not been read (or has been dropped).</p>
 */
public interface Trace {

    TraceId id();

    double tmin();

    double tmax();

    /**
     * Sample interval in seconds.
     */
    double deltat();

    default String network() {
        return id().network();
    }

    default String station() {
        return id().station();
    }

    default String location() {
        return id().location();
    }

    default String channel() {
        return id().channel();
    }

    /**
     * Number of samples covered by this trace.
     */
    int size();

    /**
     * Check if the sample buffer is present.
     */
    boolean hasData();

    /**
     * Get the sample buffer, or null for header-only traces.
     */
    double[] samples();

    /**
     * Cut out the samples falling into {@code [tmin, tmax]}.
     * The receiver is left untouched; the result is an independent copy.
     *
     * @throws NoDataException if no sample falls into the window
     */
    Trace chop(double tmin, double tmax, SnapPolicy snap) throws NoDataException;

    /**
     * Extend this trace in place so it covers at least {@code [tmin, tmax]},
     * padding with whole samples.
     */
    void extend(double tmin, double tmax, FillMethod fill);

    /**
     * Release the sample buffer. Header information stays available.
     */
    void dropData();

    /**
     * Stamp the logical window this trace was produced for.
     */
    void setWindow(double wmin, double wmax);

    /**
     * Start of the stamped window, or NaN if never stamped.
     */
    double wmin();

    /**
     * End of the stamped window, or NaN if never stamped.
     */
    double wmax();
}
