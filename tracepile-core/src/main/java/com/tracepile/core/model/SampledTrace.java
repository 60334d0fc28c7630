package com.tracepile.core.model;

import com.tracepile.core.util.Times;

import java.util.Arrays;

/**
 * Trace backed by an evenly sampled {@code double[]} buffer.
 *
 * Header-only instances keep the sample count but no buffer.
 */
public class SampledTrace implements Trace {

    // Absorbs float noise when converting time offsets to whole samples
    private static final double INDEX_EPSILON = 1e-6;

    private final TraceId id;
    private final double deltat;
    private double tmin;
    private int size;
    private double[] samples;
    private double wmin = Double.NaN;
    private double wmax = Double.NaN;

    public SampledTrace(TraceId id, double tmin, double deltat, double[] samples) {
        this(id, tmin, deltat, samples.length, samples);
    }

    private SampledTrace(TraceId id, double tmin, double deltat, int size, double[] samples) {
        if (deltat <= 0) {
            throw new IllegalArgumentException("deltat must be > 0: " + deltat);
        }
        if (size < 1) {
            throw new IllegalArgumentException("trace must have at least one sample");
        }
        this.id = id;
        this.tmin = tmin;
        this.deltat = deltat;
        this.size = size;
        this.samples = samples;
    }

    /**
     * Create a trace carrying header information only.
     */
    public static SampledTrace header(TraceId id, double tmin, double deltat, int size) {
        return new SampledTrace(id, tmin, deltat, size, null);
    }

    /**
     * Copy of this trace under a different identity. Shares no state with the receiver.
     */
    public SampledTrace withId(TraceId newId) {
        return new SampledTrace(newId, tmin, deltat, size, samples != null ? samples.clone() : null);
    }

    @Override
    public TraceId id() {
        return id;
    }

    @Override
    public double tmin() {
        return tmin;
    }

    @Override
    public double tmax() {
        return tmin + (size - 1) * deltat;
    }

    @Override
    public double deltat() {
        return deltat;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean hasData() {
        return samples != null;
    }

    @Override
    public double[] samples() {
        return samples;
    }

    @Override
    public Trace chop(double tmin, double tmax, SnapPolicy snap) throws NoDataException {
        SnapPolicy policy = snap != null ? snap : SnapPolicy.ROUND;
        int ibeg = Math.max(0, policy.begin().toIndex((tmin - this.tmin) / deltat));
        int iend = Math.min(size, policy.end().toIndex((tmax - this.tmin) / deltat));
        if (ibeg >= iend) {
            throw new NoDataException("No samples of " + id + " in " + Times.format(tmin) + " - " + Times.format(tmax));
        }
        double[] cut = samples != null ? Arrays.copyOfRange(samples, ibeg, iend) : null;
        return new SampledTrace(id, this.tmin + ibeg * deltat, deltat, iend - ibeg, cut);
    }

    @Override
    public void extend(double tmin, double tmax, FillMethod fill) {
        double newTmin = Math.min(tmin, this.tmin);
        double newTmax = Math.max(tmax, tmax());
        int nl = (int) Math.floor((this.tmin - newTmin) / deltat + INDEX_EPSILON);
        int nh = (int) Math.floor((newTmax - tmax()) / deltat + INDEX_EPSILON);
        if (nl == 0 && nh == 0) return;

        if (samples != null) {
            double[] extended = new double[nl + size + nh];
            System.arraycopy(samples, 0, extended, nl, size);
            if (fill == FillMethod.REPEAT) {
                Arrays.fill(extended, 0, nl, samples[0]);
                Arrays.fill(extended, nl + size, extended.length, samples[size - 1]);
            }
            samples = extended;
        }
        this.tmin -= nl * deltat;
        this.size += nl + nh;
    }

    @Override
    public void dropData() {
        samples = null;
    }

    @Override
    public void setWindow(double wmin, double wmax) {
        this.wmin = wmin;
        this.wmax = wmax;
    }

    @Override
    public double wmin() {
        return wmin;
    }

    @Override
    public double wmax() {
        return wmax;
    }

    @Override
    public String toString() {
        return "SampledTrace[" + id + ", " + Times.format(tmin) + " - " + Times.format(tmax())
            + ", deltat=" + deltat + ", n=" + size + (samples == null ? ", header-only" : "") + "]";
    }
}
