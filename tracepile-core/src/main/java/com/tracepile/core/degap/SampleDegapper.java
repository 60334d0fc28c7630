package com.tracepile.core.degap;

import com.tracepile.core.model.SampledTrace;
import com.tracepile.core.model.Trace;
import com.tracepile.core.model.TraceId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Degapper for evenly sampled traces.
 *
 * <p>Consecutive traces with equal identity and sample interval are joined when the
 * second one starts at most {@code maxGap} samples after the end of the first one.
 * Gaps are filled by linear interpolation. Overlaps are resolved in favour of the
 * second trace; a trace lying completely inside its predecessor is dropped.
 * Traces on misaligned sample grids are never joined.</p>
 */
public class SampleDegapper implements Degapper {

    public static final int DEFAULT_MAX_GAP = 5;

    // Largest sub-sample offset (fraction of deltat) still treated as the same grid
    private static final double GRID_TOLERANCE = 0.05;

    private final int maxGap;

    public SampleDegapper() {
        this(DEFAULT_MAX_GAP);
    }

    public SampleDegapper(int maxGap) {
        if (maxGap < 1) {
            throw new IllegalArgumentException("maxGap must be >= 1: " + maxGap);
        }
        this.maxGap = maxGap;
    }

    public int getMaxGap() {
        return maxGap;
    }

    @Override
    public List<Trace> degap(List<Trace> ordered) {
        List<Trace> out = new ArrayList<>();
        Run current = null;

        for (Trace next : ordered) {
            if (current != null && current.absorb(next, maxGap)) {
                continue;
            }
            if (current != null) {
                out.add(current.toTrace());
            }
            current = new Run(next);
        }
        if (current != null) {
            out.add(current.toTrace());
        }
        return out;
    }

    /**
     * Growing contiguous run of samples.
     */
    private static final class Run {
        private final Trace first;
        private final TraceId id;
        private final double deltat;
        private final double tmin;
        private int size;
        private double[] samples;
        private boolean merged;

        Run(Trace trace) {
            this.first = trace;
            this.id = trace.id();
            this.deltat = trace.deltat();
            this.tmin = trace.tmin();
            this.size = trace.size();
            this.samples = trace.hasData() ? trace.samples().clone() : null;
        }

        double tmax() {
            return tmin + (size - 1) * deltat;
        }

        boolean absorb(Trace next, int maxGap) {
            if (!id.equals(next.id()) || deltat != next.deltat() || (samples != null) != next.hasData()) {
                return false;
            }

            double dist = (next.tmin() - tmax()) / deltat;
            long idist = Math.round(dist);
            if (Math.abs(dist - idist) > GRID_TOLERANCE) {
                return false;
            }

            if (idist >= 1 && idist <= maxGap) {
                int fill = (int) idist - 1;
                if (samples != null) {
                    double[] b = next.samples();
                    double[] joined = Arrays.copyOf(samples, size + fill + b.length);
                    double left = samples[size - 1];
                    for (int i = 1; i <= fill; i++) {
                        joined[size + i - 1] = left + (b[0] - left) * i / idist;
                    }
                    System.arraycopy(b, 0, joined, size + fill, b.length);
                    samples = joined;
                }
                size += fill + next.size();
                merged = true;
                return true;
            }

            if (idist <= 0) {
                if (next.tmax() > tmax()) {
                    int keep = size - (int) (1 - idist);
                    if (samples != null) {
                        double[] b = next.samples();
                        double[] joined = Arrays.copyOf(samples, keep + b.length);
                        System.arraycopy(b, 0, joined, keep, b.length);
                        samples = joined;
                    }
                    size = keep + next.size();
                }
                merged = true;
                return true;
            }

            return false;
        }

        Trace toTrace() {
            if (!merged) {
                return first;
            }
            return samples != null
                ? new SampledTrace(id, tmin, deltat, samples)
                : SampledTrace.header(id, tmin, deltat, size);
        }
    }
}
