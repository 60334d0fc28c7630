package com.tracepile.store.pile;

/**
 * Tolerances for deciding whether a chopped trace fills its window.
 *
 * @param exactTolerance largest edge mismatch, in sample intervals, still counted as complete
 * @param fillTolerance  largest edge shortfall, in sample intervals, repaired by repeating edge samples
 *                       (only when degapping)
 */
public record WindowPolicy(double exactTolerance, double fillTolerance) {

    public static final WindowPolicy DEFAULT = new WindowPolicy(0.5, 5.0);

    public WindowPolicy {
        if (exactTolerance < 0 || fillTolerance < 0) {
            throw new IllegalArgumentException("tolerances must be >= 0");
        }
    }
}
