package com.tracepile.core.model;

/**
 * Snapping used for the begin and end of a chop window.
 */
public record SnapPolicy(Snap begin, Snap end) {

    public static final SnapPolicy ROUND = new SnapPolicy(Snap.ROUND, Snap.ROUND);

    public SnapPolicy {
        if (begin == null) begin = Snap.ROUND;
        if (end == null) end = Snap.ROUND;
    }
}
