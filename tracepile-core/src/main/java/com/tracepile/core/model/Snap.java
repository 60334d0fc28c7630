package com.tracepile.core.model;

/**
 * Rounding applied when a time offset is converted to a sample index.
 */
public enum Snap {
    ROUND,
    FLOOR,
    CEIL;

    /**
     * Convert a fractional sample index to an integer index.
     */
    public int toIndex(double fractionalIndex) {
        return switch (this) {
            case ROUND -> (int) Math.round(fractionalIndex);
            case FLOOR -> (int) Math.floor(fractionalIndex);
            case CEIL -> (int) Math.ceil(fractionalIndex);
        };
    }
}
