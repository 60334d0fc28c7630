package com.tracepile.core.model;

/**
 * How samples added by {@link Trace#extend} are filled.
 */
public enum FillMethod {
    ZEROS,
    REPEAT
}
