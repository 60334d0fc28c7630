package com.tracepile.core.model;

/**
 * Thrown when a chop window does not contain any sample of a trace.
 */
public class NoDataException extends Exception {

    public NoDataException(String message) {
        super(message);
    }
}
