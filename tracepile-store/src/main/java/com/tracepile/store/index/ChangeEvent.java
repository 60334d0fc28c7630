package com.tracepile.store.index;

/**
 * Structural change reported to pile listeners.
 */
public enum ChangeEvent {
    ADD("add"),
    REMOVE("remove"),
    UPDATE("update"),
    FULLUPDATE("fullupdate"),
    MODIFIED("modified");

    private final String tag;

    ChangeEvent(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
