package com.tracepile.store.pile;

import com.tracepile.store.index.ChangeEvent;

/**
 * Receives structural change notifications from a {@link TracePile}.
 * Piles hold listeners weakly: keep a reference to the listener as long as it should be notified.
 */
@FunctionalInterface
public interface PileListener {

    void pileChanged(ChangeEvent event);
}
