package com.tracepile.store.file;

import com.tracepile.core.model.Trace;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Traces which already live in memory and have no backing file.
 */
public class ResidentTraceSource implements TraceSource {

    private static final AtomicLong COUNTER = new AtomicLong();

    private final List<Trace> traces;
    private final long createdAt;
    private final String name;

    public ResidentTraceSource(List<? extends Trace> traces) {
        this.traces = List.copyOf(traces);
        this.createdAt = System.currentTimeMillis();
        this.name = "memory:" + COUNTER.incrementAndGet();
    }

    @Override
    public List<Trace> loadHeaders() {
        return traces;
    }

    @Override
    public List<Trace> loadData() {
        return traces;
    }

    @Override
    public long currentMtime() {
        return createdAt;
    }

    @Override
    public boolean isResident() {
        return true;
    }

    @Override
    public Path getPath() {
        return null;
    }

    @Override
    public String getFormat() {
        return null;
    }

    @Override
    public String describe() {
        return name;
    }
}
