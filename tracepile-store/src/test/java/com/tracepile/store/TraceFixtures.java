package com.tracepile.store;

import com.tracepile.core.io.TextTraceFormat;
import com.tracepile.core.model.SampledTrace;
import com.tracepile.core.model.TraceId;
import com.tracepile.store.file.TraceFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

/**
 * Builders for traces and text trace files used across the store tests.
 */
public final class TraceFixtures {

    public static final double JAN_2001 = 978307200.0;
    public static final double FEB_2001 = 980985600.0;
    public static final double MAR_2001 = 983404800.0;

    public static final TextTraceFormat TEXT = new TextTraceFormat();

    private TraceFixtures() {
    }

    public static TraceId id(String station) {
        return new TraceId("GE", station, "", "BHZ");
    }

    /**
     * Trace sampled once per second, sample i holding value i.
     */
    public static SampledTrace trace(String station, double tmin, int n) {
        double[] samples = new double[n];
        for (int i = 0; i < n; i++) {
            samples[i] = i;
        }
        return new SampledTrace(id(station), tmin, 1.0, samples);
    }

    public static Path writeFile(Path dir, String name, SampledTrace... traces) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(name).toAbsolutePath();
        TextTraceFormat.write(file, List.of(traces));
        return file;
    }

    public static Path writeFile(Path dir, String name, long mtime, SampledTrace... traces) throws IOException {
        Path file = writeFile(dir, name, traces);
        Files.setLastModifiedTime(file, FileTime.fromMillis(mtime));
        return file;
    }

    public static TraceFile open(Path file) throws IOException {
        return TraceFile.open(file, TextTraceFormat.NAME, TEXT, null, null);
    }
}
