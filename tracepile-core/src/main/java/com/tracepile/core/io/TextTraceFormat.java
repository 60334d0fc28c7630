package com.tracepile.core.io;

import com.tracepile.core.model.SampledTrace;
import com.tracepile.core.model.Trace;
import com.tracepile.core.model.TraceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain text trace format.
 *
 * File structure (one or more blocks):
 * <pre>
 * TRACE GE APE -- BHZ 978307200.0 0.01 3
 * 12.0
 * 13.5
 * 11.0
 * </pre>
 * Fields: network, station, location, channel ("--" for an empty code), tmin (epoch seconds),
 * deltat (seconds), sample count. Blank lines and lines starting with '#' are ignored.
 */
public class TextTraceFormat implements TraceLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TextTraceFormat.class);

    public static final String NAME = "text";
    private static final String BLOCK_TAG = "TRACE";
    private static final String EMPTY_CODE = "--";

    @Override
    public List<Trace> load(Path path, boolean wantData, Map<String, String> substitutions) throws IOException {
        List<Trace> traces = new ArrayList<>();
        int lineNo = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;

                String[] parts = line.split("\\s+");
                if (parts.length != 8 || !BLOCK_TAG.equals(parts[0])) {
                    throw new FileLoadException(path, "expected TRACE header at line " + lineNo);
                }

                TraceId id;
                double tmin;
                double deltat;
                int n;
                try {
                    id = applySubstitutions(new TraceId(decodeCode(parts[1]), decodeCode(parts[2]),
                        decodeCode(parts[3]), decodeCode(parts[4])), substitutions);
                    tmin = Double.parseDouble(parts[5]);
                    deltat = Double.parseDouble(parts[6]);
                    n = Integer.parseInt(parts[7]);
                } catch (NumberFormatException e) {
                    throw new FileLoadException(path, "bad TRACE header at line " + lineNo, e);
                }
                if (n < 1 || deltat <= 0) {
                    throw new FileLoadException(path, "bad sample count or interval at line " + lineNo);
                }

                double[] samples = wantData ? new double[n] : null;
                for (int i = 0; i < n; i++) {
                    String value = reader.readLine();
                    lineNo++;
                    if (value == null) {
                        throw new FileLoadException(path, "unexpected end of file in trace " + id);
                    }
                    if (samples != null) {
                        try {
                            samples[i] = Double.parseDouble(value.trim());
                        } catch (NumberFormatException e) {
                            throw new FileLoadException(path, "bad sample value at line " + lineNo, e);
                        }
                    }
                }

                traces.add(samples != null
                    ? new SampledTrace(id, tmin, deltat, samples)
                    : SampledTrace.header(id, tmin, deltat, n));
            }
        }

        LOG.debug("Read {} trace(s) from {} (data={})", traces.size(), path, wantData);
        return traces;
    }

    /**
     * Write traces in this format. Traces must carry data.
     */
    public static void write(Path path, List<? extends Trace> traces) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (Trace trace : traces) {
                if (!trace.hasData()) {
                    throw new IllegalArgumentException("Cannot write header-only trace " + trace.id());
                }
                TraceId id = trace.id();
                writer.write(String.join(" ", BLOCK_TAG, encodeCode(id.network()), encodeCode(id.station()),
                    encodeCode(id.location()), encodeCode(id.channel()),
                    Double.toString(trace.tmin()), Double.toString(trace.deltat()),
                    Integer.toString(trace.size())));
                writer.newLine();
                for (double v : trace.samples()) {
                    writer.write(Double.toString(v));
                    writer.newLine();
                }
            }
        }
    }

    private static TraceId applySubstitutions(TraceId id, Map<String, String> substitutions) {
        if (substitutions == null || substitutions.isEmpty()) return id;
        return new TraceId(
            substitutions.getOrDefault("network", id.network()),
            substitutions.getOrDefault("station", id.station()),
            substitutions.getOrDefault("location", id.location()),
            substitutions.getOrDefault("channel", id.channel()));
    }

    private static String decodeCode(String code) {
        return EMPTY_CODE.equals(code) ? "" : code;
    }

    private static String encodeCode(String code) {
        return code.isEmpty() ? EMPTY_CODE : code;
    }
}
