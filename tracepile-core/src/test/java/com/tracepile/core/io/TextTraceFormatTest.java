package com.tracepile.core.io;

import com.tracepile.core.model.SampledTrace;
import com.tracepile.core.model.Trace;
import com.tracepile.core.model.TraceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TextTraceFormat.
 */
class TextTraceFormatTest {

    @TempDir
    Path tempDir;

    private final TextTraceFormat format = new TextTraceFormat();

    @Nested
    @DisplayName("Reading")
    class ReadingTests {

        @Test
        @DisplayName("Should read headers without samples")
        void readsHeaders() throws IOException {
            // Given
            Path file = tempDir.resolve("a.txt");
            Files.writeString(file, "# comment\nTRACE GE APE -- BHZ 100.0 0.5 3\n1.0\n2.0\n3.0\n");

            // When
            List<Trace> traces = format.load(file, false, null);

            // Then
            assertEquals(1, traces.size());
            Trace trace = traces.get(0);
            assertEquals(new TraceId("GE", "APE", "", "BHZ"), trace.id());
            assertEquals(101.0, trace.tmax());
            assertFalse(trace.hasData());
        }

        @Test
        @DisplayName("Should read samples and apply substitutions")
        void readsDataWithSubstitutions() throws IOException {
            Path file = tempDir.resolve("b.txt");
            Files.writeString(file, "TRACE GE APE -- BHZ 100.0 1.0 2\n5.0\n6.0\n");

            List<Trace> traces = format.load(file, true, Map.of("station", "XYZ"));

            Trace trace = traces.get(0);
            assertEquals("XYZ", trace.station());
            assertArrayEquals(new double[]{5.0, 6.0}, trace.samples());
        }

        @Test
        @DisplayName("Should report malformed files as load failures")
        void reportsMalformed() throws IOException {
            Path file = tempDir.resolve("bad.txt");
            Files.writeString(file, "not a trace file\n");

            FileLoadException e = assertThrows(FileLoadException.class, () -> format.load(file, false, null));
            assertEquals(file, e.getPath());
        }

        @Test
        @DisplayName("Should report truncated blocks")
        void reportsTruncated() throws IOException {
            Path file = tempDir.resolve("short.txt");
            Files.writeString(file, "TRACE GE APE -- BHZ 100.0 1.0 5\n1.0\n");

            assertThrows(FileLoadException.class, () -> format.load(file, true, null));
        }
    }

    @Test
    @DisplayName("Written files read back with empty codes intact")
    void writesReadableFiles() throws IOException {
        Path file = tempDir.resolve("out.txt");
        SampledTrace trace = new SampledTrace(new TraceId("", "STA", "", "HHZ"), 50.0, 0.01, new double[]{1.5, 2.5});

        TextTraceFormat.write(file, List.of(trace));
        List<Trace> back = format.load(file, true, null);

        assertEquals(trace.id(), back.get(0).id());
        assertEquals(50.0, back.get(0).tmin());
        assertArrayEquals(trace.samples(), back.get(0).samples());
    }

    @Test
    @DisplayName("Registry rejects unknown formats")
    void registryRejectsUnknown() {
        TraceFormatRegistry registry = TraceFormatRegistry.withDefaults();

        assertNotNull(registry.get(TextTraceFormat.NAME));
        assertThrows(IllegalArgumentException.class, () -> registry.get("mseed"));
    }
}
