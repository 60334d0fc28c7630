package com.tracepile.store.file;

import com.tracepile.core.io.FileLoadException;
import com.tracepile.core.model.SnapPolicy;
import com.tracepile.core.model.Trace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Set;

import static com.tracepile.store.TraceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TraceFile.
 */
class TraceFileTest {

    @TempDir
    Path tempDir;

    private Path path;
    private TraceFile file;

    @BeforeEach
    void setUp() throws IOException {
        path = writeFile(tempDir, "a.txt", 1_000_000L, trace("APE", 100.0, 100), trace("BFO", 150.0, 10));
        file = open(path);
    }

    @Nested
    @DisplayName("Headers")
    class HeaderTests {

        @Test
        @DisplayName("Should index headers without loading data")
        void indexesHeaders() {
            assertFalse(file.isDataLoaded());
            assertEquals(100.0, file.getTmin());
            assertEquals(199.0, file.getTmax());
            assertEquals(Set.of("APE", "BFO"), file.getStations());
            assertEquals(1_000_000L, file.getMtime());
            assertEquals(Set.of(1.0), file.getDeltats());
        }

        @Test
        @DisplayName("Should gather keys of selected traces")
        void gathersKeys() {
            Set<String> stations = file.gatherKeys(Trace::station, t -> t.tmin() > 120.0);

            assertEquals(Set.of("BFO"), stations);
        }
    }

    @Nested
    @DisplayName("Retain and release")
    class RetainReleaseTests {

        @Test
        @DisplayName("Retaining unloaded data is a usage error")
        void retainUnloadedFails() {
            assertThrows(IllegalStateException.class, () -> file.retain());
        }

        @Test
        @DisplayName("The last release drops the data")
        void lastReleaseDropsData() throws IOException {
            file.loadData(false);
            file.retain();
            file.retain();

            file.release();
            assertTrue(file.isDataLoaded());
            assertEquals(1, file.getUseCount());

            file.release();
            assertFalse(file.isDataLoaded());
            assertEquals(0, file.getUseCount());
            assertTrue(file.getTraces().stream().noneMatch(Trace::hasData));
        }

        @Test
        @DisplayName("Releasing a file nobody holds is tolerated")
        void releaseWithoutRetain() {
            file.release();

            assertEquals(0, file.getUseCount());
        }

        @Test
        @DisplayName("In-memory files keep their data")
        void residentKeepsData() {
            TraceFile resident = TraceFile.resident(List.of(trace("APE", 0.0, 10)));

            resident.retain();
            resident.release();

            assertTrue(resident.isDataLoaded());
            assertTrue(resident.getTraces().get(0).hasData());
            assertThrows(IllegalStateException.class, resident::toCachedFile);
        }
    }

    @Nested
    @DisplayName("Chop")
    class ChopTests {

        @Test
        @DisplayName("Should chop selected traces and report data use")
        void chopsSelected() throws IOException {
            ChopResult result = file.chop(120.0, 140.0, t -> t.station().equals("APE"), SnapPolicy.ROUND, true);

            assertTrue(result.used());
            assertTrue(file.isDataLoaded());
            assertEquals(1, result.traces().size());
            Trace chopped = result.traces().get(0);
            assertEquals(120.0, chopped.tmin());
            assertEquals(20, chopped.size());
            assertEquals(20.0, chopped.samples()[0]);
        }

        @Test
        @DisplayName("Should skip traces without samples in the window")
        void skipsEmptyTraces() throws IOException {
            ChopResult result = file.chop(170.0, 190.0, null, SnapPolicy.ROUND, true);

            assertEquals(1, result.traces().size());
            assertEquals("APE", result.traces().get(0).station());
        }

        @Test
        @DisplayName("Should not load data when chopping headers only")
        void chopsHeaders() throws IOException {
            ChopResult result = file.chop(100.0, 200.0, null, SnapPolicy.ROUND, false);

            assertFalse(result.used());
            assertFalse(file.isDataLoaded());
            assertEquals(2, result.traces().size());
        }

        @Test
        @DisplayName("Should report nothing when no trace is selected")
        void nothingSelected() throws IOException {
            ChopResult result = file.chop(100.0, 200.0, t -> false, SnapPolicy.ROUND, true);

            assertSame(ChopResult.EMPTY, result);
            assertFalse(file.isDataLoaded());
        }
    }

    @Nested
    @DisplayName("Reload")
    class ReloadTests {

        @Test
        @DisplayName("Unchanged files are not reloaded")
        void unchangedNotReloaded() throws IOException {
            assertFalse(file.reloadIfModified());
        }

        @Test
        @DisplayName("Changed files get fresh headers")
        void changedReloaded() throws IOException {
            writeFile(tempDir, "a.txt", 2_000_000L, trace("XYZ", 500.0, 10));

            assertTrue(file.reloadIfModified());
            assertEquals(Set.of("XYZ"), file.getStations());
            assertEquals(500.0, file.getTmin());
            assertEquals(2_000_000L, file.getMtime());
            assertFalse(file.isDataLoaded());
        }

        @Test
        @DisplayName("Loaded files stay loaded after a reload")
        void loadedStaysLoaded() throws IOException {
            file.loadData(false);
            file.retain();
            writeFile(tempDir, "a.txt", trace("APE", 100.0, 5));
            Files.setLastModifiedTime(path, FileTime.fromMillis(3_000_000L));

            assertTrue(file.reloadIfModified());
            assertTrue(file.isDataLoaded());
            assertEquals(104.0, file.getTmax());
            assertTrue(file.getTraces().get(0).hasData());
        }

        @Test
        @DisplayName("A failed reload keeps the previous state and is retried")
        void failedReloadKeepsState() throws IOException {
            // Given
            Files.writeString(path, "not a trace file\n");
            Files.setLastModifiedTime(path, FileTime.fromMillis(4_000_000L));

            // When / Then
            assertThrows(FileLoadException.class, () -> file.reloadIfModified());
            assertEquals(Set.of("APE", "BFO"), file.getStations());
            assertEquals(1_000_000L, file.getMtime());
            assertThrows(FileLoadException.class, () -> file.reloadIfModified());
        }
    }

    @Test
    @DisplayName("Adding traces to a file on disk is rejected")
    void addTracesRequiresResident() {
        assertThrows(IllegalStateException.class, () -> file.addTraces(List.of(trace("APE", 0.0, 1))));
    }

    @Test
    @DisplayName("Summary names the file")
    void summary() {
        String summary = file.toString();

        assertTrue(summary.startsWith("TraceFile"));
        assertTrue(summary.contains(path.toString()));
        assertTrue(summary.contains("number of traces: 2"));
    }
}
