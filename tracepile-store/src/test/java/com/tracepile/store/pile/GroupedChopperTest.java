package com.tracepile.store.pile;

import com.tracepile.core.model.Trace;
import com.tracepile.store.file.TraceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static com.tracepile.store.TraceFixtures.trace;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GroupedChopper.
 */
class GroupedChopperTest {

    private TracePile pile;

    @BeforeEach
    void setUp() {
        pile = new TracePile();
        pile.addFile(TraceFile.resident(List.of(trace("BFO", 100.0, 100))));
        pile.addFile(TraceFile.resident(List.of(trace("APE", 100.0, 100))));
        pile.addFile(TraceFile.resident(List.of(trace("APE", 500.0, 10), trace("XYZ", 500.0, 10))));
    }

    @Test
    @DisplayName("Should run the windows of each key in key order")
    void windowsPerKey() {
        // Given
        GroupedChopper<String> chopper = pile.chopperGrouped(Trace::station,
            ChopRequest.window(100.0, 200.0).tinc(50.0));

        // When
        List<String> keys = new ArrayList<>();
        List<List<Trace>> windows = new ArrayList<>();
        while (chopper.hasNext()) {
            windows.add(chopper.next());
            keys.add(chopper.getCurrentKey());
        }

        // Then: XYZ has no data in the range, its windows are empty
        assertEquals(List.of("APE", "APE", "BFO", "BFO", "XYZ", "XYZ"), keys);
        for (int i = 0; i < 4; i++) {
            List<Trace> window = windows.get(i);
            assertEquals(1, window.size());
            assertEquals(keys.get(i), window.get(0).station());
        }
        assertTrue(windows.get(4).isEmpty());
        assertTrue(windows.get(5).isEmpty());
        assertThrows(NoSuchElementException.class, chopper::next);
    }

    @Test
    @DisplayName("Should combine keys with the outer trace selector")
    void outerSelector() {
        GroupedChopper<String> chopper = pile.chopperGrouped(Trace::station,
            ChopRequest.all().traceSelector(t -> !t.station().equals("BFO")));

        List<String> stations = new ArrayList<>();
        while (chopper.hasNext()) {
            for (Trace trace : chopper.next()) {
                stations.add(trace.station());
            }
        }
        chopper.close();

        assertFalse(stations.contains("BFO"));
        assertTrue(stations.contains("APE"));
        assertTrue(stations.contains("XYZ"));
    }
}
