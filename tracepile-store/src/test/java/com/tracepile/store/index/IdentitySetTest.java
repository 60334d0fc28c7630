package com.tracepile.store.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IdentitySet.
 */
class IdentitySetTest {

    @Test
    @DisplayName("Should start compact and empty")
    void startsCompact() {
        IdentitySet<String> set = new IdentitySet<>();

        assertTrue(set.isEmpty());
        assertTrue(set.isCompact());
    }

    @Test
    @DisplayName("Should expand on add and answer membership")
    void expandsOnAdd() {
        IdentitySet<String> set = new IdentitySet<>();

        set.add("APE");
        set.add("BFO");
        set.add("APE");

        assertFalse(set.isCompact());
        assertEquals(2, set.size());
        assertTrue(set.contains("BFO"));
        assertFalse(set.contains("XXX"));
    }

    @Test
    @DisplayName("Should share equal compact sets")
    void sharesCompactSets() {
        IdentitySet<String> a = new IdentitySet<>();
        IdentitySet<String> b = new IdentitySet<>();
        a.add("APE");
        a.add("BFO");
        b.add("BFO");
        b.add("APE");

        a.compact();
        b.compact();

        assertTrue(a.isCompact());
        assertEquals(a.asSet(), b.asSet());
    }

    @Test
    @DisplayName("Interner should hand out one instance per distinct set")
    void internerDeduplicates() {
        CompactInterner interner = new CompactInterner();

        Set<String> first = interner.intern(new HashSet<>(Set.of("APE", "BFO")));
        Set<String> second = interner.intern(Set.of("BFO", "APE"));

        assertSame(first, second);
        assertEquals(1, interner.size());
    }

    @Test
    @DisplayName("Should keep large sets mutable")
    void keepsLargeSetsMutable() {
        IdentitySet<Integer> set = new IdentitySet<>();
        for (int i = 0; i < IdentitySet.COMPACT_THRESHOLD; i++) {
            set.add(i);
        }

        set.compact();

        assertFalse(set.isCompact());
        assertEquals(IdentitySet.COMPACT_THRESHOLD, set.size());
    }

    @Test
    @DisplayName("Should keep union semantics across compact and expanded forms")
    void unionAcrossForms() {
        IdentitySet<String> a = new IdentitySet<>();
        a.add("APE");
        a.compact();
        IdentitySet<String> b = new IdentitySet<>();
        b.add("BFO");

        a.addAll(b);

        assertEquals(Set.of("APE", "BFO"), a.asSet());
        assertThrows(UnsupportedOperationException.class, () -> a.asSet().add("X"));
    }
}
