package com.raditha.dictation.similarity;

import net.jqwik.api.*;
import net.jqwik.api.lifecycle.BeforeProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyboardProximity and KeyboardLayout.
 */
class KeyboardProximityTest {

    private KeyboardProximity proximity;

    @BeforeEach
    @BeforeProperty
    void setUp() {
        proximity = new KeyboardProximity();
    }

    @Test
    void testQwertzNeighbours() {
        assertTrue(proximity.isAdjacent('a', 's', KeyboardLayout.QWERTZ));
        assertTrue(proximity.isAdjacent('z', 'u', KeyboardLayout.QWERTZ));
        assertTrue(proximity.isAdjacent('ö', 'ä', KeyboardLayout.QWERTZ));
        assertFalse(proximity.isAdjacent('a', 'p', KeyboardLayout.QWERTZ));
    }

    @Test
    void testQwertyDiffersFromQwertz() {
        assertTrue(proximity.isAdjacent('y', 'u', KeyboardLayout.QWERTY));
        assertFalse(proximity.isAdjacent('z', 'u', KeyboardLayout.QWERTY));
    }

    @Test
    void testAzertyNeighbours() {
        assertTrue(proximity.isAdjacent('a', 'z', KeyboardLayout.AZERTY));
        assertTrue(proximity.isAdjacent('q', 's', KeyboardLayout.AZERTY));
    }

    @Test
    void testAutoChecksAllLayouts() {
        assertTrue(proximity.isAdjacent('z', 'u', KeyboardLayout.AUTO));
        assertTrue(proximity.isAdjacent('y', 'u', KeyboardLayout.AUTO));
        assertTrue(proximity.isAdjacent('y', 'u', null));
    }

    @Test
    void testCaseInsensitiveAndNotSelfAdjacent() {
        assertTrue(proximity.isAdjacent('A', 's', KeyboardLayout.QWERTZ));
        assertFalse(proximity.isAdjacent('a', 'a', KeyboardLayout.QWERTZ));
        assertFalse(proximity.isAdjacent('a', 'A', KeyboardLayout.QWERTZ));
    }

    @Test
    void testProximityCost() {
        assertEquals(KeyboardProximity.ADJACENT_COST, proximity.proximityCost('d', 'f', KeyboardLayout.QWERTZ), 0.001);
        assertEquals(KeyboardProximity.DEFAULT_COST, proximity.proximityCost('d', 'p', KeyboardLayout.QWERTZ), 0.001);
    }

    @Test
    void testLayoutFromString() {
        assertEquals(KeyboardLayout.QWERTY, KeyboardLayout.fromString("qwerty"));
        assertEquals(KeyboardLayout.AZERTY, KeyboardLayout.fromString(" AZERTY "));
        assertEquals(KeyboardLayout.AUTO, KeyboardLayout.fromString(""));
        assertThrows(IllegalArgumentException.class, () -> KeyboardLayout.fromString("dvorak"));
    }

    @Property(tries = 300)
    void adjacencyIsSymmetric(@ForAll("keys") char a, @ForAll("keys") char b,
            @ForAll KeyboardLayout layout) {
        assertEquals(proximity.isAdjacent(a, b, layout), proximity.isAdjacent(b, a, layout));
    }

    @Provide
    Arbitrary<Character> keys() {
        return Arbitraries.chars().with("abcdefghijklmnopqrstuvwxyzäöüß,.-");
    }
}
