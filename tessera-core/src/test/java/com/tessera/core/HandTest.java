package com.tessera.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HandTest {

    @Test
    void fullHandHoldsEveryPlayableMask() {
        Hand hand = Hand.full(2);

        assertEquals(126, hand.size());
        assertEquals(63, hand.masks().length);
        assertEquals(1, hand.masks()[0]);
        assertEquals(63, hand.masks()[62]);
        assertEquals(2, hand.count(0x2A));
    }

    @Test
    void withdrawingLeavesOriginalUntouched() {
        Hand hand = Hand.full(1);
        Hand smaller = hand.without(0x09);

        assertTrue(hand.contains(0x09));
        assertFalse(smaller.contains(0x09));
        assertEquals(62, smaller.size());
        assertEquals(62, smaller.masks().length);
        assertThrows(IllegalArgumentException.class, () -> smaller.without(0x09));
    }

    @Test
    void countsRoundTripAndDefineEquality() {
        int[] counts = new int[64];
        counts[5] = 3;
        counts[63] = 1;
        Hand hand = Hand.ofCounts(counts);
        counts[5] = 0;

        assertEquals(4, hand.size());
        assertArrayEquals(new int[] {5, 63}, hand.masks());
        assertEquals(hand, Hand.ofCounts(hand.toCounts()));
        assertEquals(hand.hashCode(), Hand.ofCounts(hand.toCounts()).hashCode());
        assertTrue(Hand.ofCounts(new int[64]).isEmpty());
    }

    @Test
    void rejectsMalformedCounts() {
        int[] withZeroMask = new int[64];
        withZeroMask[0] = 1;
        int[] negative = new int[64];
        negative[3] = -1;

        assertThrows(IllegalArgumentException.class, () -> Hand.ofCounts(new int[10]));
        assertThrows(IllegalArgumentException.class, () -> Hand.ofCounts(withZeroMask));
        assertThrows(IllegalArgumentException.class, () -> Hand.ofCounts(negative));
        assertThrows(IllegalArgumentException.class, () -> Hand.full(0));
        assertThrows(IllegalArgumentException.class, () -> Hand.full(1).count(0));
    }
}
