package org.dxworks.cobolsim.runtime.cics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScreenBufferTest {

    @Test
    void writesAndReadsAtOneBasedPositions() {
        ScreenBuffer screen = new ScreenBuffer();

        screen.write(2, 3, "HELLO");

        assertEquals("HELLO", screen.read(2, 3, 5));
        assertEquals("  HELLO", screen.rowText(2).substring(0, 7));
        assertEquals(ScreenBuffer.ROWS, screen.lines().size());
    }

    @Test
    void textWrapsOntoTheNextRowAndStopsAtTheEnd() {
        ScreenBuffer screen = new ScreenBuffer();

        screen.write(1, 79, "ABCD");
        screen.write(24, 79, "XYZ");

        assertEquals("AB", screen.read(1, 79, 2));
        assertEquals("CD", screen.read(2, 1, 2));
        assertEquals("XY", screen.read(24, 79, 5));
    }

    @Test
    void snapshotIsDetachedFromLaterWrites() {
        ScreenBuffer screen = new ScreenBuffer();
        screen.write(1, 1, "A", 1);

        List<ScreenChar> snapshot = screen.snapshot();
        screen.clear();

        assertEquals('A', snapshot.get(0).ch);
        assertEquals(1, snapshot.get(0).attr);
        assertEquals(' ', screen.snapshot().get(0).ch);
    }

    @Test
    void positionsOutsideTheScreenAreRejected() {
        ScreenBuffer screen = new ScreenBuffer();

        assertThrows(IllegalArgumentException.class, () -> screen.write(0, 1, "X"));
        assertThrows(IllegalArgumentException.class, () -> screen.read(25, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> screen.write(1, 81, "X"));
        assertFalse(ScreenBuffer.contains(30, 1));
        assertFalse(ScreenBuffer.contains(1, 0));
        assertTrue(ScreenBuffer.contains(24, 80));
    }
}
