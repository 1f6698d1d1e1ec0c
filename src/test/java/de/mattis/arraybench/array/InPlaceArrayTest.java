package de.mattis.arraybench.array;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InPlaceArrayTest {

    private static long[] contents(InitializableArray a) {
        long[] out = new long[(int) a.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = a.read(i);
        }
        return out;
    }

    @Test
    void shouldStartZeroedAndReportNameAndSize() {
        PairBlockInPlaceArray sec3 = new PairBlockInPlaceArray(6);
        QuadBlockInPlaceArray sec4 = new QuadBlockInPlaceArray(8);
        assertEquals("sec3", sec3.name());
        assertEquals("sec4", sec4.name());
        assertEquals(6, sec3.size());
        assertEquals(8, sec4.size());
        assertArrayEquals(new long[6], contents(sec3));
        assertArrayEquals(new long[8], contents(sec4));
    }

    @Test
    void shouldRejectSizesNotDivisibleByBlockSize() {
        assertThrows(IllegalArgumentException.class, () -> new PairBlockInPlaceArray(7));
        assertThrows(IllegalArgumentException.class, () -> new QuadBlockInPlaceArray(10));
        assertThrows(IllegalArgumentException.class, () -> new QuadBlockInPlaceArray(0));
        assertThrows(IllegalArgumentException.class, () -> new PairBlockInPlaceArray(-2));
        assertThrows(IllegalArgumentException.class, () -> new PairBlockInPlaceArray(3_000_000_000L));
    }

    @Test
    void shouldOverwriteEverythingOnInit() {
        for (InitializableArray a : new InitializableArray[]{new PairBlockInPlaceArray(20), new QuadBlockInPlaceArray(20)}) {
            for (int i = 0; i < 20; i++) {
                a.write(i, 100 + i);
            }
            a.init(-7);
            long[] expected = new long[20];
            Arrays.fill(expected, -7);
            assertArrayEquals(expected, contents(a), a.name());

            a.write(13, 5);
            a.write(2, 6);
            expected[13] = 5;
            expected[2] = 6;
            assertArrayEquals(expected, contents(a), a.name());
        }
    }

    @Test
    void shouldNotMistakeWrittenValuesForChains() {
        // Werte, die wie ausgerichtete Zeiger auf andere Blöcke aussehen
        for (InitializableArray a : new InitializableArray[]{new PairBlockInPlaceArray(16), new QuadBlockInPlaceArray(16)}) {
            a.init(0);
            long[] expected = new long[16];
            for (int i = 15; i >= 0; i--) {
                long value = (15 - i) & ~3L;
                a.write(i, value);
                expected[i] = value;
            }
            assertArrayEquals(expected, contents(a), a.name());

            a.init(8);
            Arrays.fill(expected, 8);
            a.write(0, 4);
            a.write(4, 0);
            a.write(12, 8);
            expected[0] = 4;
            expected[4] = 0;
            expected[12] = 8;
            assertArrayEquals(expected, contents(a), a.name());
        }
    }

    @Test
    void shouldMatchPlainArrayUnderRandomOperations() {
        Random random = new Random(1234);
        for (int round = 0; round < 200; round++) {
            int blocks = 1 + random.nextInt(12);
            InitializableArray[] candidates = {new PairBlockInPlaceArray(2L * blocks), new QuadBlockInPlaceArray(4L * blocks)};
            for (InitializableArray a : candidates) {
                int n = (int) a.size();
                long[] expected = new long[n];
                for (int op = 0; op < 300; op++) {
                    int kind = random.nextInt(3);
                    if (kind == 0) {
                        long v = random.nextInt(9) - 4;
                        a.init(v);
                        Arrays.fill(expected, v);
                    } else if (kind == 1) {
                        int i = random.nextInt(n);
                        assertEquals(expected[i], a.read(i), a.name() + " N=" + n + " round=" + round + " op=" + op);
                    } else {
                        int i = random.nextInt(n);
                        // jeder zweite Wert ist ein gültiger Slot-Index, also ein potenzieller Zeiger
                        long v = random.nextBoolean() ? random.nextInt(n) : random.nextInt(2001) - 1000;
                        a.write(i, v);
                        expected[i] = v;
                    }
                }
                assertArrayEquals(expected, contents(a), a.name() + " N=" + n + " round=" + round);
            }
        }
    }

    @Test
    void shouldBehaveLikePlainArrayOnceAllBlocksAreInitialized() {
        QuadBlockInPlaceArray a = new QuadBlockInPlaceArray(8);
        a.init(3);
        for (int i = 0; i < 8; i++) {
            a.write(i, i * 10L);
        }
        a.write(5, 99);
        assertArrayEquals(new long[]{0, 10, 20, 30, 40, 99, 60, 70}, contents(a));
    }

    @Test
    void shouldMirrorInitValueAndBoundaryIntoLastBlock() {
        QuadBlockInPlaceArray a = new QuadBlockInPlaceArray(16);
        a.init(77);
        assertEquals(77, a.storedInitValue());
        assertEquals(0, a.storedBoundary());

        a.write(0, 1);
        assertEquals(77, a.storedInitValue());
        assertEquals(1, a.storedBoundary());
        assertEquals(1, a.read(0));
        assertEquals(77, a.read(13));
        assertEquals(77, a.read(14));
    }

    @Test
    void shouldInitInConstantTime() {
        PairBlockInPlaceArray a = new PairBlockInPlaceArray(1 << 20);
        long elapsed = a.init(5);
        assertTrue(elapsed >= 0);
        assertEquals(5, a.read(0));
        assertEquals(5, a.read((1 << 20) - 1));
    }
}
