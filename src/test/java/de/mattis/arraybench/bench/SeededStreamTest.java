package de.mattis.arraybench.bench;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeededStreamTest {

    @Test
    void shouldMatchMt19937ReferenceOutputs() {
        SeededStream defaultSeed = new SeededStream(5489);
        assertEquals(3499211612L, defaultSeed.nextRaw());

        SeededStream again = new SeededStream(5489);
        long raw = 0;
        for (int i = 0; i < 10_000; i++) {
            raw = again.nextRaw();
        }
        assertEquals(4123659995L, raw);

        assertEquals(1608637542L, new SeededStream(42).nextRaw());
    }

    @Test
    void shouldReproduceSequenceForSameSeed() {
        SeededStream a = new SeededStream(7);
        SeededStream b = new SeededStream(7);
        for (int i = 0; i < 1_000; i++) {
            assertEquals(a.nextIndex(1_000), b.nextIndex(1_000));
            assertEquals(a.nextValue(), b.nextValue());
        }
        assertNotEquals(new SeededStream(7).nextRaw(), new SeededStream(8).nextRaw());
    }

    @Test
    void shouldStayWithinBounds() {
        SeededStream rng = new SeededStream(123);
        boolean sawMin = false;
        boolean sawMax = false;
        for (int i = 0; i < 200_000; i++) {
            long v = rng.nextValue();
            assertTrue(v >= -1000 && v <= 1000, "value out of range: " + v);
            sawMin |= v == -1000;
            sawMax |= v == 1000;

            long idx = rng.nextIndex(37);
            assertTrue(idx >= 0 && idx < 37);

            int pct = rng.nextPercent();
            assertTrue(pct >= 0 && pct < 100);
        }
        assertTrue(sawMin && sawMax, "both value bounds should be reachable");
    }

    @Test
    void shouldDrawWideIndicesAboveTwoPow32() {
        SeededStream rng = new SeededStream(1);
        long n = 10_000_000_000L;
        boolean aboveInt = false;
        for (int i = 0; i < 1_000; i++) {
            long idx = rng.nextIndex(n);
            assertTrue(idx >= 0 && idx < n);
            aboveInt |= idx > 0xFFFF_FFFFL;
        }
        assertTrue(aboveInt);
    }

    @Test
    void shouldAlwaysReturnZeroForBoundOne() {
        SeededStream rng = new SeededStream(99);
        for (int i = 0; i < 100; i++) {
            assertEquals(0L, rng.nextIndex(1));
            assertEquals(0L, rng.nextBelowRaw(1));
        }
    }

    @Test
    void shouldRejectSeedsOutsideUnsigned32Bit() {
        assertThrows(IllegalArgumentException.class, () -> new SeededStream(-1));
        assertThrows(IllegalArgumentException.class, () -> new SeededStream(SeededStream.MAX_SEED + 1));
        assertEquals(SeededStream.MAX_SEED, new SeededStream(SeededStream.MAX_SEED).seed());
    }

    @Test
    void shouldGiveReproducibleDistinctStreamsForSeedsAboveTwoPow31() {
        long[] seeds = {0L, 2_147_483_648L, SeededStream.MAX_SEED};
        long[] first = new long[seeds.length];
        for (int i = 0; i < seeds.length; i++) {
            SeededStream a = new SeededStream(seeds[i]);
            SeededStream b = new SeededStream(seeds[i]);
            for (int k = 0; k < 1_000; k++) {
                assertEquals(a.nextRaw(), b.nextRaw(), "seed " + seeds[i]);
            }
            first[i] = new SeededStream(seeds[i]).nextRaw();
            assertTrue(first[i] >= 0 && first[i] <= SeededStream.MAX_SEED);
        }
        assertNotEquals(first[0], first[1]);
        assertNotEquals(first[1], first[2]);
        assertNotEquals(first[0], first[2]);
    }
}
