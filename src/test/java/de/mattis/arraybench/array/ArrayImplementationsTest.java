package de.mattis.arraybench.array;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArrayImplementationsTest {

    @Test
    void shouldListImplementationsInRegistrationOrder() {
        assertEquals(List.of("java_long_array", "java_chunked_long_array", "sec3", "sec4"), ArrayImplementations.names());
    }

    @Test
    void shouldCreateFreshZeroedInstances() {
        InitializableArray a = ArrayImplementations.create("java_long_array", 10);
        InitializableArray b = ArrayImplementations.create(" java_chunked_long_array ", 10);
        assertInstanceOf(LongArray.class, a);
        assertInstanceOf(ChunkedLongArray.class, b);
        assertEquals(0L, a.read(9));
        assertEquals(0L, b.read(9));

        InitializableArray sec3 = ArrayImplementations.create("sec3", 10);
        InitializableArray sec4 = ArrayImplementations.create("sec4", 12);
        assertInstanceOf(PairBlockInPlaceArray.class, sec3);
        assertInstanceOf(QuadBlockInPlaceArray.class, sec4);
        assertEquals(0L, sec3.read(9));
        assertEquals(0L, sec4.read(11));
    }

    @Test
    void shouldFailOnUnknownImplementation() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ArrayImplementations.requireKnown("std_vector"));
        assertTrue(e.getMessage().contains("Unknown implementation: std_vector"));
    }
}
