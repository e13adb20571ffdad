package com.sandy.aiot.edge.runtime.tools;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedRingBufferTest {

    @Test
    void evictsOldestWhenFull() {
        BoundedRingBuffer<Integer> buffer = new BoundedRingBuffer<>(3);
        for (int i = 1; i <= 5; i++) buffer.add(i);
        assertEquals(3, buffer.size());
        assertEquals(List.of(3, 4, 5), buffer.toList());
        assertEquals(5, buffer.latest());
    }

    @Test
    void tailReturnsNewestInInsertionOrder() {
        BoundedRingBuffer<String> buffer = new BoundedRingBuffer<>(720);
        for (int i = 0; i < 800; i++) buffer.add("r" + i);
        assertEquals(720, buffer.size());
        assertEquals(List.of("r797", "r798", "r799"), buffer.tail(3));
        assertEquals(720, buffer.tail(10_000).size());
        assertTrue(buffer.tail(0).isEmpty());
        assertTrue(buffer.tail(-5).isEmpty());
    }

    @Test
    void tailIsACopy() {
        BoundedRingBuffer<Integer> buffer = new BoundedRingBuffer<>(2);
        buffer.add(1);
        List<Integer> view = buffer.toList();
        buffer.add(2);
        buffer.add(3);
        assertEquals(List.of(1), view);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedRingBuffer<>(0));
    }
}
