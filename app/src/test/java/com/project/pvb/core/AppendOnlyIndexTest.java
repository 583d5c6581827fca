package com.project.pvb.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppendOnlyIndexTest {

    @Test
    void growsPastInitialCapacityPreservingOrder() {
        AppendOnlyIndex<Integer> index = new AppendOnlyIndex<>(Integer[]::new);
        for (int i = 0; i < 100; i++) {
            index.append(i);
        }

        assertEquals(100, index.size());
        assertEquals(0, index.get(0));
        assertEquals(99, index.get(99));
        assertEquals(List.of(15, 16, 17), index.slice(15, 18));
    }

    @Test
    void sliceIsClampedToPublishedSize() {
        AppendOnlyIndex<String> index = new AppendOnlyIndex<>(String[]::new);
        index.append("a");
        index.append("b");

        assertEquals(List.of("b"), index.slice(1, 50));
        assertEquals(List.of(), index.slice(2, 5));
    }

    @Test
    void getOutsidePublishedPrefixFails() {
        AppendOnlyIndex<String> index = new AppendOnlyIndex<>(String[]::new);
        index.append("a");

        assertThrows(IndexOutOfBoundsException.class, () -> index.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> index.get(-1));
    }

    @Test
    void snapshotFiltersAndCopies() {
        AppendOnlyIndex<Integer> index = new AppendOnlyIndex<>(Integer[]::new);
        for (int i = 0; i < 10; i++) {
            index.append(i);
        }

        List<Integer> evens = index.snapshot(i -> i % 2 == 0);
        index.append(10);

        assertEquals(List.of(0, 2, 4, 6, 8), evens);
        assertEquals(11, index.snapshot(i -> true).size());
    }

    @Test
    void sliceIsDetachedFromLaterAppends() {
        AppendOnlyIndex<String> index = new AppendOnlyIndex<>(String[]::new);
        for (int i = 0; i < 16; i++) {
            index.append("e" + i);
        }

        List<String> head = index.slice(0, 16);
        index.append("e16");
        head.set(0, "changed");

        assertEquals(16, head.size());
        assertEquals("e0", index.get(0));
        assertEquals("e16", index.get(16));
    }
}
