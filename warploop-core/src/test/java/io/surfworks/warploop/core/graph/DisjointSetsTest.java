package io.surfworks.warploop.core.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DisjointSets")
class DisjointSetsTest {

    @Test
    @DisplayName("initialized handles start as singletons")
    void singletons() {
        DisjointSets sets = new DisjointSets();
        assertTrue(sets.initialize(3));
        assertFalse(sets.initialize(3));

        assertTrue(sets.contains(3));
        assertFalse(sets.contains(2));
        assertEquals(List.of(3), sets.members(3));
        assertEquals(1, sets.classCount());
    }

    @Test
    @DisplayName("union merges classes and keeps members sorted")
    void unionKeepsMembersSorted() {
        DisjointSets sets = new DisjointSets(4);
        sets.union(5, 1);
        sets.union(3, 5);
        sets.union(0, 2);

        assertEquals(List.of(1, 3, 5), sets.members(3));
        assertEquals(List.of(0, 2), sets.members(2));
        assertTrue(sets.areMapped(1, 5));
        assertFalse(sets.areMapped(1, 2));
        assertEquals(2, sets.classCount());
        assertFalse(sets.union(1, 3));
    }

    @Test
    @DisplayName("classes enumerate by smallest member")
    void classOrder() {
        DisjointSets sets = new DisjointSets();
        sets.union(4, 7);
        sets.union(2, 9);
        sets.initialize(6);

        List<Integer> roots = sets.classRoots();

        assertEquals(3, roots.size());
        assertEquals(2, sets.members(roots.get(0)).get(0));
        assertEquals(4, sets.members(roots.get(1)).get(0));
        assertEquals(6, sets.members(roots.get(2)).get(0));
    }

    @Test
    @DisplayName("grows past the expected handle count")
    void grows() {
        DisjointSets sets = new DisjointSets(2);
        sets.union(10, 100);

        assertTrue(sets.areMapped(100, 10));
        assertFalse(sets.contains(50));
    }

    @Test
    @DisplayName("finding an unregistered handle fails")
    void unregistered() {
        DisjointSets sets = new DisjointSets();

        assertThrows(IllegalArgumentException.class, () -> sets.find(1));
        assertThrows(IllegalArgumentException.class, () -> sets.initialize(-1));
    }

    @Test
    @DisplayName("frozen sets answer queries but reject mutation")
    void frozen() {
        DisjointSets sets = new DisjointSets();
        sets.union(0, 1);
        sets.union(1, 2);
        sets.freeze();

        assertTrue(sets.isFrozen());
        assertTrue(sets.areMapped(0, 2));
        assertThrows(IllegalStateException.class, () -> sets.union(0, 3));
        assertThrows(IllegalStateException.class, () -> sets.initialize(4));
    }
}
