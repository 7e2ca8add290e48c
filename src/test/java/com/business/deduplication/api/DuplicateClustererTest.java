package com.business.deduplication.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateClustererTest {

    @Test
    @DisplayName("Singletons should each form a group")
    void singletons() {
        DuplicateClusterer clusterer = new DuplicateClusterer(3);
        assertEquals(List.of(List.of(0), List.of(1), List.of(2)), clusterer.groups());
    }

    @Test
    @DisplayName("Unions should be transitive")
    void transitive() {
        DuplicateClusterer clusterer = new DuplicateClusterer(5);

        assertTrue(clusterer.union(0, 3));
        assertTrue(clusterer.union(3, 4));
        assertFalse(clusterer.union(4, 0));

        assertEquals(List.of(List.of(0, 3, 4), List.of(1), List.of(2)), clusterer.groups());
        assertEquals(0, clusterer.find(4));
    }

    @Test
    @DisplayName("Union order should not change the groups")
    void orderIndependent() {
        DuplicateClusterer forward = new DuplicateClusterer(6);
        forward.union(1, 2);
        forward.union(2, 5);
        forward.union(0, 4);

        DuplicateClusterer backward = new DuplicateClusterer(6);
        backward.union(4, 0);
        backward.union(5, 2);
        backward.union(2, 1);

        assertEquals(forward.groups(), backward.groups());
        assertEquals(List.of(List.of(0, 4), List.of(1, 2, 5), List.of(3)), forward.groups());
    }

    @Test
    @DisplayName("An empty batch should have no groups")
    void empty() {
        assertTrue(new DuplicateClusterer(0).groups().isEmpty());
    }
}
