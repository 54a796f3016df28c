package com.ragbridge.host;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VectorStoreTest {

    @Test
    void requireParallel_rejectsMismatchedLengths() {
        List<float[]> oneVector = List.of(new float[]{1f});

        assertThrows(IllegalArgumentException.class,
                () -> VectorStore.requireParallel(List.of("a", "b"), oneVector, null));
        assertThrows(IllegalArgumentException.class,
                () -> VectorStore.requireParallel(List.of("a"), oneVector, List.of(Map.of(), Map.of())));
        assertThrows(IllegalArgumentException.class,
                () -> VectorStore.requireParallel(null, oneVector, null));
        VectorStore.requireParallel(List.of("a"), oneVector, List.of(Map.of()));
    }

    @Test
    void requireSelection_needsIdsOrFilters() {
        assertThrows(IllegalArgumentException.class, () -> VectorStore.requireSelection(null, null));
        VectorStore.requireSelection(List.of(), null);
        VectorStore.requireSelection(null, Map.of());
    }

    @Test
    void searchHit_distanceIsOneMinusScore() {
        SearchHit hit = new SearchHit("c-1", 0.75, null);

        assertEquals(0.25, hit.distance(), 1e-9);
        assertEquals(Map.of(), hit.metadata());
    }
}
