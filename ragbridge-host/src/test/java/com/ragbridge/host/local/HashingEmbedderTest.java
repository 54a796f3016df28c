package com.ragbridge.host.local;

import com.ragbridge.errors.EmbeddingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashingEmbedderTest {

    private final HashingEmbedder embedder = new HashingEmbedder(64);

    @Test
    void embedDocuments_preservesLengthAndOrder() {
        List<String> texts = List.of("alpha beta", "gamma", "", "alpha beta");

        List<float[]> vectors = embedder.embedDocuments(texts).join();

        assertEquals(4, vectors.size());
        assertArrayEquals(vectors.get(0), vectors.get(3));
        assertArrayEquals(embedder.embedQuery("gamma").join(), vectors.get(1));
        assertEquals(64, vectors.get(2).length);
    }

    @Test
    void embedDocuments_outputFollowsInputPermutation() {
        List<String> texts = List.of("solar panels", "wind turbines", "tidal energy", "geothermal wells",
                "hydro dams", "battery storage", "grid balancing");
        List<Integer> perm = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) perm.add(i);
        Collections.shuffle(perm, new Random(42));
        List<String> shuffled = new ArrayList<>();
        for (int i : perm) shuffled.add(texts.get(i));

        List<float[]> original = embedder.embedDocuments(texts).join();
        List<float[]> reordered = embedder.embedDocuments(shuffled).join();

        assertEquals(texts.size(), reordered.size());
        for (int i = 0; i < perm.size(); i++) {
            assertArrayEquals(original.get(perm.get(i)), reordered.get(i), "position " + i);
        }
    }

    @Test
    void vectorsAreUnitLength() {
        float[] v = embedder.embedQuery("The quick brown fox").join();

        double norm = 0;
        for (float x : v) norm += x * x;
        assertEquals(1.0, norm, 1e-5);
    }

    @Test
    void caseAndPunctuationDoNotMatter() {
        assertTrue(Arrays.equals(embedder.embedQuery("Hello, World!").join(), embedder.embedQuery("hello world").join()));
    }

    @Test
    void nullText_failsWholeBatch() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> embedder.embedDocuments(Arrays.asList("ok", null)).join());

        assertInstanceOf(EmbeddingException.class, thrown.getCause());
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbedder(0));
    }
}
