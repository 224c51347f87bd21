package com.example.musictaste.domain.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class SetSimilarityTest {

    @Test
    void jaccardShouldDivideIntersectionByUnion() {
        double similarity = SetSimilarity.jaccard(Arrays.asList("rock", "pop", "jazz"), Arrays.asList("pop", "jazz", "folk"));

        assertEquals(0.5D, similarity, 1e-9);
    }

    @Test
    void jaccardShouldBeZeroWhenEitherSideIsEmpty() {
        assertEquals(0.0D, SetSimilarity.jaccard(Collections.<String>emptyList(), Arrays.asList("rock")), 0.0D);
        assertEquals(0.0D, SetSimilarity.jaccard(Arrays.asList("rock"), Collections.<String>emptyList()), 0.0D);
        assertEquals(0.0D, SetSimilarity.jaccard(Collections.<String>emptyList(), Collections.<String>emptyList()), 0.0D);
    }

    @Test
    void jaccardShouldIgnoreDuplicatesAndBeSymmetric() {
        double forward = SetSimilarity.jaccard(Arrays.asList("rock", "rock", "pop"), Arrays.asList("rock"));
        double backward = SetSimilarity.jaccard(Arrays.asList("rock"), Arrays.asList("rock", "rock", "pop"));

        assertEquals(0.5D, forward, 1e-9);
        assertEquals(forward, backward, 0.0D);
    }
}
