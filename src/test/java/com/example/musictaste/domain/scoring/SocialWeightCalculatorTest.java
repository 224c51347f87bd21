package com.example.musictaste.domain.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.musictaste.domain.model.FollowEdges;
import java.util.Arrays;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class SocialWeightCalculatorTest {

    // viewer follows 2 and 3; 2 and 4 follow the viewer
    private final FollowEdges edges = new FollowEdges(Arrays.asList(2L, 3L), Arrays.asList(2L, 4L));

    @Test
    void shouldWeightByFollowRelation() {
        assertEquals(1.5D, SocialWeightCalculator.weight(edges, 2L, OptionalDouble.empty()), 1e-9);
        assertEquals(1.2D, SocialWeightCalculator.weight(edges, 3L, OptionalDouble.empty()), 1e-9);
        assertEquals(1.0D, SocialWeightCalculator.weight(edges, 4L, OptionalDouble.empty()), 1e-9);
        assertEquals(1.0D, SocialWeightCalculator.weight(FollowEdges.none(), 5L, OptionalDouble.empty()), 1e-9);
    }

    @Test
    void similarityBonusShouldStackOnTheFollowWeight() {
        assertEquals(1.8D, SocialWeightCalculator.weight(edges, 2L, OptionalDouble.of(0.9D)), 1e-9);
        assertEquals(1.5D, SocialWeightCalculator.weight(edges, 3L, OptionalDouble.of(0.71D)), 1e-9);
        assertEquals(1.3D, SocialWeightCalculator.weight(edges, 7L, OptionalDouble.of(0.8D)), 1e-9);
    }

    @Test
    void similarityAtThresholdShouldNotEarnBonus() {
        assertEquals(1.2D, SocialWeightCalculator.weight(edges, 3L, OptionalDouble.of(0.7D)), 1e-9);
    }
}
