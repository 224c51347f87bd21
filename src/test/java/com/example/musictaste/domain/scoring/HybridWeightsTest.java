package com.example.musictaste.domain.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.musictaste.domain.model.CompatibilityBreakdown;
import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.ScoreComponents;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class HybridWeightsTest {

    @Test
    void defaultsShouldSumToOne() {
        HybridWeights weights = HybridWeights.defaults();

        assertEquals(1.0D, weights.combine(new ScoreComponents(1.0D, 1.0D, 1.0D, 1.0D, 1.0D, 1.0D)), 1e-9);
        assertEquals(0.0D, weights.combine(new ScoreComponents(0.0D, 0.0D, 0.0D, 0.0D, 0.0D, 0.0D)), 0.0D);
    }

    @Test
    void combineShouldApplyEachWeight() {
        ScoreComponents components = new ScoreComponents(0.5D, 0.8D, 0.5D, 1.0D, 0.0D, 0.5D);

        double expected = 0.25D * 0.5D + 0.30D * 0.8D + 0.20D * 0.5D + 0.10D * 1.0D + 0.10D * 0.0D + 0.05D * 0.5D;
        assertEquals(expected, HybridWeights.defaults().combine(components), 1e-9);
    }

    @Test
    void oversizedWeightsShouldStillProduceBoundedScores() {
        HybridWeights heavy = new HybridWeights(2.0D, 2.0D, 2.0D, 2.0D, 2.0D, 2.0D);

        assertEquals(1.0D, heavy.combine(new ScoreComponents(1.0D, 1.0D, 1.0D, 1.0D, 1.0D, 1.0D)), 0.0D);
    }

    @Test
    void oversizedCompatibilityWeightsShouldStayWithinUnitRange() {
        CompatibilityWeights heavy = new CompatibilityWeights(5.0D, 5.0D, 5.0D, 5.0D, 5.0D);
        CompatibilityBreakdown identical = new CompatibilityBreakdown(1.0D, 1.0D, 1.0D, 1.0D, 1.0D);

        double score = heavy.combine(identical);

        assertEquals(1.0D, score, 0.0D);
        assertEquals(100, new CompatibilityEntry(score, identical, Instant.EPOCH).percentage());
    }

    @Test
    void zeroCompatibilityWeightsShouldScoreZero() {
        CompatibilityWeights none = new CompatibilityWeights(0.0D, 0.0D, 0.0D, 0.0D, 0.0D);

        double score = none.combine(new CompatibilityBreakdown(1.0D, 1.0D, 1.0D, 1.0D, 1.0D));

        assertEquals(0.0D, score, 0.0D);
        assertEquals(0, new CompatibilityEntry(score, null, Instant.EPOCH).percentage());
    }

    @Test
    void shouldRejectNegativeOrNonFiniteWeights() {
        assertThrows(IllegalArgumentException.class, () -> new HybridWeights(-0.1D, 0.3D, 0.2D, 0.1D, 0.1D, 0.05D));
        assertThrows(IllegalArgumentException.class, () -> new HybridWeights(0.25D, Double.NaN, 0.2D, 0.1D, 0.1D, 0.05D));
        assertThrows(IllegalArgumentException.class,
                () -> new CompatibilityWeights(0.35D, 0.25D, Double.POSITIVE_INFINITY, 0.15D, 0.1D));
    }
}
