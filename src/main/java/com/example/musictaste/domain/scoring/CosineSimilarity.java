package com.example.musictaste.domain.scoring;

import java.util.Map;

/**
 * Cosine similarity of two sparse rating vectors keyed by song id, restricted
 * to the songs both users rated.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Raw cosine over the common keys. Returns 0 when there is no overlap or
     * either restricted vector has zero magnitude.
     */
    public static double raw(Map<Long, Double> a, Map<Long, Double> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0D;
        }
        Map<Long, Double> small = a.size() <= b.size() ? a : b;
        Map<Long, Double> large = small == a ? b : a;

        double dot = 0.0D;
        double normSmall = 0.0D;
        double normLarge = 0.0D;
        int common = 0;
        for (Map.Entry<Long, Double> entry : small.entrySet()) {
            Double other = large.get(entry.getKey());
            if (other == null || entry.getValue() == null) {
                continue;
            }
            double x = entry.getValue();
            double y = other;
            dot += x * y;
            normSmall += x * x;
            normLarge += y * y;
            common++;
        }
        if (common == 0 || normSmall == 0.0D || normLarge == 0.0D) {
            return 0.0D;
        }
        return dot / (Math.sqrt(normSmall) * Math.sqrt(normLarge));
    }

    /**
     * Similarity as used by the scorers: negative cosine means "no evidence"
     * and is clamped to 0. The upper clamp only absorbs rounding error.
     */
    public static double effective(Map<Long, Double> a, Map<Long, Double> b) {
        return ScoreBounds.clampUnit(raw(a, b));
    }
}
