package com.example.musictaste.domain.scoring;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard overlap used for genre, favorite-artist and language comparisons.
 */
public final class SetSimilarity {

    private SetSimilarity() {
    }

    /**
     * @return {@code |A∩B| / |A∪B|}, or 0 when either side is empty
     */
    public static <T> double jaccard(Collection<T> a, Collection<T> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0D;
        }
        Set<T> left = new HashSet<>(a);
        Set<T> right = new HashSet<>(b);
        Set<T> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }
}
