package com.example.musictaste.domain.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Genres a user likes, derived from the genres of songs they rated at least
 * {@link #LIKED_RATING} stars.
 */
public final class GenreProfile {

    public static final double LIKED_RATING = 4.0D;

    private static final GenreProfile EMPTY = new GenreProfile(Collections.emptyMap());

    /** Occurrence count per genre, in first-seen order. */
    private final Map<String, Integer> frequency;

    private GenreProfile(Map<String, Integer> frequency) {
        this.frequency = frequency;
    }

    /**
     * @param occurrences one entry per (liked song, genre) pair
     */
    public static GenreProfile fromOccurrences(Collection<String> occurrences) {
        if (occurrences == null || occurrences.isEmpty()) {
            return EMPTY;
        }
        Map<String, Integer> frequency = new LinkedHashMap<>();
        for (String genre : occurrences) {
            if (genre == null || genre.trim().isEmpty()) {
                continue;
            }
            frequency.merge(genre.trim(), 1, Integer::sum);
        }
        return new GenreProfile(Collections.unmodifiableMap(frequency));
    }

    public static GenreProfile empty() {
        return EMPTY;
    }

    public Set<String> genreSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(frequency.keySet()));
    }

    /**
     * Genres by descending frequency; equal counts keep first-seen order.
     */
    public List<String> rankedByFrequency() {
        List<String> ranked = new ArrayList<>(frequency.keySet());
        ranked.sort((a, b) -> Integer.compare(frequency.get(b), frequency.get(a)));
        return ranked;
    }

    public boolean isEmpty() {
        return frequency.isEmpty();
    }
}
