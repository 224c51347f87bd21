package com.example.musictaste.domain;

/**
 * How a user is scored for a single recommendation request.
 * <p>
 * Exactly one mode applies per request; it is chosen from the user's total
 * review count before any scoring starts.
 */
public enum ScoringMode {

    /** Popularity + favorite-artist + language heuristic for users with little history. */
    COLD_START,

    /** Weighted blend of genre, CF, community, artist, language and era signals. */
    HYBRID;

    /** Users with fewer reviews than this are scored in {@link #COLD_START}. */
    public static final int HYBRID_MIN_INTERACTIONS = 5;

    public static ScoringMode forInteractionCount(int interactionCount) {
        return interactionCount < HYBRID_MIN_INTERACTIONS ? COLD_START : HYBRID;
    }
}
