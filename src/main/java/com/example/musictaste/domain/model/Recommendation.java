package com.example.musictaste.domain.model;

import com.example.musictaste.domain.ScoringMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ranked result of one recommendation request, tagged with the single mode
 * that produced it.
 */
public final class Recommendation {

    private final long userId;
    private final ScoringMode mode;
    private final List<ScoredSong> songs;

    public Recommendation(long userId, ScoringMode mode, List<ScoredSong> songs) {
        this.userId = userId;
        this.mode = mode;
        this.songs = Collections.unmodifiableList(new ArrayList<>(songs));
    }

    public long getUserId() {
        return userId;
    }

    public ScoringMode getMode() {
        return mode;
    }

    public List<ScoredSong> getSongs() {
        return songs;
    }
}
