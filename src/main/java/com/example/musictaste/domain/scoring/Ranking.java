package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.ScoredSong;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class Ranking {

    private Ranking() {
    }

    /**
     * Highest scores first. The sort is stable, so equal scores keep their
     * candidate order.
     */
    public static List<ScoredSong> top(List<ScoredSong> scored, int limit) {
        List<ScoredSong> sorted = new ArrayList<>(scored);
        sorted.sort(Comparator.comparingDouble(ScoredSong::getScore).reversed());
        return sorted.size() > limit ? new ArrayList<>(sorted.subList(0, Math.max(0, limit))) : sorted;
    }
}
