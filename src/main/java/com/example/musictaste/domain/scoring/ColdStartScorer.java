package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.ScoredSong;
import com.example.musictaste.domain.model.Song;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ranking heuristic for users with too little history for collaborative signals:
 * {@code popularity_30d + 1.0 (favorite artist) + 0.5 (preferred language)}.
 * Scores are unbounded; only their order matters.
 */
public final class ColdStartScorer {

    public static final double FAVORITE_ARTIST_BONUS = 1.0D;
    public static final double LANGUAGE_BONUS = 0.5D;

    private ColdStartScorer() {
    }

    public static double score(Song song, PreferenceProfile profile) {
        double score = song.getPopularity30d();
        if (profile.isFavoriteArtist(song.getArtistId())) {
            score += FAVORITE_ARTIST_BONUS;
        }
        if (profile.prefersLanguage(song.getLanguage())) {
            score += LANGUAGE_BONUS;
        }
        return score;
    }

    /**
     * Language-restricted (no era filter), scored, sorted descending with
     * ties in candidate order, truncated to {@code limit}.
     */
    public static List<ScoredSong> rank(Collection<Song> candidates, PreferenceProfile profile, int limit) {
        List<ScoredSong> scored = new ArrayList<>();
        for (Song song : candidates) {
            if (HardFilter.admitsLanguage(song, profile)) {
                scored.add(ScoredSong.coldStart(song, score(song, profile)));
            }
        }
        return Ranking.top(scored, limit);
    }
}
