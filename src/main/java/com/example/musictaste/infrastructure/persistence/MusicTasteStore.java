package com.example.musictaste.infrastructure.persistence;

import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.domain.model.FollowEdges;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.SentimentAnnotation;
import com.example.musictaste.domain.model.Song;
import com.example.musictaste.domain.model.SongRating;
import com.example.musictaste.domain.model.SongReview;
import com.example.musictaste.domain.model.UserPair;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read/write view of the persistent store used by the scoring engines.
 * <p>
 * Missing data is returned as empty values, never as errors. Failures of the
 * underlying store surface as Spring {@code DataAccessException}s.
 */
public interface MusicTasteStore {

    /**
     * @return the user's preferences, or {@link PreferenceProfile#empty()} if none were saved
     */
    PreferenceProfile getPreferenceProfile(long userId);

    List<SongRating> getReviewsByUser(long userId);

    List<SongReview> getReviewsBySong(long songId);

    /**
     * One genre per (song, genre) occurrence over the user's reviews rated at least {@code minRating}.
     */
    List<String> getGenresRatedAtLeast(long userId, double minRating);

    /**
     * Up to {@code cap} songs ordered by 30-day popularity descending, then id.
     * Empty filters mean no restriction.
     */
    List<Song> getCandidateSongs(Collection<String> languages, List<EraRange> eras, int cap);

    List<Song> getSongsByIds(Collection<Long> songIds);

    List<SongReview> getReviewsCreatedSince(Instant since);

    Optional<SongReview> getReview(long reviewId);

    FollowEdges getFollowEdges(long userId);

    Optional<CompatibilityEntry> getCompatibilityCache(UserPair pair);

    void upsertCompatibilityCache(UserPair pair, CompatibilityEntry entry);

    void upsertSentiment(long reviewId, SentimentAnnotation annotation);
}
