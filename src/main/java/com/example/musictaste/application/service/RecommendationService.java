package com.example.musictaste.application.service;

import com.example.musictaste.common.config.AppCompatibilityProperties;
import com.example.musictaste.common.config.AppRecommendationProperties;
import com.example.musictaste.common.exception.BusinessException;
import com.example.musictaste.common.exception.ErrorCodes;
import com.example.musictaste.domain.ScoringMode;
import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.FollowEdges;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.Recommendation;
import com.example.musictaste.domain.model.ScoreComponents;
import com.example.musictaste.domain.model.ScoredSong;
import com.example.musictaste.domain.model.Song;
import com.example.musictaste.domain.model.SongRating;
import com.example.musictaste.domain.model.SongReview;
import com.example.musictaste.domain.model.UserPair;
import com.example.musictaste.domain.scoring.ColdStartScorer;
import com.example.musictaste.domain.scoring.CollaborativeFilteringScorer;
import com.example.musictaste.domain.scoring.CommunityScorer;
import com.example.musictaste.domain.scoring.EraProximityScorer;
import com.example.musictaste.domain.scoring.GenreProfile;
import com.example.musictaste.domain.scoring.HardFilter;
import com.example.musictaste.domain.scoring.HybridWeights;
import com.example.musictaste.domain.scoring.Ranking;
import com.example.musictaste.domain.scoring.ScoreBounds;
import com.example.musictaste.domain.scoring.SetSimilarity;
import com.example.musictaste.domain.scoring.SocialWeightCalculator;
import com.example.musictaste.infrastructure.persistence.MusicTasteStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Personalized song recommendations.
 * <p>
 * Each request first selects a {@link ScoringMode} from the user's review
 * count, then runs exactly one of the two pipelines:
 * <ul>
 *   <li>COLD_START: language-restricted popular songs ranked by {@link ColdStartScorer}.</li>
 *   <li>HYBRID: hard filter, drop already rated songs, cap the pool, score six
 *       signals per candidate and combine them with {@link HybridWeights}.</li>
 * </ul>
 * Store failures are reported as {@code RECOMMENDATION_UNAVAILABLE}; an empty
 * list is only returned when there is genuinely nothing to recommend.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final int MAX_LIMIT = 100;
    /** Top genres written to the debug log per hybrid request. */
    private static final int DIAGNOSTIC_GENRES = 5;

    private final MusicTasteStore store;
    private final AppRecommendationProperties properties;
    private final HybridWeights weights;
    private final Duration compatibilityTtl;
    private final Executor executor;
    private final MetricsRecorder metrics;
    private final Clock clock;

    @Autowired
    public RecommendationService(MusicTasteStore store,
                                 AppRecommendationProperties properties,
                                 AppCompatibilityProperties compatibilityProperties,
                                 @Qualifier("recommendationExecutor") ExecutorService executor,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(store, properties, compatibilityProperties.cacheTtl(), executor,
                meterRegistryProvider.getIfAvailable(), Clock.systemUTC());
    }

    RecommendationService(MusicTasteStore store,
                          AppRecommendationProperties properties,
                          Duration compatibilityTtl,
                          Executor executor,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.store = store;
        this.properties = properties;
        this.weights = properties.toHybridWeights();
        this.compatibilityTtl = compatibilityTtl;
        this.executor = executor;
        this.metrics = new MetricsRecorder(meterRegistry);
        this.clock = clock;
    }

    public Recommendation recommend(Long userId, int limit) {
        if (userId == null || userId <= 0) {
            throw new BusinessException(ErrorCodes.BAD_REQUEST, "userId不合法", "请检查用户后重试");
        }
        int safeLimit = normalizeLimit(limit);
        long startedAtNanos = System.nanoTime();
        try {
            List<SongRating> ratings = store.getReviewsByUser(userId);
            ScoringMode mode = ScoringMode.forInteractionCount(ratings.size());
            List<ScoredSong> songs = mode == ScoringMode.COLD_START
                    ? recommendColdStart(userId, safeLimit)
                    : recommendHybrid(userId, ratings, safeLimit);

            log.info("RECOMMEND_EVENT event=recommend_success userId={} mode={} interactions={} size={} traceId={}",
                    userId, mode, ratings.size(), songs.size(), currentTraceId());
            metrics.counter("music.recommend.mode", "mode", mode.name());
            return new Recommendation(userId, mode, songs);
        } catch (DataAccessException e) {
            log.warn("RECOMMEND_EVENT event=recommend_failure userId={} cause={} traceId={}",
                    userId, e.getClass().getSimpleName(), currentTraceId());
            metrics.counter("music.recommend.failure");
            throw new BusinessException(ErrorCodes.RECOMMENDATION_UNAVAILABLE, "推荐暂时不可用",
                    ErrorCodes.RETRY_LATER, e);
        } catch (RejectedExecutionException e) {
            log.warn("RECOMMEND_EVENT event=recommend_rejected userId={} message={} traceId={}",
                    userId, e.getMessage(), currentTraceId());
            metrics.counter("music.recommend.failure");
            throw new BusinessException(ErrorCodes.RECOMMENDATION_UNAVAILABLE, "推荐暂时不可用",
                    ErrorCodes.RETRY_LATER, e);
        } finally {
            metrics.duration("music.recommend.latency", System.nanoTime() - startedAtNanos);
        }
    }

    // ------------------------------------------------------------------
    // Cold start
    // ------------------------------------------------------------------

    private List<ScoredSong> recommendColdStart(long userId, int limit) {
        PreferenceProfile profile = store.getPreferenceProfile(userId);
        int pool = limit * Math.max(1, properties.getColdStartPoolMultiplier());
        List<Song> candidates = store.getCandidateSongs(profile.getPreferredLanguages(), Collections.emptyList(), pool);
        return ColdStartScorer.rank(candidates, profile, limit);
    }

    // ------------------------------------------------------------------
    // Hybrid
    // ------------------------------------------------------------------

    private List<ScoredSong> recommendHybrid(long userId, List<SongRating> ratings, int limit) {
        CompletableFuture<PreferenceProfile> profileLookup =
                AsyncLookups.supply(() -> store.getPreferenceProfile(userId), executor);
        CompletableFuture<GenreProfile> genreLookup = AsyncLookups.supply(() -> GenreProfile.fromOccurrences(
                store.getGenresRatedAtLeast(userId, GenreProfile.LIKED_RATING)), executor);
        CompletableFuture<FollowEdges> edgeLookup =
                AsyncLookups.supply(() -> store.getFollowEdges(userId), executor);

        PreferenceProfile profile = AsyncLookups.join(profileLookup);
        int cap = Math.max(1, properties.getCandidateCap());
        List<Song> pool = store.getCandidateSongs(profile.getPreferredLanguages(), profile.getPreferredEras(), cap);

        Map<Long, Double> userRatings = toVector(ratings);
        List<Song> candidates = new ArrayList<>();
        for (Song song : HardFilter.apply(pool, profile)) {
            if (candidates.size() >= cap) {
                break;
            }
            if (!userRatings.containsKey(song.getId())) {
                candidates.add(song);
            }
        }

        GenreProfile genres = AsyncLookups.join(genreLookup);
        FollowEdges edges = AsyncLookups.join(edgeLookup);
        if (log.isDebugEnabled()) {
            List<String> ranked = genres.rankedByFrequency();
            log.debug("Hybrid inputs userId={} pool={} candidates={} topGenres={}",
                    userId, pool.size(), candidates.size(),
                    ranked.subList(0, Math.min(DIAGNOSTIC_GENRES, ranked.size())));
        }

        HybridRequest request = new HybridRequest(userId, userRatings, profile, genres, edges, clock.instant());
        List<CompletableFuture<ScoredSong>> scoring = new ArrayList<>(candidates.size());
        for (Song song : candidates) {
            scoring.add(AsyncLookups.supply(() -> scoreCandidate(request, song), executor));
        }
        return Ranking.top(AsyncLookups.joinAll(scoring), limit);
    }

    private ScoredSong scoreCandidate(HybridRequest request, Song song) {
        List<SongReview> reviews = store.getReviewsBySong(song.getId());
        PreferenceProfile profile = request.profile;

        double genre = SetSimilarity.jaccard(song.getGenres(), request.genres.genreSet());
        double cf = CollaborativeFilteringScorer.score(request.userId, request.userRatings, reviews, request::ratingsOf);
        double community = CommunityScorer.score(reviews, request.now, request::socialWeight);
        double artist = profile.isFavoriteArtist(song.getArtistId()) ? 1.0D : 0.0D;
        double language = profile.prefersLanguage(song.getLanguage()) ? 1.0D : 0.0D;
        double era = EraProximityScorer.score(song.getReleaseYear(), profile.getPreferredEras());

        ScoreComponents components = new ScoreComponents(
                ScoreBounds.checkUnit("genre", genre),
                ScoreBounds.checkUnit("cf", cf),
                ScoreBounds.checkUnit("community", community),
                artist,
                language,
                ScoreBounds.checkUnit("era", era));
        return new ScoredSong(song, weights.combine(components), components);
    }

    /**
     * Per-request inputs and memoized lookups shared by all candidate scorers.
     */
    private final class HybridRequest {

        private final long userId;
        private final Map<Long, Double> userRatings;
        private final PreferenceProfile profile;
        private final GenreProfile genres;
        private final FollowEdges edges;
        private final Instant now;
        private final ConcurrentMap<Long, Map<Long, Double>> ratingVectors = new ConcurrentHashMap<>();
        private final ConcurrentMap<Long, OptionalDouble> similarities = new ConcurrentHashMap<>();

        private HybridRequest(long userId,
                              Map<Long, Double> userRatings,
                              PreferenceProfile profile,
                              GenreProfile genres,
                              FollowEdges edges,
                              Instant now) {
            this.userId = userId;
            this.userRatings = userRatings;
            this.profile = profile;
            this.genres = genres;
            this.edges = edges;
            this.now = now;
        }

        Map<Long, Double> ratingsOf(Long otherUserId) {
            Map<Long, Double> vector = ratingVectors.get(otherUserId);
            if (vector == null) {
                vector = toVector(store.getReviewsByUser(otherUserId));
                Map<Long, Double> raced = ratingVectors.putIfAbsent(otherUserId, vector);
                if (raced != null) {
                    vector = raced;
                }
            }
            return vector;
        }

        double socialWeight(Long reviewerId) {
            return SocialWeightCalculator.weight(edges, reviewerId, similarityTo(reviewerId));
        }

        /**
         * Taste similarity from a fresh compatibility cache entry only; a
         * missing or stale entry gives no bonus and is not recomputed here.
         */
        private OptionalDouble similarityTo(long reviewerId) {
            if (reviewerId == userId) {
                return OptionalDouble.empty();
            }
            OptionalDouble similarity = similarities.get(reviewerId);
            if (similarity == null) {
                Optional<CompatibilityEntry> entry = store.getCompatibilityCache(UserPair.of(userId, reviewerId));
                similarity = entry.filter(e -> e.isFresh(now, compatibilityTtl))
                        .map(e -> OptionalDouble.of(e.getScore()))
                        .orElse(OptionalDouble.empty());
                similarities.putIfAbsent(reviewerId, similarity);
            }
            return similarity;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Map<Long, Double> toVector(List<SongRating> ratings) {
        Map<Long, Double> vector = new HashMap<>(Math.max(16, ratings.size() * 2));
        for (SongRating rating : ratings) {
            vector.put(rating.getSongId(), rating.getRating());
        }
        return vector;
    }

    static int normalizeLimit(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private static String currentTraceId() {
        String traceId = MDC.get("requestId");
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }
}
