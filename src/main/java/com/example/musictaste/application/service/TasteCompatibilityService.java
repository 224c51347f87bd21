package com.example.musictaste.application.service;

import com.example.musictaste.common.config.AppCompatibilityProperties;
import com.example.musictaste.common.exception.BusinessException;
import com.example.musictaste.common.exception.ErrorCodes;
import com.example.musictaste.domain.model.CompatibilityBreakdown;
import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.CompatibilityResult;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.SongRating;
import com.example.musictaste.domain.model.UserPair;
import com.example.musictaste.domain.scoring.CompatibilityWeights;
import com.example.musictaste.domain.scoring.GenreProfile;
import com.example.musictaste.domain.scoring.TasteCompatibilityCalculator;
import com.example.musictaste.infrastructure.persistence.MusicTasteStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
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
 * Symmetric taste compatibility between two users, cached per unordered pair.
 * <p>
 * A cached entry younger than the configured TTL is returned as-is. Otherwise
 * all five components are recomputed and the pair's cache row is overwritten.
 */
@Service
public class TasteCompatibilityService {

    private static final Logger log = LoggerFactory.getLogger(TasteCompatibilityService.class);

    private final MusicTasteStore store;
    private final CompatibilityWeights weights;
    private final Duration cacheTtl;
    private final Executor executor;
    private final MetricsRecorder metrics;
    private final Clock clock;

    @Autowired
    public TasteCompatibilityService(MusicTasteStore store,
                                     AppCompatibilityProperties properties,
                                     @Qualifier("recommendationExecutor") ExecutorService executor,
                                     ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(store, properties.toCompatibilityWeights(), properties.cacheTtl(), executor,
                meterRegistryProvider.getIfAvailable(), Clock.systemUTC());
    }

    TasteCompatibilityService(MusicTasteStore store,
                              CompatibilityWeights weights,
                              Duration cacheTtl,
                              Executor executor,
                              MeterRegistry meterRegistry,
                              Clock clock) {
        this.store = store;
        this.weights = weights;
        this.cacheTtl = cacheTtl;
        this.executor = executor;
        this.metrics = new MetricsRecorder(meterRegistry);
        this.clock = clock;
    }

    public CompatibilityResult compatibility(Long userId, Long otherUserId) {
        if (userId == null || userId <= 0 || otherUserId == null || otherUserId <= 0) {
            throw new BusinessException(ErrorCodes.BAD_REQUEST, "userId不合法", "请检查用户后重试");
        }
        if (userId.equals(otherUserId)) {
            throw new BusinessException(ErrorCodes.BAD_REQUEST, "不能与自己计算品味匹配度");
        }
        UserPair pair = UserPair.of(userId, otherUserId);
        Instant now = clock.instant();
        try {
            Optional<CompatibilityEntry> cached = store.getCompatibilityCache(pair);
            if (cached.isPresent() && cached.get().isFresh(now, cacheTtl)) {
                metrics.counter("music.compatibility.cache.hit");
                log.info("COMPATIBILITY_EVENT event=cache_hit pair={} percentage={} traceId={}",
                        pair, cached.get().percentage(), currentTraceId());
                return new CompatibilityResult(pair, cached.get(), true);
            }
            metrics.counter("music.compatibility.cache.miss");

            CompatibilityEntry entry = compute(pair, now);
            store.upsertCompatibilityCache(pair, entry);
            log.info("COMPATIBILITY_EVENT event=computed pair={} percentage={} stale={} traceId={}",
                    pair, entry.percentage(), cached.isPresent(), currentTraceId());
            return new CompatibilityResult(pair, entry, false);
        } catch (DataAccessException e) {
            log.warn("COMPATIBILITY_EVENT event=compatibility_failure pair={} cause={} traceId={}",
                    pair, e.getClass().getSimpleName(), currentTraceId());
            throw new BusinessException(ErrorCodes.COMPATIBILITY_UNAVAILABLE, "品味匹配度暂时不可用",
                    ErrorCodes.RETRY_LATER, e);
        } catch (RejectedExecutionException e) {
            log.warn("COMPATIBILITY_EVENT event=compatibility_rejected pair={} message={} traceId={}",
                    pair, e.getMessage(), currentTraceId());
            throw new BusinessException(ErrorCodes.COMPATIBILITY_UNAVAILABLE, "品味匹配度暂时不可用",
                    ErrorCodes.RETRY_LATER, e);
        }
    }

    private CompatibilityEntry compute(UserPair pair, Instant now) {
        long low = pair.getLowUserId();
        long high = pair.getHighUserId();
        CompletableFuture<List<SongRating>> ratingsLow = AsyncLookups.supply(() -> store.getReviewsByUser(low), executor);
        CompletableFuture<List<SongRating>> ratingsHigh = AsyncLookups.supply(() -> store.getReviewsByUser(high), executor);
        CompletableFuture<GenreProfile> genresLow = AsyncLookups.supply(() -> GenreProfile.fromOccurrences(
                store.getGenresRatedAtLeast(low, GenreProfile.LIKED_RATING)), executor);
        CompletableFuture<GenreProfile> genresHigh = AsyncLookups.supply(() -> GenreProfile.fromOccurrences(
                store.getGenresRatedAtLeast(high, GenreProfile.LIKED_RATING)), executor);
        CompletableFuture<PreferenceProfile> profileLow = AsyncLookups.supply(() -> store.getPreferenceProfile(low), executor);
        CompletableFuture<PreferenceProfile> profileHigh = AsyncLookups.supply(() -> store.getPreferenceProfile(high), executor);

        CompatibilityBreakdown breakdown = TasteCompatibilityCalculator.breakdown(
                toVector(AsyncLookups.join(ratingsLow)),
                toVector(AsyncLookups.join(ratingsHigh)),
                AsyncLookups.join(genresLow),
                AsyncLookups.join(genresHigh),
                AsyncLookups.join(profileLow),
                AsyncLookups.join(profileHigh));
        return new CompatibilityEntry(weights.combine(breakdown), breakdown, now);
    }

    private static Map<Long, Double> toVector(List<SongRating> ratings) {
        Map<Long, Double> vector = new HashMap<>();
        for (SongRating rating : ratings) {
            vector.put(rating.getSongId(), rating.getRating());
        }
        return vector;
    }

    private static String currentTraceId() {
        String traceId = MDC.get("requestId");
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }
}
