package com.example.musictaste.application.service;

import com.example.musictaste.common.exception.BusinessException;
import com.example.musictaste.common.exception.ErrorCodes;
import com.example.musictaste.domain.model.Song;
import com.example.musictaste.domain.model.SongReview;
import com.example.musictaste.domain.model.TrendingSong;
import com.example.musictaste.domain.scoring.TrendingScorer;
import com.example.musictaste.infrastructure.persistence.MusicTasteStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Songs with the most time-decayed review engagement over the last seven days.
 */
@Service
public class TrendingService {

    private static final Logger log = LoggerFactory.getLogger(TrendingService.class);

    private final MusicTasteStore store;
    private final MetricsRecorder metrics;
    private final Clock clock;

    @Autowired
    public TrendingService(MusicTasteStore store, ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(store, meterRegistryProvider.getIfAvailable(), Clock.systemUTC());
    }

    TrendingService(MusicTasteStore store, MeterRegistry meterRegistry, Clock clock) {
        this.store = store;
        this.metrics = new MetricsRecorder(meterRegistry);
        this.clock = clock;
    }

    public List<TrendingSong> trending(int limit) {
        int safeLimit = RecommendationService.normalizeLimit(limit);
        long startedAtNanos = System.nanoTime();
        try {
            Instant now = clock.instant();
            List<SongReview> reviews = store.getReviewsCreatedSince(now.minus(TrendingScorer.WINDOW));
            List<Map.Entry<Long, Double>> ranked =
                    TrendingScorer.rank(TrendingScorer.engagementBySong(reviews, now), safeLimit);
            if (ranked.isEmpty()) {
                return Collections.emptyList();
            }

            List<Long> songIds = new ArrayList<>(ranked.size());
            for (Map.Entry<Long, Double> entry : ranked) {
                songIds.add(entry.getKey());
            }
            Map<Long, Song> songsById = new HashMap<>();
            for (Song song : store.getSongsByIds(songIds)) {
                songsById.put(song.getId(), song);
            }

            List<TrendingSong> result = new ArrayList<>(ranked.size());
            for (Map.Entry<Long, Double> entry : ranked) {
                Song song = songsById.get(entry.getKey());
                if (song == null) {
                    log.debug("Trending song missing from catalog, songId={}", entry.getKey());
                    continue;
                }
                result.add(new TrendingSong(song, entry.getValue()));
            }
            log.info("TRENDING_EVENT event=trending_success reviews={} size={} traceId={}",
                    reviews.size(), result.size(), currentTraceId());
            return result;
        } catch (DataAccessException e) {
            log.warn("TRENDING_EVENT event=trending_failure cause={} traceId={}",
                    e.getClass().getSimpleName(), currentTraceId());
            metrics.counter("music.recommend.failure", "operation", "trending");
            throw new BusinessException(ErrorCodes.RECOMMENDATION_UNAVAILABLE, "热门榜单暂时不可用",
                    ErrorCodes.RETRY_LATER, e);
        } finally {
            metrics.duration("music.trending.latency", System.nanoTime() - startedAtNanos);
        }
    }

    private static String currentTraceId() {
        String traceId = MDC.get("requestId");
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }
}
