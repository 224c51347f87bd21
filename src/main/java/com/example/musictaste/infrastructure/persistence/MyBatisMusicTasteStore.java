package com.example.musictaste.infrastructure.persistence;

import com.example.musictaste.domain.model.CompatibilityBreakdown;
import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.domain.model.FollowEdges;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.SentimentAnnotation;
import com.example.musictaste.domain.model.Song;
import com.example.musictaste.domain.model.SongRating;
import com.example.musictaste.domain.model.SongReview;
import com.example.musictaste.domain.model.UserPair;
import com.example.musictaste.infrastructure.persistence.entity.CompatibilityCacheEntity;
import com.example.musictaste.infrastructure.persistence.entity.ReviewSentimentEntity;
import com.example.musictaste.infrastructure.persistence.entity.SongEntity;
import com.example.musictaste.infrastructure.persistence.entity.SongReviewEntity;
import com.example.musictaste.infrastructure.persistence.entity.UserPreferenceEntity;
import com.example.musictaste.infrastructure.persistence.mapper.CompatibilityCacheMapper;
import com.example.musictaste.infrastructure.persistence.mapper.FollowMapper;
import com.example.musictaste.infrastructure.persistence.mapper.ReviewSentimentMapper;
import com.example.musictaste.infrastructure.persistence.mapper.SongMapper;
import com.example.musictaste.infrastructure.persistence.mapper.SongReviewMapper;
import com.example.musictaste.infrastructure.persistence.mapper.UserPreferenceMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@link MusicTasteStore} backed by MySQL through the MyBatis mappers.
 * Timestamps are stored as UTC {@code DATETIME}s.
 */
@Component
public class MyBatisMusicTasteStore implements MusicTasteStore {

    private static final Logger log = LoggerFactory.getLogger(MyBatisMusicTasteStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {
    };
    private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<List<Long>>() {
    };
    private static final TypeReference<List<Map<String, Integer>>> ERA_LIST =
            new TypeReference<List<Map<String, Integer>>>() {
            };

    private final SongMapper songMapper;
    private final SongReviewMapper songReviewMapper;
    private final ReviewSentimentMapper reviewSentimentMapper;
    private final UserPreferenceMapper userPreferenceMapper;
    private final FollowMapper followMapper;
    private final CompatibilityCacheMapper compatibilityCacheMapper;
    private final ObjectMapper objectMapper;

    public MyBatisMusicTasteStore(SongMapper songMapper,
                                  SongReviewMapper songReviewMapper,
                                  ReviewSentimentMapper reviewSentimentMapper,
                                  UserPreferenceMapper userPreferenceMapper,
                                  FollowMapper followMapper,
                                  CompatibilityCacheMapper compatibilityCacheMapper,
                                  ObjectMapper objectMapper) {
        this.songMapper = songMapper;
        this.songReviewMapper = songReviewMapper;
        this.reviewSentimentMapper = reviewSentimentMapper;
        this.userPreferenceMapper = userPreferenceMapper;
        this.followMapper = followMapper;
        this.compatibilityCacheMapper = compatibilityCacheMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public PreferenceProfile getPreferenceProfile(long userId) {
        UserPreferenceEntity entity = userPreferenceMapper.selectByUserId(userId);
        if (entity == null) {
            return PreferenceProfile.empty();
        }
        List<String> languages = readJson(entity.getPreferredLanguages(), STRING_LIST, "preferred_languages", userId)
                .stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .collect(Collectors.toList());
        List<Long> artists = readJson(entity.getFavoriteArtistIds(), LONG_LIST, "favorite_artist_ids", userId);
        return new PreferenceProfile(languages, toEras(entity.getPreferredEras(), userId), artists);
    }

    @Override
    public List<SongRating> getReviewsByUser(long userId) {
        List<SongReviewEntity> rows = songReviewMapper.selectRatingsByUser(userId);
        List<SongRating> ratings = new ArrayList<>(rows.size());
        for (SongReviewEntity row : rows) {
            if (row.getSongId() == null || row.getRating() == null) {
                continue;
            }
            ratings.add(new SongRating(row.getSongId(), row.getRating()));
        }
        return ratings;
    }

    @Override
    public List<SongReview> getReviewsBySong(long songId) {
        return toReviews(songReviewMapper.selectBySong(songId));
    }

    @Override
    public List<String> getGenresRatedAtLeast(long userId, double minRating) {
        return songMapper.selectGenresRatedAtLeast(userId, minRating);
    }

    @Override
    public List<Song> getCandidateSongs(Collection<String> languages, List<EraRange> eras, int cap) {
        if (cap <= 0) {
            return Collections.emptyList();
        }
        return toSongs(songMapper.selectCandidates(languages, eras, cap));
    }

    @Override
    public List<Song> getSongsByIds(Collection<Long> songIds) {
        if (songIds == null || songIds.isEmpty()) {
            return Collections.emptyList();
        }
        return toSongs(songMapper.selectByIds(songIds));
    }

    @Override
    public List<SongReview> getReviewsCreatedSince(Instant since) {
        return toReviews(songReviewMapper.selectCreatedSince(toLocal(since)));
    }

    @Override
    public Optional<SongReview> getReview(long reviewId) {
        SongReviewEntity row = songReviewMapper.selectById(reviewId);
        return row == null ? Optional.empty() : Optional.of(toReview(row));
    }

    @Override
    public FollowEdges getFollowEdges(long userId) {
        return new FollowEdges(followMapper.selectFollowingIds(userId), followMapper.selectFollowerIds(userId));
    }

    @Override
    public Optional<CompatibilityEntry> getCompatibilityCache(UserPair pair) {
        CompatibilityCacheEntity row = compatibilityCacheMapper.selectByPair(pair.getLowUserId(), pair.getHighUserId());
        if (row == null) {
            return Optional.empty();
        }
        CompatibilityBreakdown breakdown = new CompatibilityBreakdown(
                orZero(row.getCfScore()),
                orZero(row.getGenreScore()),
                orZero(row.getArtistScore()),
                orZero(row.getLanguageScore()),
                orZero(row.getEraScore()));
        return Optional.of(new CompatibilityEntry(orZero(row.getCompatibilityScore()), breakdown,
                toInstant(row.getCalculatedAt())));
    }

    @Override
    public void upsertCompatibilityCache(UserPair pair, CompatibilityEntry entry) {
        CompatibilityCacheEntity row = new CompatibilityCacheEntity();
        row.setUserLowId(pair.getLowUserId());
        row.setUserHighId(pair.getHighUserId());
        row.setCompatibilityScore(entry.getScore());
        row.setCfScore(entry.getBreakdown().getCf());
        row.setGenreScore(entry.getBreakdown().getGenre());
        row.setArtistScore(entry.getBreakdown().getArtist());
        row.setLanguageScore(entry.getBreakdown().getLanguage());
        row.setEraScore(entry.getBreakdown().getEra());
        row.setCalculatedAt(toLocal(entry.getComputedAt()));
        compatibilityCacheMapper.upsert(row);
    }

    @Override
    public void upsertSentiment(long reviewId, SentimentAnnotation annotation) {
        ReviewSentimentEntity row = new ReviewSentimentEntity();
        row.setReviewId(reviewId);
        row.setSentimentScore(annotation.getSentiment());
        row.setToxicityScore(annotation.getToxicity());
        row.setEmotionTags(writeJson(annotation.getEmotions()));
        row.setProcessedAt(LocalDateTime.now(ZoneOffset.UTC));
        reviewSentimentMapper.upsert(row);
    }

    private List<Song> toSongs(List<SongEntity> rows) {
        List<Song> songs = new ArrayList<>(rows.size());
        for (SongEntity row : rows) {
            List<String> genres = StringUtils.hasText(row.getGenres())
                    ? Arrays.stream(row.getGenres().split(","))
                    .map(String::trim)
                    .filter(StringUtils::hasText)
                    .collect(Collectors.toList())
                    : Collections.emptyList();
            songs.add(new Song(
                    row.getId(),
                    row.getArtistId(),
                    row.getTitle(),
                    genres,
                    row.getLanguage(),
                    row.getReleaseYear(),
                    orZero(row.getPopularity30d())));
        }
        return songs;
    }

    private List<SongReview> toReviews(List<SongReviewEntity> rows) {
        List<SongReview> reviews = new ArrayList<>(rows.size());
        for (SongReviewEntity row : rows) {
            reviews.add(toReview(row));
        }
        return reviews;
    }

    private SongReview toReview(SongReviewEntity row) {
        SentimentAnnotation sentiment = null;
        if (row.getSentimentScore() != null || row.getToxicityScore() != null) {
            sentiment = new SentimentAnnotation(
                    orZero(row.getSentimentScore()),
                    orZero(row.getToxicityScore()),
                    readJson(row.getEmotionTags(), STRING_LIST, "emotion_tags", row.getId()));
        }
        return new SongReview(
                row.getId(),
                row.getUserId() == null ? 0L : row.getUserId(),
                row.getSongId() == null ? 0L : row.getSongId(),
                orZero(row.getRating()),
                row.getReviewText(),
                toInstant(row.getCreatedAt()),
                sentiment);
    }

    private List<EraRange> toEras(String json, long userId) {
        List<EraRange> eras = new ArrayList<>();
        for (Map<String, Integer> raw : readJson(json, ERA_LIST, "preferred_eras", userId)) {
            Integer start = raw.get("start");
            Integer end = raw.get("end");
            if (start == null || end == null || start > end) {
                log.warn("Skipped malformed era range userId={} era={}", userId, raw);
                continue;
            }
            eras.add(new EraRange(start, end));
        }
        return eras;
    }

    private <T> List<T> readJson(String json, TypeReference<List<T>> type, String column, Object rowId) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        try {
            List<T> values = objectMapper.readValue(json, type);
            return values == null ? Collections.emptyList() : values;
        } catch (JsonProcessingException e) {
            log.warn("Ignored unreadable JSON column={} rowId={}", column, rowId, e);
            return Collections.emptyList();
        }
    }

    private String writeJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize emotion tags", e);
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0.0D : value;
    }

    private static Instant toInstant(LocalDateTime value) {
        return value == null ? null : value.toInstant(ZoneOffset.UTC);
    }

    private static LocalDateTime toLocal(Instant value) {
        return value == null ? null : LocalDateTime.ofInstant(value, ZoneOffset.UTC);
    }
}
