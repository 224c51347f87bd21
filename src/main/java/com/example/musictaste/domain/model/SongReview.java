package com.example.musictaste.domain.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A user's review of a song. The sentiment annotation is absent until the
 * annotation job has processed the review.
 */
public final class SongReview {

    private final Long id;
    private final long userId;
    private final long songId;
    private final double rating;
    private final String text;
    private final Instant createdAt;
    private final SentimentAnnotation sentiment;

    public SongReview(Long id,
                      long userId,
                      long songId,
                      double rating,
                      String text,
                      Instant createdAt,
                      SentimentAnnotation sentiment) {
        this.id = id;
        this.userId = userId;
        this.songId = songId;
        this.rating = rating;
        this.text = text;
        this.createdAt = createdAt;
        this.sentiment = sentiment;
    }

    public Long getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    public long getSongId() {
        return songId;
    }

    public double getRating() {
        return rating;
    }

    public String getText() {
        return text;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<SentimentAnnotation> getSentiment() {
        return Optional.ofNullable(sentiment);
    }
}
