package com.example.musictaste.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * song_review row, optionally joined with its review_sentiment row.
 */
@Data
public class SongReviewEntity {

    private Long id;

    private Long userId;

    private Long songId;

    private Double rating;

    private String reviewText;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private Double sentimentScore;

    private Double toxicityScore;

    /** JSON array. */
    private String emotionTags;
}
