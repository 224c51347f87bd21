package com.example.musictaste.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ReviewSentimentEntity {

    private Long reviewId;

    private Double sentimentScore;

    private Double toxicityScore;

    private String emotionTags;

    private LocalDateTime processedAt;
}
