package com.example.musictaste.infrastructure.persistence.mapper;

import com.example.musictaste.infrastructure.persistence.entity.ReviewSentimentEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ReviewSentimentMapper {

    @Insert("INSERT INTO review_sentiment (review_id, sentiment_score, toxicity_score, emotion_tags, processed_at) "
            + "VALUES (#{reviewId}, #{sentimentScore}, #{toxicityScore}, #{emotionTags}, #{processedAt}) "
            + "ON DUPLICATE KEY UPDATE "
            + "sentiment_score = VALUES(sentiment_score), "
            + "toxicity_score = VALUES(toxicity_score), "
            + "emotion_tags = VALUES(emotion_tags), "
            + "processed_at = VALUES(processed_at)")
    int upsert(ReviewSentimentEntity entity);
}
