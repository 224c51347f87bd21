package com.example.musictaste.infrastructure.persistence.mapper;

import com.example.musictaste.infrastructure.persistence.entity.SongReviewEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SongReviewMapper {

    String REVIEW_WITH_SENTIMENT = "SELECT r.id, r.user_id, r.song_id, r.rating, r.review_text, r.created_at, r.updated_at, "
            + "rs.sentiment_score, rs.toxicity_score, rs.emotion_tags "
            + "FROM song_review r "
            + "LEFT JOIN review_sentiment rs ON rs.review_id = r.id ";

    @Select("SELECT id, user_id, song_id, rating, created_at "
            + "FROM song_review WHERE user_id = #{userId} ORDER BY id ASC")
    List<SongReviewEntity> selectRatingsByUser(@Param("userId") long userId);

    @Select(REVIEW_WITH_SENTIMENT + "WHERE r.song_id = #{songId} ORDER BY r.id ASC")
    List<SongReviewEntity> selectBySong(@Param("songId") long songId);

    @Select(REVIEW_WITH_SENTIMENT + "WHERE r.created_at >= #{since} ORDER BY r.created_at ASC, r.id ASC")
    List<SongReviewEntity> selectCreatedSince(@Param("since") LocalDateTime since);

    @Select(REVIEW_WITH_SENTIMENT + "WHERE r.id = #{id}")
    SongReviewEntity selectById(@Param("id") long id);
}
