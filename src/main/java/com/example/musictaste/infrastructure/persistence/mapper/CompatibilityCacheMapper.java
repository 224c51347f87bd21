package com.example.musictaste.infrastructure.persistence.mapper;

import com.example.musictaste.infrastructure.persistence.entity.CompatibilityCacheEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface CompatibilityCacheMapper {

    @Select("SELECT user_low_id, user_high_id, compatibility_score, cf_score, genre_score, artist_score, "
            + "language_score, era_score, calculated_at "
            + "FROM taste_compatibility_cache WHERE user_low_id = #{lowId} AND user_high_id = #{highId}")
    CompatibilityCacheEntity selectByPair(@Param("lowId") long lowId, @Param("highId") long highId);

    @Insert("INSERT INTO taste_compatibility_cache ("
            + "user_low_id, user_high_id, compatibility_score, cf_score, genre_score, artist_score, "
            + "language_score, era_score, calculated_at"
            + ") VALUES ("
            + "#{userLowId}, #{userHighId}, #{compatibilityScore}, #{cfScore}, #{genreScore}, #{artistScore}, "
            + "#{languageScore}, #{eraScore}, #{calculatedAt}"
            + ") ON DUPLICATE KEY UPDATE "
            + "compatibility_score = VALUES(compatibility_score), "
            + "cf_score = VALUES(cf_score), "
            + "genre_score = VALUES(genre_score), "
            + "artist_score = VALUES(artist_score), "
            + "language_score = VALUES(language_score), "
            + "era_score = VALUES(era_score), "
            + "calculated_at = VALUES(calculated_at)")
    int upsert(CompatibilityCacheEntity entity);
}
