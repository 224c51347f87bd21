package com.example.musictaste.infrastructure.persistence.mapper;

import com.example.musictaste.infrastructure.persistence.entity.UserPreferenceEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface UserPreferenceMapper {

    @Select("SELECT user_id, preferred_languages, preferred_eras, favorite_artist_ids, onboarding_completed, updated_at "
            + "FROM user_preference WHERE user_id = #{userId}")
    UserPreferenceEntity selectByUserId(@Param("userId") long userId);
}
