package com.example.musictaste.infrastructure.persistence.mapper;

import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface FollowMapper {

    @Select("SELECT following_id FROM user_follow WHERE follower_id = #{userId}")
    List<Long> selectFollowingIds(@Param("userId") long userId);

    @Select("SELECT follower_id FROM user_follow WHERE following_id = #{userId}")
    List<Long> selectFollowerIds(@Param("userId") long userId);
}
