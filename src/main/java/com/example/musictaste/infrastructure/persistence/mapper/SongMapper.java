package com.example.musictaste.infrastructure.persistence.mapper;

import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.infrastructure.persistence.entity.SongEntity;
import java.util.Collection;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SongMapper {

    /**
     * Candidate pool for recommendation, most popular first.
     * <p>
     * Languages and eras narrow the pool in SQL when given; the engine applies
     * the same predicate again in memory.
     */
    @Select("<script>"
            + "SELECT s.id, s.artist_id, s.title, s.language, s.release_year, s.popularity_30d, s.created_at, "
            + "  GROUP_CONCAT(sg.genre ORDER BY sg.genre SEPARATOR ',') AS genres "
            + "FROM song s "
            + "LEFT JOIN song_genre sg ON sg.song_id = s.id "
            + "<where>"
            + "  <if test='languages != null and languages.size() > 0'>"
            + "    s.language IN "
            + "    <foreach collection='languages' item='lang' open='(' separator=',' close=')'>#{lang}</foreach>"
            + "  </if>"
            + "  <if test='eras != null and eras.size() > 0'>"
            + "    AND <foreach collection='eras' item='era' open='(' separator=' OR ' close=')'>"
            + "      (s.release_year BETWEEN #{era.start} AND #{era.end})"
            + "    </foreach>"
            + "  </if>"
            + "</where>"
            + "GROUP BY s.id "
            + "ORDER BY s.popularity_30d DESC, s.id ASC "
            + "LIMIT #{limit}"
            + "</script>")
    List<SongEntity> selectCandidates(@Param("languages") Collection<String> languages,
                                      @Param("eras") List<EraRange> eras,
                                      @Param("limit") int limit);

    @Select("<script>"
            + "SELECT s.id, s.artist_id, s.title, s.language, s.release_year, s.popularity_30d, s.created_at, "
            + "  GROUP_CONCAT(sg.genre ORDER BY sg.genre SEPARATOR ',') AS genres "
            + "FROM song s "
            + "LEFT JOIN song_genre sg ON sg.song_id = s.id "
            + "WHERE s.id IN "
            + "<foreach collection='ids' item='id' open='(' separator=',' close=')'>#{id}</foreach> "
            + "GROUP BY s.id"
            + "</script>")
    List<SongEntity> selectByIds(@Param("ids") Collection<Long> ids);

    /**
     * One row per (reviewed song, genre) for the user's reviews at or above
     * the given rating, oldest review first.
     */
    @Select("SELECT sg.genre "
            + "FROM song_review r "
            + "INNER JOIN song_genre sg ON sg.song_id = r.song_id "
            + "WHERE r.user_id = #{userId} AND r.rating >= #{minRating} "
            + "ORDER BY r.created_at ASC, r.id ASC, sg.genre ASC")
    List<String> selectGenresRatedAtLeast(@Param("userId") long userId, @Param("minRating") double minRating);
}
