package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.ScoredSong;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScoredSongResponse {

    private SongResponse song;
    private double score;
    /** Absent for cold-start results. */
    private ScoreComponentsResponse components;

    public static ScoredSongResponse from(ScoredSong scored) {
        return new ScoredSongResponse(
                SongResponse.from(scored.getSong()),
                scored.getScore(),
                scored.getComponents() == null ? null : ScoreComponentsResponse.from(scored.getComponents()));
    }
}
