package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.TrendingSong;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrendingSongResponse {

    private int rank;
    private SongResponse song;
    private double engagement;

    public static TrendingSongResponse from(int rank, TrendingSong trending) {
        return new TrendingSongResponse(rank, SongResponse.from(trending.getSong()), trending.getEngagement());
    }
}
