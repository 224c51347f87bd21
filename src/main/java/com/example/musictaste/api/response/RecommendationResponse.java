package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.Recommendation;
import com.example.musictaste.domain.model.ScoredSong;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

    private Long userId;
    private String mode;
    private List<ScoredSongResponse> songs;

    public static RecommendationResponse from(Recommendation recommendation) {
        List<ScoredSongResponse> songs = new ArrayList<>(recommendation.getSongs().size());
        for (ScoredSong scored : recommendation.getSongs()) {
            songs.add(ScoredSongResponse.from(scored));
        }
        return new RecommendationResponse(recommendation.getUserId(), recommendation.getMode().name(), songs);
    }
}
