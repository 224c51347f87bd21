package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.ScoreComponents;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreComponentsResponse {

    private double genre;
    private double cf;
    private double community;
    private double artist;
    private double language;
    private double era;

    public static ScoreComponentsResponse from(ScoreComponents c) {
        return new ScoreComponentsResponse(c.getGenre(), c.getCf(), c.getCommunity(),
                c.getArtist(), c.getLanguage(), c.getEra());
    }
}
