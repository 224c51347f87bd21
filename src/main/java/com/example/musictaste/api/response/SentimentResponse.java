package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.SentimentAnnotation;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SentimentResponse {

    private Long reviewId;
    private double sentiment;
    private double toxicity;
    private List<String> emotions;

    public static SentimentResponse from(Long reviewId, SentimentAnnotation annotation) {
        return new SentimentResponse(reviewId, annotation.getSentiment(), annotation.getToxicity(),
                new ArrayList<>(annotation.getEmotions()));
    }
}
