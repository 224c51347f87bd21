package com.example.musictaste.common.config;

import com.example.musictaste.domain.scoring.HybridWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.recommendation")
public class AppRecommendationProperties {

    /**
     * Max candidates scored per hybrid request.
     */
    private int candidateCap = 1000;

    /**
     * Cold-start pool is this many times the requested limit, most popular first.
     */
    private int coldStartPoolMultiplier = 3;

    /**
     * Worker threads for per-request parallel lookups.
     */
    private int executorThreads = 4;

    private Weights weights = new Weights();

    public HybridWeights toHybridWeights() {
        return new HybridWeights(
                weights.getGenre(),
                weights.getCf(),
                weights.getCommunity(),
                weights.getArtist(),
                weights.getLanguage(),
                weights.getEra());
    }

    @Data
    public static class Weights {
        private double genre = 0.25D;
        private double cf = 0.30D;
        private double community = 0.20D;
        private double artist = 0.10D;
        private double language = 0.10D;
        private double era = 0.05D;
    }
}
