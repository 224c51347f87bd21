package com.example.musictaste.common.config;

import com.example.musictaste.domain.scoring.CompatibilityWeights;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.compatibility")
public class AppCompatibilityProperties {

    /**
     * Cached compatibility entries older than this are recomputed.
     */
    private long cacheTtlMinutes = 60L;

    private Weights weights = new Weights();

    public Duration cacheTtl() {
        return Duration.ofMinutes(Math.max(1L, cacheTtlMinutes));
    }

    public CompatibilityWeights toCompatibilityWeights() {
        return new CompatibilityWeights(
                weights.getCf(),
                weights.getGenre(),
                weights.getArtist(),
                weights.getLanguage(),
                weights.getEra());
    }

    @Data
    public static class Weights {
        private double cf = 0.35D;
        private double genre = 0.25D;
        private double artist = 0.15D;
        private double language = 0.15D;
        private double era = 0.10D;
    }
}
