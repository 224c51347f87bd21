package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.CompatibilityBreakdown;
import com.example.musictaste.domain.model.CompatibilityEntry;
import com.example.musictaste.domain.model.CompatibilityResult;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityResponse {

    private Long userLowId;
    private Long userHighId;
    private int percentage;
    private double score;
    private Components components;
    private Instant computedAt;
    private boolean cached;

    public static CompatibilityResponse from(CompatibilityResult result) {
        CompatibilityEntry entry = result.getEntry();
        CompatibilityBreakdown b = entry.getBreakdown();
        return new CompatibilityResponse(
                result.getPair().getLowUserId(),
                result.getPair().getHighUserId(),
                entry.percentage(),
                entry.getScore(),
                new Components(b.getCf(), b.getGenre(), b.getArtist(), b.getLanguage(), b.getEra()),
                entry.getComputedAt(),
                result.isCached());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Components {
        private double cf;
        private double genre;
        private double artist;
        private double language;
        private double era;
    }
}
