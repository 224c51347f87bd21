package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.CompatibilityBreakdown;

/**
 * Weights of the five taste compatibility components.
 */
public final class CompatibilityWeights {

    private static final CompatibilityWeights DEFAULTS = new CompatibilityWeights(0.35D, 0.25D, 0.15D, 0.15D, 0.10D);

    private final double cf;
    private final double genre;
    private final double artist;
    private final double language;
    private final double era;

    public CompatibilityWeights(double cf, double genre, double artist, double language, double era) {
        this.cf = HybridWeights.requireWeight("cf", cf);
        this.genre = HybridWeights.requireWeight("genre", genre);
        this.artist = HybridWeights.requireWeight("artist", artist);
        this.language = HybridWeights.requireWeight("language", language);
        this.era = HybridWeights.requireWeight("era", era);
    }

    public static CompatibilityWeights defaults() {
        return DEFAULTS;
    }

    public double combine(CompatibilityBreakdown b) {
        double sum = cf * b.getCf()
                + genre * b.getGenre()
                + artist * b.getArtist()
                + language * b.getLanguage()
                + era * b.getEra();
        return ScoreBounds.clampUnit(sum);
    }

    public double getCf() {
        return cf;
    }

    public double getGenre() {
        return genre;
    }

    public double getArtist() {
        return artist;
    }

    public double getLanguage() {
        return language;
    }

    public double getEra() {
        return era;
    }
}
