package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.ScoreComponents;

/**
 * Weights of the six hybrid signals. Passed into the engine so alternative
 * weight sets can be tried without code changes.
 */
public final class HybridWeights {

    private static final HybridWeights DEFAULTS = new HybridWeights(0.25D, 0.30D, 0.20D, 0.10D, 0.10D, 0.05D);

    private final double genre;
    private final double cf;
    private final double community;
    private final double artist;
    private final double language;
    private final double era;

    public HybridWeights(double genre, double cf, double community, double artist, double language, double era) {
        this.genre = requireWeight("genre", genre);
        this.cf = requireWeight("cf", cf);
        this.community = requireWeight("community", community);
        this.artist = requireWeight("artist", artist);
        this.language = requireWeight("language", language);
        this.era = requireWeight("era", era);
    }

    public static HybridWeights defaults() {
        return DEFAULTS;
    }

    /**
     * Weighted sum of the components, clamped to [0, 1].
     */
    public double combine(ScoreComponents c) {
        double sum = genre * c.getGenre()
                + cf * c.getCf()
                + community * c.getCommunity()
                + artist * c.getArtist()
                + language * c.getLanguage()
                + era * c.getEra();
        return ScoreBounds.clampUnit(sum);
    }

    public double getGenre() {
        return genre;
    }

    public double getCf() {
        return cf;
    }

    public double getCommunity() {
        return community;
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

    static double requireWeight(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0D) {
            throw new IllegalArgumentException("weight '" + name + "' must be a finite non-negative number, got " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "HybridWeights{genre=" + genre + ", cf=" + cf + ", community=" + community
                + ", artist=" + artist + ", language=" + language + ", era=" + era + "}";
    }
}
