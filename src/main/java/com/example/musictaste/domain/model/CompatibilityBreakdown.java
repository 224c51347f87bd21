package com.example.musictaste.domain.model;

/**
 * The five component similarities of a taste compatibility score, each in [0, 1].
 */
public final class CompatibilityBreakdown {

    private final double cf;
    private final double genre;
    private final double artist;
    private final double language;
    private final double era;

    public CompatibilityBreakdown(double cf, double genre, double artist, double language, double era) {
        this.cf = cf;
        this.genre = genre;
        this.artist = artist;
        this.language = language;
        this.era = era;
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
