package com.example.musictaste.domain.model;

/**
 * Per-signal scores of a hybrid recommendation, each in [0, 1].
 */
public final class ScoreComponents {

    private final double genre;
    private final double cf;
    private final double community;
    private final double artist;
    private final double language;
    private final double era;

    public ScoreComponents(double genre, double cf, double community, double artist, double language, double era) {
        this.genre = genre;
        this.cf = cf;
        this.community = community;
        this.artist = artist;
        this.language = language;
        this.era = era;
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
}
