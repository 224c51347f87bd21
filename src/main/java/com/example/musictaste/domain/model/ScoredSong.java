package com.example.musictaste.domain.model;

/**
 * A candidate song with its final score. Components are only present for
 * hybrid scoring; cold-start scores are an unbounded ranking heuristic.
 */
public final class ScoredSong {

    private final Song song;
    private final double score;
    private final ScoreComponents components;

    public ScoredSong(Song song, double score, ScoreComponents components) {
        this.song = song;
        this.score = score;
        this.components = components;
    }

    public static ScoredSong coldStart(Song song, double score) {
        return new ScoredSong(song, score, null);
    }

    public Song getSong() {
        return song;
    }

    public double getScore() {
        return score;
    }

    public ScoreComponents getComponents() {
        return components;
    }
}
