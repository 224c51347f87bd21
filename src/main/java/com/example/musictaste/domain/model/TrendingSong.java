package com.example.musictaste.domain.model;

/**
 * A song with its time-decayed engagement over the trending window.
 */
public final class TrendingSong {

    private final Song song;
    private final double engagement;

    public TrendingSong(Song song, double engagement) {
        this.song = song;
        this.engagement = engagement;
    }

    public Song getSong() {
        return song;
    }

    public double getEngagement() {
        return engagement;
    }
}
