package com.example.musictaste.domain.model;

/**
 * One (song, rating) entry of a user's rating vector.
 */
public final class SongRating {

    private final long songId;
    private final double rating;

    public SongRating(long songId, double rating) {
        this.songId = songId;
        this.rating = rating;
    }

    public long getSongId() {
        return songId;
    }

    public double getRating() {
        return rating;
    }
}
