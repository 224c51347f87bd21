package com.example.musictaste.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Immutable catalog entry as seen by the scoring engine.
 */
public final class Song {

    private final Long id;
    private final Long artistId;
    private final String title;
    private final List<String> genres;
    private final String language;
    private final Integer releaseYear;
    private final double popularity30d;

    public Song(Long id,
                Long artistId,
                String title,
                Collection<String> genres,
                String language,
                Integer releaseYear,
                double popularity30d) {
        this.id = id;
        this.artistId = artistId;
        this.title = title;
        this.genres = genres == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(genres));
        this.language = language;
        this.releaseYear = releaseYear;
        this.popularity30d = popularity30d;
    }

    public Long getId() {
        return id;
    }

    public Long getArtistId() {
        return artistId;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getGenres() {
        return genres;
    }

    public String getLanguage() {
        return language;
    }

    public Integer getReleaseYear() {
        return releaseYear;
    }

    public double getPopularity30d() {
        return popularity30d;
    }

    @Override
    public String toString() {
        return "Song{id=" + id + ", title=" + title + ", language=" + language + ", year=" + releaseYear + "}";
    }
}
