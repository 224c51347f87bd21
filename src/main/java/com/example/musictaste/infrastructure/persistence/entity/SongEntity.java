package com.example.musictaste.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SongEntity {

    private Long id;

    private Long artistId;

    private String title;

    /** Comma separated genre tags, aggregated from song_genre. */
    private String genres;

    private String language;

    private Integer releaseYear;

    private Double popularity30d;

    private LocalDateTime createdAt;
}
