package com.example.musictaste.api.response;

import com.example.musictaste.domain.model.Song;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SongResponse {

    private Long id;
    private Long artistId;
    private String title;
    private List<String> genres;
    private String language;
    private Integer releaseYear;
    private Double popularity30d;

    public static SongResponse from(Song song) {
        return new SongResponse(song.getId(), song.getArtistId(), song.getTitle(),
                new ArrayList<>(song.getGenres()), song.getLanguage(), song.getReleaseYear(),
                song.getPopularity30d());
    }
}
