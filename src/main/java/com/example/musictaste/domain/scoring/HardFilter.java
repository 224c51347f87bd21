package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.EraRange;
import com.example.musictaste.domain.model.PreferenceProfile;
import com.example.musictaste.domain.model.Song;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Language/era admission gate applied before any scoring. A rejected song is
 * dropped from the request's candidate set and never reaches a scorer.
 */
public final class HardFilter {

    private HardFilter() {
    }

    public static boolean admits(Song song, PreferenceProfile profile) {
        return admitsLanguage(song, profile) && admitsEra(song, profile);
    }

    public static boolean admitsLanguage(Song song, PreferenceProfile profile) {
        if (profile.getPreferredLanguages().isEmpty()) {
            return true;
        }
        return profile.prefersLanguage(song.getLanguage());
    }

    public static boolean admitsEra(Song song, PreferenceProfile profile) {
        List<EraRange> eras = profile.getPreferredEras();
        if (eras.isEmpty()) {
            return true;
        }
        Integer year = song.getReleaseYear();
        if (year == null) {
            return false;
        }
        for (EraRange era : eras) {
            if (era.contains(year)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Admitted songs in their input order.
     */
    public static List<Song> apply(Collection<Song> candidates, PreferenceProfile profile) {
        List<Song> admitted = new ArrayList<>(candidates.size());
        for (Song song : candidates) {
            if (admits(song, profile)) {
                admitted.add(song);
            }
        }
        return admitted;
    }
}
