package com.example.musictaste.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Onboarding preferences of one user. Empty collections mean "no restriction".
 */
public final class PreferenceProfile {

    public static final int MAX_FAVORITE_ARTISTS = 4;

    private static final PreferenceProfile EMPTY =
            new PreferenceProfile(Collections.emptySet(), Collections.emptyList(), Collections.emptyList());

    private final Set<String> preferredLanguages;
    private final List<EraRange> preferredEras;
    private final Set<Long> favoriteArtistIds;

    public PreferenceProfile(Collection<String> preferredLanguages,
                             List<EraRange> preferredEras,
                             Collection<Long> favoriteArtistIds) {
        this.preferredLanguages = Collections.unmodifiableSet(new LinkedHashSet<>(nullSafe(preferredLanguages)));
        this.preferredEras = Collections.unmodifiableList(new ArrayList<>(nullSafe(preferredEras)));
        Set<Long> artists = new LinkedHashSet<>();
        for (Long artistId : nullSafe(favoriteArtistIds)) {
            if (artistId != null && artists.size() < MAX_FAVORITE_ARTISTS) {
                artists.add(artistId);
            }
        }
        this.favoriteArtistIds = Collections.unmodifiableSet(artists);
    }

    public static PreferenceProfile empty() {
        return EMPTY;
    }

    public Set<String> getPreferredLanguages() {
        return preferredLanguages;
    }

    public List<EraRange> getPreferredEras() {
        return preferredEras;
    }

    public Set<Long> getFavoriteArtistIds() {
        return favoriteArtistIds;
    }

    public boolean prefersLanguage(String language) {
        return language != null && preferredLanguages.contains(language);
    }

    public boolean isFavoriteArtist(Long artistId) {
        return artistId != null && favoriteArtistIds.contains(artistId);
    }

    private static <T> Collection<T> nullSafe(Collection<T> values) {
        return values == null ? Collections.emptyList() : values;
    }
}
