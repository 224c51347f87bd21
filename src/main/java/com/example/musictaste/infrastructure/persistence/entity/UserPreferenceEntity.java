package com.example.musictaste.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class UserPreferenceEntity {

    private Long userId;

    /** JSON array of language codes. */
    private String preferredLanguages;

    /** JSON array of {"start":..,"end":..} objects. */
    private String preferredEras;

    /** JSON array of artist ids. */
    private String favoriteArtistIds;

    private Integer onboardingCompleted;

    private LocalDateTime updatedAt;
}
