package com.example.musictaste.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class CompatibilityCacheEntity {

    private Long userLowId;

    private Long userHighId;

    private Double compatibilityScore;

    private Double cfScore;

    private Double genreScore;

    private Double artistScore;

    private Double languageScore;

    private Double eraScore;

    private LocalDateTime calculatedAt;
}
