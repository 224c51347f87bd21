package com.example.musictaste.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Asynchronously produced annotation of a review's text.
 * Sentiment is in [-1, 1], toxicity in [0, 1].
 */
public final class SentimentAnnotation {

    private final double sentiment;
    private final double toxicity;
    private final List<String> emotions;

    public SentimentAnnotation(double sentiment, double toxicity, Collection<String> emotions) {
        this.sentiment = Math.max(-1.0D, Math.min(1.0D, sentiment));
        this.toxicity = Math.max(0.0D, Math.min(1.0D, toxicity));
        this.emotions = emotions == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(emotions));
    }

    public static SentimentAnnotation neutral() {
        return new SentimentAnnotation(0.0D, 0.0D, Collections.emptyList());
    }

    public double getSentiment() {
        return sentiment;
    }

    public double getToxicity() {
        return toxicity;
    }

    public List<String> getEmotions() {
        return emotions;
    }
}
