package com.example.musictaste.domain.sentiment;

import com.example.musictaste.domain.model.SentimentAnnotation;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Word-list heuristic that turns review text into a {@link SentimentAnnotation}.
 * <p>
 * Sentiment is {@code (positive - negative) / (positive + negative)}. Toxicity is
 * five times the share of toxic words, plus 0.3 for near-empty reviews, capped at 1.
 * Emotion tags are the groups with at least one keyword present.
 */
@Component
public class ReviewSentimentAnalyzer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]");

    private static final int SHORT_REVIEW_CHARS = 10;
    private static final double SHORT_REVIEW_PENALTY = 0.3D;
    private static final double TOXIC_SHARE_FACTOR = 5.0D;

    private static final Set<String> POSITIVE = words(
            "love", "amazing", "beautiful", "perfect", "great", "excellent", "wonderful",
            "fantastic", "brilliant", "awesome", "incredible", "outstanding", "superb",
            "masterpiece", "genius", "epic", "legendary", "iconic", "phenomenal",
            "best", "favorite", "adore", "enjoy", "like", "happy", "joyful", "uplifting",
            "inspiring", "moving", "powerful", "stunning", "gorgeous", "divine");

    private static final Set<String> NEGATIVE = words(
            "hate", "terrible", "awful", "horrible", "worst", "bad", "poor", "disappointing",
            "boring", "dull", "mediocre", "trash", "garbage", "waste", "sucks", "lame",
            "annoying", "irritating", "overrated", "unlistenable", "painful", "cringe");

    private static final Set<String> TOXIC = words(
            "stupid", "idiot", "moron", "dumb", "trash", "garbage", "sucks", "kill",
            "die", "hate", "disgusting", "pathetic", "loser", "ugly", "worthless");

    private static final Map<String, Set<String>> EMOTIONS = new LinkedHashMap<>();

    static {
        EMOTIONS.put("joy", words("happy", "joyful", "cheerful", "upbeat", "fun", "playful", "energetic"));
        EMOTIONS.put("sadness", words("sad", "melancholy", "depressing", "somber", "dark", "emotional", "tearjerker"));
        EMOTIONS.put("anger", words("angry", "aggressive", "intense", "powerful", "furious", "rage"));
        EMOTIONS.put("nostalgia", words("nostalgic", "memories", "reminds", "throwback", "classic", "timeless"));
        EMOTIONS.put("calm", words("calm", "peaceful", "relaxing", "soothing", "chill", "ambient", "tranquil"));
        EMOTIONS.put("energetic", words("energetic", "hype", "pumped", "exciting", "vibrant", "dynamic"));
    }

    public SentimentAnnotation analyze(String text) {
        if (text == null || text.trim().isEmpty()) {
            return SentimentAnnotation.neutral();
        }
        String[] tokens = WHITESPACE.split(text.trim().toLowerCase(Locale.ROOT));

        int positive = 0;
        int negative = 0;
        int toxic = 0;
        Set<String> emotions = new LinkedHashSet<>();
        for (String token : tokens) {
            String word = NON_WORD.matcher(token).replaceAll("");
            if (word.isEmpty()) {
                continue;
            }
            if (POSITIVE.contains(word)) {
                positive++;
            }
            if (NEGATIVE.contains(word)) {
                negative++;
            }
            if (TOXIC.contains(word)) {
                toxic++;
            }
            for (Map.Entry<String, Set<String>> group : EMOTIONS.entrySet()) {
                if (group.getValue().contains(word)) {
                    emotions.add(group.getKey());
                }
            }
        }

        int polar = positive + negative;
        double sentiment = polar == 0 ? 0.0D : (double) (positive - negative) / polar;
        double toxicity = Math.min(1.0D, (double) toxic / Math.max(1, tokens.length) * TOXIC_SHARE_FACTOR);
        if (text.trim().length() < SHORT_REVIEW_CHARS) {
            toxicity = Math.min(1.0D, toxicity + SHORT_REVIEW_PENALTY);
        }
        return new SentimentAnnotation(sentiment, toxicity, emotions);
    }

    private static Set<String> words(String... words) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(words)));
    }
}
