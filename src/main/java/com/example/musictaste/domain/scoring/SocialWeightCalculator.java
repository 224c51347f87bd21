package com.example.musictaste.domain.scoring;

import com.example.musictaste.domain.model.FollowEdges;
import java.util.OptionalDouble;

/**
 * Multiplier applied to a reviewer's influence on the viewer's community score.
 * <p>
 * Base weight comes from the follow graph (mutual 1.5, viewer follows
 * reviewer 1.2, otherwise 1.0). A taste similarity above 0.7 adds 0.3 on top
 * of whichever base applies. The combined weight is not capped.
 */
public final class SocialWeightCalculator {

    public static final double BASE_WEIGHT = 1.0D;
    public static final double FOLLOWING_WEIGHT = 1.2D;
    public static final double MUTUAL_WEIGHT = 1.5D;
    public static final double SIMILARITY_BONUS = 0.3D;
    public static final double SIMILARITY_THRESHOLD = 0.7D;

    private SocialWeightCalculator() {
    }

    /**
     * @param viewerEdges follow edges of the viewer
     * @param reviewerId  author of the review being weighted
     * @param similarity  viewer/reviewer taste similarity if one is known
     */
    public static double weight(FollowEdges viewerEdges, long reviewerId, OptionalDouble similarity) {
        double weight = baseWeight(viewerEdges, reviewerId);
        if (similarity.isPresent() && similarity.getAsDouble() > SIMILARITY_THRESHOLD) {
            weight += SIMILARITY_BONUS;
        }
        return weight;
    }

    static double baseWeight(FollowEdges viewerEdges, long reviewerId) {
        boolean following = viewerEdges.follows(reviewerId);
        boolean followedBy = viewerEdges.isFollowedBy(reviewerId);
        if (following && followedBy) {
            return MUTUAL_WEIGHT;
        }
        if (following) {
            return FOLLOWING_WEIGHT;
        }
        return BASE_WEIGHT;
    }
}
