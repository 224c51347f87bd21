package com.example.musictaste.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Follow graph neighbourhood of one user.
 */
public final class FollowEdges {

    private static final FollowEdges NONE = new FollowEdges(Collections.emptySet(), Collections.emptySet());

    /** Users this user follows. */
    private final Set<Long> following;
    /** Users following this user. */
    private final Set<Long> followers;

    public FollowEdges(Collection<Long> following, Collection<Long> followers) {
        this.following = following == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new HashSet<>(following));
        this.followers = followers == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new HashSet<>(followers));
    }

    public static FollowEdges none() {
        return NONE;
    }

    public boolean follows(long userId) {
        return following.contains(userId);
    }

    public boolean isFollowedBy(long userId) {
        return followers.contains(userId);
    }
}
