package com.example.musictaste.domain.model;

import java.util.Objects;

/**
 * Unordered pair of user ids. {@code of(a, b)} and {@code of(b, a)} are equal.
 */
public final class UserPair {

    private final long lowUserId;
    private final long highUserId;

    private UserPair(long lowUserId, long highUserId) {
        this.lowUserId = lowUserId;
        this.highUserId = highUserId;
    }

    public static UserPair of(long userA, long userB) {
        if (userA == userB) {
            throw new IllegalArgumentException("pair requires two distinct users, got " + userA);
        }
        return new UserPair(Math.min(userA, userB), Math.max(userA, userB));
    }

    public long getLowUserId() {
        return lowUserId;
    }

    public long getHighUserId() {
        return highUserId;
    }

    public String key() {
        return lowUserId + ":" + highUserId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserPair)) {
            return false;
        }
        UserPair other = (UserPair) o;
        return lowUserId == other.lowUserId && highUserId == other.highUserId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowUserId, highUserId);
    }

    @Override
    public String toString() {
        return key();
    }
}
