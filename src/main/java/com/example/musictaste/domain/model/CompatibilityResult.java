package com.example.musictaste.domain.model;

/**
 * Compatibility of a user pair together with whether it was served from cache.
 */
public final class CompatibilityResult {

    private final UserPair pair;
    private final CompatibilityEntry entry;
    private final boolean cached;

    public CompatibilityResult(UserPair pair, CompatibilityEntry entry, boolean cached) {
        this.pair = pair;
        this.entry = entry;
        this.cached = cached;
    }

    public UserPair getPair() {
        return pair;
    }

    public CompatibilityEntry getEntry() {
        return entry;
    }

    public boolean isCached() {
        return cached;
    }
}
