package net.seitter.pagedb.buffer;

/**
 * Victim selection order among unfixed resident pages.
 */
public enum ReplacementPolicy {
    /** Evict the least recently touched unfixed page (scan from the tail of the used list). */
    LRU,
    /** Evict the most recently touched unfixed page (scan from the head of the used list). */
    MRU;

    /**
     * Parses a policy name, ignoring case.
     *
     * @param name "lru" or "mru"
     * @return The policy
     * @throws IllegalArgumentException If the name is not a known policy
     */
    public static ReplacementPolicy fromName(String name) {
        for (ReplacementPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown replacement policy: " + name);
    }
}
