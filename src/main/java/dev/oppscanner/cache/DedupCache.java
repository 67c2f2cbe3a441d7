package dev.oppscanner.cache;

/**
 * Remembers which (source, native id) pairs were already emitted, for a limited time.
 */
public interface DedupCache {

    /**
     * True if the pair was marked within the TTL window.
     */
    boolean seen(String source, String nativeId);

    /**
     * Record the pair as seen now. Re-marking restarts its TTL window.
     */
    void mark(String source, String nativeId);

    /**
     * Atomic seen-then-mark.
     *
     * @return true if the pair was not seen and is now marked, false if it was already seen
     */
    boolean claim(String source, String nativeId);

    /**
     * Drop expired entries.
     *
     * @return number of entries removed
     */
    int evictExpired();

    int size();

    static String key(String source, String nativeId) {
        return source + ":" + nativeId;
    }
}
