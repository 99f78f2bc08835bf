package fr.lapetina.avatar.delivery.infrastructure.cache;

/**
 * Counters of the response cache since creation.
 */
public record CacheStats(long size, long hitCount, long missCount, long evictionCount) {

    public double hitRate() {
        long requests = hitCount + missCount;
        return requests == 0 ? 0 : (double) hitCount / requests;
    }
}
