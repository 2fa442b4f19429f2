package eu.virtualparadox.termcontext.cache;

/**
 * Point-in-time counters of a {@link ContextCache}.
 *
 * @param hits        lookups answered from a live entry
 * @param misses      lookups that found nothing or an expired entry
 * @param evictions   entries dropped to stay within capacity
 * @param expirations entries dropped on access because their TTL had passed
 * @param size        entries physically stored, expired ones included
 */
public record CacheStats(long hits, long misses, long evictions, long expirations, int size) {
}
