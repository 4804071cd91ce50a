package io.evitadb.lingua.cache;

/**
 * Snapshot of the cache's bookkeeping.
 *
 * @param entryCount number of stored entries
 * @param totalSize  total size of stored values in bytes
 * @param maxSize    configured size bound in bytes
 * @param enabled    whether lookups and stores are active
 */
public record CacheStats(long entryCount, long totalSize, long maxSize, boolean enabled) {
}
