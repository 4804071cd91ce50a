package io.evitadb.lingua.cache;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Value found in the {@link TranslationCache}. The value itself may be null when null was stored.
 *
 * @param value      the cached value, or null for a stored "no value"
 * @param insertedAt when the entry was written
 * @param <T>        value type
 */
public record CacheHit<T>(@Nullable T value, @Nonnull Instant insertedAt) {
}
