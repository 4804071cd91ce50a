package io.evitadb.lingua.cache;

import javax.annotation.Nonnull;

/**
 * Thrown when the cache's backing database cannot be read or written.
 */
public final class CacheAccessException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CacheAccessException(@Nonnull String message, @Nonnull Throwable cause) {
		super(message, cause);
	}
}
