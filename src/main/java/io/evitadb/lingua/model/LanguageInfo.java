package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Language supported by the remote service.
 *
 * @param language          lower-cased language code
 * @param name              human-readable name
 * @param supportsFormality whether formality can be set for this target, if reported
 */
public record LanguageInfo(
	@Nonnull String language,
	@Nonnull String name,
	@Nullable Boolean supportsFormality
) {
}
