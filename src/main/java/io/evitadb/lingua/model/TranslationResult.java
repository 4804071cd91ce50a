package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Immutable record representing the outcome of translating a single text.
 * The same shape is stored in the translation cache; the {@code cached} flag tells callers
 * whether the value was served locally instead of by the remote service.
 *
 * @param text               the translated text
 * @param detectedSourceLang source language detected by the service (lower-cased), if reported
 * @param billedCharacters   number of billed characters, if reported
 * @param modelTypeUsed      model type the service used, if reported
 * @param cached             true when the result was served from the cache
 */
public record TranslationResult(
	@Nonnull String text,
	@Nullable String detectedSourceLang,
	@Nullable Integer billedCharacters,
	@Nullable String modelTypeUsed,
	boolean cached
) {

	public TranslationResult {
		Objects.requireNonNull(text, "text must not be null");
	}

	/**
	 * Creates a result freshly returned by the remote service.
	 *
	 * @param text               the translated text
	 * @param detectedSourceLang detected source language or null
	 * @param billedCharacters   billed characters or null
	 * @param modelTypeUsed      model type or null
	 * @return a non-cached TranslationResult
	 */
	@Nonnull
	public static TranslationResult remote(
		@Nonnull String text,
		@Nullable String detectedSourceLang,
		@Nullable Integer billedCharacters,
		@Nullable String modelTypeUsed
	) {
		return new TranslationResult(text, detectedSourceLang, billedCharacters, modelTypeUsed, false);
	}

	/**
	 * Returns a copy of this result flagged as served from the cache.
	 *
	 * @return cached copy
	 */
	@Nonnull
	public TranslationResult asCached() {
		return new TranslationResult(this.text, this.detectedSourceLang, this.billedCharacters, this.modelTypeUsed, true);
	}

	/**
	 * Returns a copy of this result with different text, keeping all metadata.
	 *
	 * @param newText replacement text
	 * @return copy with the new text
	 */
	@Nonnull
	public TranslationResult withText(@Nonnull String newText) {
		return new TranslationResult(newText, this.detectedSourceLang, this.billedCharacters, this.modelTypeUsed, this.cached);
	}
}
