package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Translation of one input text into one of several requested target languages.
 *
 * @param targetLang         the target language this result belongs to
 * @param text               the translated text
 * @param detectedSourceLang detected source language, if reported
 * @param billedCharacters   billed characters, if reported
 * @param modelTypeUsed      model type, if reported
 * @param cached             true when served from the cache
 */
public record MultiTargetResult(
	@Nonnull String targetLang,
	@Nonnull String text,
	@Nullable String detectedSourceLang,
	@Nullable Integer billedCharacters,
	@Nullable String modelTypeUsed,
	boolean cached
) {

	@Nonnull
	public static MultiTargetResult of(@Nonnull String targetLang, @Nonnull TranslationResult result) {
		return new MultiTargetResult(
			targetLang,
			result.text(),
			result.detectedSourceLang(),
			result.billedCharacters(),
			result.modelTypeUsed(),
			result.cached()
		);
	}
}
