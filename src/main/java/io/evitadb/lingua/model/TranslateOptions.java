package io.evitadb.lingua.model;

import javax.annotation.Nonnull;

/**
 * Per-call switches of the orchestrator that do not travel to the remote service.
 *
 * @param preserveCode protect Markdown code blocks and inline code from translation
 * @param skipCache    bypass both cache lookup and cache store for this call
 */
public record TranslateOptions(boolean preserveCode, boolean skipCache) {

	@Nonnull
	public static TranslateOptions defaults() {
		return new TranslateOptions(false, false);
	}
}
