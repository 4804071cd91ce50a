package io.evitadb.lingua;

import io.evitadb.lingua.cache.CacheHit;
import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.http.TranslationClient;
import io.evitadb.lingua.model.LanguageInfo;
import io.evitadb.lingua.model.LanguageType;
import io.evitadb.lingua.model.MultiTargetResult;
import io.evitadb.lingua.model.TranslateOptions;
import io.evitadb.lingua.model.TranslationParameters;
import io.evitadb.lingua.model.TranslationResult;
import io.evitadb.lingua.model.UsageInfo;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Sits between callers and the remote client: validates input, protects placeholders and code, consults the
 * translation cache and stores fresh results in it.
 *
 * Errors raised by the client propagate unchanged and are never cached.
 */
public final class TranslationOrchestrator {

	/** Largest text accepted per request, in UTF-8 bytes. */
	public static final int MAX_TEXT_BYTES = 128 * 1024;
	/** Largest number of texts sent in one remote call. */
	public static final int BATCH_CHUNK_SIZE = 50;
	/** Largest number of target languages translated at the same time. */
	public static final int MULTI_TARGET_CONCURRENCY = 5;
	static final Duration LANGUAGE_CACHE_TTL = Duration.ofHours(24);

	@Nonnull
	private final TranslationClient client;
	@Nullable
	private final TranslationCache cache;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Log log;
	private final Map<LanguageType, LanguageListing> languages = new ConcurrentHashMap<>();

	/**
	 * Creates an orchestrator.
	 *
	 * @param client remote client
	 * @param cache  translation cache, or null to always call the service
	 * @param log    Maven log for output
	 */
	public TranslationOrchestrator(
		@Nonnull TranslationClient client,
		@Nullable TranslationCache cache,
		@Nonnull Log log
	) {
		this(client, cache, Clock.systemUTC(), log);
	}

	/**
	 * Creates an orchestrator with an explicit clock for the language list memo.
	 */
	public TranslationOrchestrator(
		@Nonnull TranslationClient client,
		@Nullable TranslationCache cache,
		@Nonnull Clock clock,
		@Nonnull Log log
	) {
		this.client = Objects.requireNonNull(client, "client must not be null");
		this.cache = cache;
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Translates a single text with default options.
	 *
	 * @see #translate(String, TranslationParameters, TranslateOptions)
	 */
	@Nonnull
	public TranslationResult translate(@Nonnull String text, @Nonnull TranslationParameters parameters) {
		return translate(text, parameters, TranslateOptions.defaults());
	}

	/**
	 * Translates a single text. A cached result is returned flagged as cached; otherwise the service is called
	 * and its result is stored.
	 *
	 * @param text       text to translate, must not be blank
	 * @param parameters translation parameters
	 * @param options    code preservation and cache bypass switches
	 * @return translated text with metadata
	 */
	@Nonnull
	public TranslationResult translate(
		@Nonnull String text,
		@Nonnull TranslationParameters parameters,
		@Nonnull TranslateOptions options
	) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");
		Objects.requireNonNull(options, "options must not be null");
		if (text.isBlank()) {
			throw new IllegalArgumentException("Text cannot be empty");
		}
		final int textBytes = utf8Length(text);
		if (textBytes > MAX_TEXT_BYTES) {
			throw new IllegalArgumentException("Text too large: " + textBytes + " bytes exceeds the " +
				MAX_TEXT_BYTES + " byte limit (128KB). Split the text into smaller chunks.");
		}

		final TextPreserver.Protected prepared = TextPreserver.protect(text, options.preserveCode());
		final String key = Fingerprint.of(prepared.text(), parameters);
		final boolean useCache = this.cache != null && !options.skipCache();
		if (this.cache != null && options.skipCache()) {
			this.log.debug("Cache bypassed for this request");
		}

		if (useCache) {
			final Optional<TranslationResult> cached = lookup(key);
			if (cached.isPresent()) {
				this.log.debug("Cache hit for " + parameters.getTargetLang());
				return cached.get().withText(prepared.restore(cached.get().text()));
			}
			this.log.debug("Cache miss for " + parameters.getTargetLang());
		}

		final long start = System.nanoTime();
		final TranslationResult result = this.client.translate(List.of(prepared.text()), parameters).get(0);
		this.log.debug("Translation to " + parameters.getTargetLang() + " took " +
			Duration.ofNanos(System.nanoTime() - start).toMillis() + "ms");
		if (useCache) {
			this.cache.set(key, result);
		}
		return result.withText(prepared.restore(result.text()));
	}

	/**
	 * Translates several texts with the same parameters. Cached texts are served locally; the rest are
	 * deduplicated and sent in chunks of at most {@link #BATCH_CHUNK_SIZE}. The first failing remote call
	 * aborts the whole batch.
	 *
	 * @param texts      texts to translate, none of them blank
	 * @param parameters translation parameters
	 * @return one result per input text, in input order
	 */
	@Nonnull
	public List<TranslationResult> translateBatch(@Nonnull List<String> texts, @Nonnull TranslationParameters parameters) {
		Objects.requireNonNull(texts, "texts must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");
		if (texts.isEmpty()) {
			return List.of();
		}

		long totalBytes = 0;
		for (int i = 0; i < texts.size(); i++) {
			final String text = texts.get(i);
			if (text == null || text.isBlank()) {
				throw new IllegalArgumentException("Text at index " + i + " cannot be empty");
			}
			final int itemBytes = utf8Length(text);
			if (itemBytes > MAX_TEXT_BYTES) {
				throw new IllegalArgumentException("Text at index " + i + " too large: " + itemBytes +
					" bytes exceeds the " + MAX_TEXT_BYTES + " byte limit (128KB)");
			}
			totalBytes += itemBytes;
		}
		if (totalBytes > MAX_TEXT_BYTES) {
			throw new IllegalArgumentException("Batch text too large: " + totalBytes + " bytes total exceeds the " +
				MAX_TEXT_BYTES + " byte limit (128KB). Split the texts into smaller batches.");
		}

		final TranslationResult[] results = new TranslationResult[texts.size()];
		// unique uncached text -> every index it occurs at
		final Map<String, List<Integer>> pending = new LinkedHashMap<>();
		for (int i = 0; i < texts.size(); i++) {
			final String text = texts.get(i);
			if (this.cache != null) {
				final Optional<TranslationResult> cached = lookup(Fingerprint.of(text, parameters));
				if (cached.isPresent()) {
					results[i] = cached.get();
					continue;
				}
			}
			pending.computeIfAbsent(text, t -> new ArrayList<>()).add(i);
		}

		final List<String> unique = new ArrayList<>(pending.keySet());
		for (int from = 0; from < unique.size(); from += BATCH_CHUNK_SIZE) {
			final List<String> chunk = unique.subList(from, Math.min(from + BATCH_CHUNK_SIZE, unique.size()));
			final List<TranslationResult> translated = this.client.translate(chunk, parameters);
			for (int i = 0; i < chunk.size(); i++) {
				final String text = chunk.get(i);
				final TranslationResult result = translated.get(i);
				for (final Integer index : pending.get(text)) {
					results[index] = result;
				}
				if (this.cache != null) {
					this.cache.set(Fingerprint.of(text, parameters), result);
				}
			}
		}
		this.log.debug("Batch of " + texts.size() + " texts: " + (texts.size() - countIndices(pending)) +
			" from cache, " + unique.size() + " unique texts translated");
		return List.of(results);
	}

	/**
	 * Translates one text into several target languages, at most {@link #MULTI_TARGET_CONCURRENCY} at a time.
	 *
	 * @param text        text to translate
	 * @param parameters  parameters shared by all targets; their target language is replaced per target
	 * @param targetLangs target languages, at least one
	 * @param options     code preservation and cache bypass switches
	 * @return one result per target language, in the order of {@code targetLangs}
	 */
	@Nonnull
	public List<MultiTargetResult> translateToMultiple(
		@Nonnull String text,
		@Nonnull TranslationParameters parameters,
		@Nonnull List<String> targetLangs,
		@Nonnull TranslateOptions options
	) {
		Objects.requireNonNull(targetLangs, "targetLangs must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");
		if (targetLangs.isEmpty()) {
			throw new IllegalArgumentException("At least one target language is required");
		}

		final ExecutorService executor = Executors.newFixedThreadPool(
			Math.min(MULTI_TARGET_CONCURRENCY, targetLangs.size())
		);
		try {
			final List<Future<MultiTargetResult>> futures = new ArrayList<>(targetLangs.size());
			for (final String targetLang : targetLangs) {
				final TranslationParameters targetParameters = parameters.withTargetLang(targetLang);
				futures.add(executor.submit(
					() -> MultiTargetResult.of(targetLang, translate(text, targetParameters, options))
				));
			}
			final List<MultiTargetResult> results = new ArrayList<>(futures.size());
			for (final Future<MultiTargetResult> future : futures) {
				results.add(await(future));
			}
			return results;
		} finally {
			executor.shutdownNow();
		}
	}

	/**
	 * Returns the account's character usage.
	 *
	 * @return usage with derived percentage and remaining characters
	 */
	@Nonnull
	public UsageInfo getUsage() {
		return this.client.getUsage();
	}

	/**
	 * Returns supported languages, remembered in memory for 24 hours per language type.
	 *
	 * @param type source or target languages
	 * @return supported languages
	 */
	@Nonnull
	public List<LanguageInfo> getSupportedLanguages(@Nonnull LanguageType type) {
		Objects.requireNonNull(type, "type must not be null");
		final Instant now = this.clock.instant();
		final LanguageListing listing = this.languages.get(type);
		if (listing != null && listing.fetchedAt().plus(LANGUAGE_CACHE_TTL).isAfter(now)) {
			return listing.languages();
		}
		final List<LanguageInfo> fetched = List.copyOf(this.client.getSupportedLanguages(type));
		this.languages.put(type, new LanguageListing(fetched, now));
		return fetched;
	}

	/**
	 * Returns the trace id of the last remote response, if any.
	 */
	@Nonnull
	public Optional<String> getLastTraceId() {
		return this.client.getLastTraceId();
	}

	@Nonnull
	private Optional<TranslationResult> lookup(@Nonnull String key) {
		return this.cache.get(key, TranslationResult.class)
			.map(CacheHit::value)
			.map(TranslationResult::asCached);
	}

	@Nonnull
	private static MultiTargetResult await(@Nonnull Future<MultiTargetResult> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for translations", e);
		} catch (ExecutionException e) {
			final Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new IllegalStateException("Translation failed: " + cause.getMessage(), cause);
		}
	}

	private static int countIndices(@Nonnull Map<String, List<Integer>> pending) {
		int count = 0;
		for (final List<Integer> indices : pending.values()) {
			count += indices.size();
		}
		return count;
	}

	private static int utf8Length(@Nonnull String text) {
		return text.getBytes(StandardCharsets.UTF_8).length;
	}

	private record LanguageListing(@Nonnull List<LanguageInfo> languages, @Nonnull Instant fetchedAt) {
	}
}
