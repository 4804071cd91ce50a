package io.evitadb.lingua;

import io.evitadb.lingua.cache.CacheStats;
import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.http.HttpTransport;
import io.evitadb.lingua.http.JdkHttpTransport;
import io.evitadb.lingua.http.RequestException;
import io.evitadb.lingua.http.RequestExecutor;
import io.evitadb.lingua.http.TranslationClient;
import io.evitadb.lingua.model.BatchOptions;
import io.evitadb.lingua.model.BatchResult;
import io.evitadb.lingua.model.BatchStatistics;
import io.evitadb.lingua.model.BatchUnit;
import io.evitadb.lingua.model.LanguageInfo;
import io.evitadb.lingua.model.LanguageType;
import io.evitadb.lingua.model.MultiTargetResult;
import io.evitadb.lingua.model.TranslateOptions;
import io.evitadb.lingua.model.TranslationParameters;
import io.evitadb.lingua.model.TranslationResult;
import io.evitadb.lingua.model.UsageInfo;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Main Mojo for the Lingua plugin providing actions:
 * - show-config: prints current configuration
 * - translate: translates {@code lingua.text} into one or more target languages
 * - translate-files: translates the listed files
 * - translate-dir: translates all supported files of a directory
 * - usage: prints the account's character usage
 * - languages: lists supported source or target languages
 * - cache-stats / cache-clear: inspects or empties the local translation cache
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true, requiresProject = false)
public class LinguaMojo extends AbstractMojo {

	private static final String SUPPORTED_ACTIONS =
		"show-config, translate, translate-files, translate-dir, usage, languages, cache-stats, cache-clear";

	/** Which action to perform. */
	@Parameter(property = "lingua.action", defaultValue = "show-config")
	private String action;

	/** API key of the translation service (no default). */
	@Parameter(property = "lingua.apiKey")
	private String apiKey;

	/** Use the Pro endpoint instead of the Free one. */
	@Parameter(property = "lingua.usePro", defaultValue = "false")
	private boolean usePro;

	/** Explicit service base URL; overrides {@code usePro}. */
	@Parameter(property = "lingua.baseUrl")
	private String baseUrl;

	/** Time bound of a single request attempt in milliseconds (default 30000). */
	@Parameter(property = "lingua.timeout", defaultValue = "30000")
	private long timeout = RequestExecutor.DEFAULT_TIMEOUT.toMillis();

	/** Number of retries after a failed attempt (default 3). */
	@Parameter(property = "lingua.maxRetries", defaultValue = "3")
	private int maxRetries = RequestExecutor.DEFAULT_MAX_RETRIES;

	/** Whether translations are cached locally. */
	@Parameter(property = "lingua.cacheEnabled", defaultValue = "true")
	private boolean cacheEnabled = true;

	/** Cache database location (default ~/.cache/lingua/cache). */
	@Parameter(property = "lingua.cacheDir")
	private String cacheDir;

	/** Cache size bound, e.g. 100M or 1G. */
	@Parameter(property = "lingua.cacheMaxSize", defaultValue = "1G")
	private String cacheMaxSize = "1G";

	/** Cache entry time to live in days, 0 disables expiry. */
	@Parameter(property = "lingua.cacheTtlDays", defaultValue = "30")
	private int cacheTtlDays = 30;

	/** Number of files translated in parallel (1-100). */
	@Parameter(property = "lingua.concurrency", defaultValue = "5")
	private int concurrency = BatchCoordinator.DEFAULT_CONCURRENCY;

	/** Text for the translate action. */
	@Parameter(property = "lingua.text")
	private String text;

	/** Files for the translate-files action. */
	@Parameter(property = "lingua.files")
	private List<String> files;

	/** Directory for the translate-dir action. */
	@Parameter(property = "lingua.inputDir")
	private String inputDir;

	/** Output directory for file translations. */
	@Parameter(property = "lingua.outputDir")
	private String outputDir;

	/** Output file name template with {name}, {lang} and {ext} placeholders. */
	@Parameter(property = "lingua.outputPattern")
	private String outputPattern;

	/** Whether translate-dir descends into subdirectories. */
	@Parameter(property = "lingua.recursive", defaultValue = "true")
	private boolean recursive = true;

	/** Glob matched against file names by translate-dir. */
	@Parameter(property = "lingua.pattern", defaultValue = "*")
	private String pattern = FileScanner.DEFAULT_PATTERN;

	/** Target language. */
	@Parameter(property = "lingua.targetLang")
	private String targetLang;

	/** Several target languages for the translate action. */
	@Parameter(property = "lingua.targetLangs")
	private List<String> targetLangs;

	/** Source language; detected by the service when not set. */
	@Parameter(property = "lingua.sourceLang")
	private String sourceLang;

	/** Formality: default, more, less, prefer_more, prefer_less. */
	@Parameter(property = "lingua.formality")
	private String formality;

	/** Glossary to apply. */
	@Parameter(property = "lingua.glossaryId")
	private String glossaryId;

	/** Model type: quality_optimized, prefer_quality_optimized, latency_optimized. */
	@Parameter(property = "lingua.modelType")
	private String modelType;

	/** Additional context that influences the translation without being translated. */
	@Parameter(property = "lingua.context")
	private String context;

	/** Tag handling: xml or html. */
	@Parameter(property = "lingua.tagHandling")
	private String tagHandling;

	/** Language listing for the languages action: source or target. */
	@Parameter(property = "lingua.languageType", defaultValue = "target")
	private String languageType = "target";

	@Nullable
	private HttpTransport transport;

	@Override
	public void execute() throws MojoExecutionException, MojoFailureException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		final Log log = getLog();
		try {
			switch (this.action) {
				case "show-config":
					showConfig(log);
					break;
				case "translate":
					translateText(log);
					break;
				case "translate-files":
					translateFiles(log);
					break;
				case "translate-dir":
					translateDirectory(log);
					break;
				case "usage":
					usage(log);
					break;
				case "languages":
					languages(log);
					break;
				case "cache-stats":
					cacheStats(log);
					break;
				case "cache-clear":
					cacheClear(log);
					break;
				default:
					throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: " + SUPPORTED_ACTIONS);
			}
		} catch (RequestException ex) {
			log.error(ex.getKind() + ": " + ex.getMessage());
			log.error("Suggestion: " + ex.getSuggestion());
			throw new MojoFailureException(ex.getKind() + ": " + ex.getMessage(), ex);
		} catch (IllegalArgumentException ex) {
			throw new MojoExecutionException("Invalid configuration: " + ex.getMessage(), ex);
		} catch (IOException ex) {
			throw new MojoExecutionException("Action " + this.action + " failed: " + ex.getMessage(), ex);
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Lingua Plugin Configuration:");
		log.info(" - apiKey: " + (isBlank(this.apiKey) ? "<not set>" : mask(this.apiKey)));
		if (isBlank(this.apiKey)) {
			log.warn("API key is not set");
		}
		log.info(" - baseUrl: " + resolveBaseUrl());
		log.info(" - timeout: " + this.timeout + "ms");
		log.info(" - maxRetries: " + this.maxRetries);
		log.info(" - cacheEnabled: " + this.cacheEnabled);
		log.info(" - cacheDir: " + resolveCachePath());
		log.info(" - cacheMaxSize: " + this.cacheMaxSize);
		log.info(" - cacheTtlDays: " + this.cacheTtlDays);
		log.info(" - concurrency: " + this.concurrency);
		log.info(" - targetLang: " + (isBlank(this.targetLang) ? "<not set>" : this.targetLang));
		if (this.targetLangs != null && !this.targetLangs.isEmpty()) {
			log.info(" - targetLangs: " + String.join(",", this.targetLangs));
		}
		log.info(" - sourceLang: " + (isBlank(this.sourceLang) ? "<auto>" : this.sourceLang));
		if (!isBlank(this.formality)) {
			log.info(" - formality: " + this.formality);
		}
		if (!isBlank(this.glossaryId)) {
			log.info(" - glossaryId: " + this.glossaryId);
		}
		if (!isBlank(this.modelType)) {
			log.info(" - modelType: " + this.modelType);
		}
	}

	private void translateText(@Nonnull final Log log) throws IOException, MojoExecutionException {
		if (isBlank(this.text)) {
			throw new MojoExecutionException("Text must be specified for translate action");
		}
		try (Session session = openSession(log)) {
			if (this.targetLangs != null && !this.targetLangs.isEmpty()) {
				final List<MultiTargetResult> results = session.orchestrator().translateToMultiple(
					this.text, buildParameters(this.targetLangs.get(0)), this.targetLangs, TranslateOptions.defaults()
				);
				for (final MultiTargetResult result : results) {
					log.info("[" + result.targetLang() + "]" + (result.cached() ? " (cached)" : "") + " " + result.text());
				}
			} else {
				final TranslationResult result = session.orchestrator().translate(this.text, buildParameters(requireTargetLang()));
				log.info(result.text());
				if (result.detectedSourceLang() != null) {
					log.info("Detected source language: " + result.detectedSourceLang());
				}
				if (result.billedCharacters() != null) {
					log.info("Billed characters: " + result.billedCharacters());
				}
				if (result.cached()) {
					log.info("Served from cache");
				}
			}
		}
	}

	private void translateFiles(@Nonnull final Log log) throws IOException, MojoExecutionException, MojoFailureException {
		if (this.files == null || this.files.isEmpty()) {
			throw new MojoExecutionException("At least one file must be specified for translate-files action");
		}
		final TranslationParameters parameters = buildParameters(requireTargetLang());
		final List<Path> paths = new ArrayList<>(this.files.size());
		for (final String file : this.files) {
			paths.add(Path.of(file).toAbsolutePath().normalize());
		}
		try (Session session = openSession(log)) {
			final BatchCoordinator coordinator = new BatchCoordinator(
				new FileTranslator(session.orchestrator()), this.concurrency, log
			);
			try {
				report(log, coordinator, coordinator.translateFiles(paths, parameters, buildBatchOptions(log)));
			} finally {
				coordinator.shutdown();
			}
		}
	}

	private void translateDirectory(@Nonnull final Log log) throws IOException, MojoExecutionException, MojoFailureException {
		if (isBlank(this.inputDir)) {
			throw new MojoExecutionException("Input directory must be specified for translate-dir action");
		}
		final TranslationParameters parameters = buildParameters(requireTargetLang());
		final Path root = Path.of(this.inputDir).toAbsolutePath().normalize();
		try (Session session = openSession(log)) {
			final BatchCoordinator coordinator = new BatchCoordinator(
				new FileTranslator(session.orchestrator()), this.concurrency, log
			);
			try {
				log.info("=== Translating " + root + " to " + parameters.getTargetLang() + " ===");
				report(log, coordinator, coordinator.translateDirectory(root, parameters, buildBatchOptions(log)));
			} finally {
				coordinator.shutdown();
			}
		}
	}

	private void usage(@Nonnull final Log log) throws IOException {
		try (Session session = openSession(log)) {
			final UsageInfo usage = session.orchestrator().getUsage();
			log.info("Character usage: " + usage.characterCount() + " / " + usage.characterLimit() +
				String.format(Locale.ROOT, " (%.2f%%)", usage.percentageUsed()));
			log.info("Remaining: " + usage.remaining());
			if (usage.apiKeyCharacterCount() != null) {
				log.info("API key usage: " + usage.apiKeyCharacterCount() +
					(usage.apiKeyCharacterLimit() != null ? " / " + usage.apiKeyCharacterLimit() : ""));
			}
			if (usage.startTime() != null && usage.endTime() != null) {
				log.info("Billing period: " + usage.startTime() + " - " + usage.endTime());
			}
		}
	}

	private void languages(@Nonnull final Log log) throws IOException {
		final LanguageType type = LanguageType.valueOf(this.languageType.trim().toUpperCase(Locale.ROOT));
		try (Session session = openSession(log)) {
			final List<LanguageInfo> languages = session.orchestrator().getSupportedLanguages(type);
			log.info("Supported " + type.parameterValue() + " languages (" + languages.size() + "):");
			for (final LanguageInfo language : languages) {
				log.info("  " + language.language() + " - " + language.name() +
					(Boolean.TRUE.equals(language.supportsFormality()) ? " (formality)" : ""));
			}
		}
	}

	private void cacheStats(@Nonnull final Log log) throws IOException {
		try (TranslationCache cache = openCache(log)) {
			final CacheStats stats = cache.stats();
			log.info("Cache: " + cache.getDatabasePath());
			log.info(" - entries: " + stats.entryCount());
			log.info(" - size: " + DataSize.format(stats.totalSize()) + " / " + DataSize.format(stats.maxSize()));
			log.info(" - enabled: " + this.cacheEnabled);
		}
	}

	private void cacheClear(@Nonnull final Log log) throws IOException {
		try (TranslationCache cache = openCache(log)) {
			final long entries = cache.stats().entryCount();
			cache.clear();
			log.info("Removed " + entries + " cache entries");
		}
	}

	private void report(
		@Nonnull final Log log,
		@Nonnull final BatchCoordinator coordinator,
		@Nonnull final BatchResult result
	) throws MojoFailureException {
		final BatchStatistics statistics = coordinator.getStatistics(result);
		log.info("--- Translation Summary ---");
		log.info("Total: " + statistics.total());
		log.info("Successful: " + statistics.successful());
		log.info("Failed: " + statistics.failed());
		log.info("Skipped: " + statistics.skipped());
		for (final BatchUnit unit : result.skipped()) {
			log.warn("Skipped " + unit.sourcePath() + ": " + unit.reason());
		}
		for (final BatchUnit unit : result.failed()) {
			log.error("Failed " + unit.sourcePath() + ": " + unit.error());
		}
		if (result.hasFailures()) {
			throw new MojoFailureException(statistics.failed() + " file(s) failed to translate");
		}
	}

	@Nonnull
	private BatchOptions buildBatchOptions(@Nonnull final Log log) {
		return BatchOptions.defaults()
			.withOutputDir(isBlank(this.outputDir) ? null : Path.of(this.outputDir).toAbsolutePath().normalize())
			.withOutputPattern(isBlank(this.outputPattern) ? null : this.outputPattern)
			.withRecursive(this.recursive)
			.withPattern(this.pattern)
			.withProgress(progress -> log.debug("Progress " + progress.completed() + "/" + progress.total() +
				(progress.current() != null ? ": " + progress.current() : "")));
	}

	@Nonnull
	private TranslationParameters buildParameters(@Nonnull final String target) {
		return TranslationParameters.builder(target)
			.sourceLang(blankToNull(this.sourceLang))
			.formality(blankToNull(this.formality))
			.glossaryId(blankToNull(this.glossaryId))
			.modelType(blankToNull(this.modelType))
			.context(blankToNull(this.context))
			.tagHandling(blankToNull(this.tagHandling))
			.build();
	}

	@Nonnull
	private String requireTargetLang() throws MojoExecutionException {
		if (isBlank(this.targetLang)) {
			throw new MojoExecutionException("Target language must be specified (lingua.targetLang)");
		}
		return this.targetLang;
	}

	/**
	 * Wires the client stack and, when enabled, the cache for a single action.
	 */
	@Nonnull
	private Session openSession(@Nonnull final Log log) throws IOException {
		final HttpTransport effectiveTransport = this.transport != null
			? this.transport
			: new JdkHttpTransport(resolveBaseUrl(), this.apiKey == null ? "" : this.apiKey);
		final RequestExecutor executor = new RequestExecutor(
			effectiveTransport, this.maxRetries, Duration.ofMillis(this.timeout), log
		);
		final TranslationCache cache = this.cacheEnabled ? openCache(log) : null;
		return new Session(new TranslationOrchestrator(new TranslationClient(executor), cache, log), cache);
	}

	@Nonnull
	private TranslationCache openCache(@Nonnull final Log log) throws IOException {
		if (this.cacheTtlDays < 0) {
			throw new IllegalArgumentException("cacheTtlDays must not be negative");
		}
		return new TranslationCache(
			resolveCachePath(),
			DataSize.parse(this.cacheMaxSize),
			Duration.ofDays(this.cacheTtlDays),
			Clock.systemUTC(),
			log
		);
	}

	@Nonnull
	private Path resolveCachePath() {
		return isBlank(this.cacheDir)
			? TranslationCache.defaultLocation()
			: Path.of(this.cacheDir).toAbsolutePath().normalize().resolve("cache");
	}

	@Nonnull
	private String resolveBaseUrl() {
		return isBlank(this.baseUrl) ? JdkHttpTransport.defaultBaseUrl(this.usePro) : this.baseUrl;
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nullable
	private static String blankToNull(@Nullable final String value) {
		return isBlank(value) ? null : value;
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setApiKey(@Nullable final String apiKey) { this.apiKey = apiKey; }
	void setUsePro(final boolean usePro) { this.usePro = usePro; }
	void setBaseUrl(@Nullable final String baseUrl) { this.baseUrl = baseUrl; }
	void setTimeout(final long timeout) { this.timeout = timeout; }
	void setMaxRetries(final int maxRetries) { this.maxRetries = maxRetries; }
	void setCacheEnabled(final boolean cacheEnabled) { this.cacheEnabled = cacheEnabled; }
	void setCacheDir(@Nullable final String cacheDir) { this.cacheDir = cacheDir; }
	void setCacheMaxSize(@Nonnull final String cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }
	void setCacheTtlDays(final int cacheTtlDays) { this.cacheTtlDays = cacheTtlDays; }
	void setConcurrency(final int concurrency) { this.concurrency = concurrency; }
	void setText(@Nullable final String text) { this.text = text; }
	void setFiles(@Nullable final List<String> files) { this.files = files; }
	void setInputDir(@Nullable final String inputDir) { this.inputDir = inputDir; }
	void setOutputDir(@Nullable final String outputDir) { this.outputDir = outputDir; }
	void setOutputPattern(@Nullable final String outputPattern) { this.outputPattern = outputPattern; }
	void setRecursive(final boolean recursive) { this.recursive = recursive; }
	void setPattern(@Nonnull final String pattern) { this.pattern = pattern; }
	void setTargetLang(@Nullable final String targetLang) { this.targetLang = targetLang; }
	void setTargetLangs(@Nullable final List<String> targetLangs) { this.targetLangs = targetLangs; }
	void setSourceLang(@Nullable final String sourceLang) { this.sourceLang = sourceLang; }
	void setFormality(@Nullable final String formality) { this.formality = formality; }
	void setGlossaryId(@Nullable final String glossaryId) { this.glossaryId = glossaryId; }
	void setModelType(@Nullable final String modelType) { this.modelType = modelType; }
	void setContext(@Nullable final String context) { this.context = context; }
	void setTagHandling(@Nullable final String tagHandling) { this.tagHandling = tagHandling; }
	void setLanguageType(@Nonnull final String languageType) { this.languageType = languageType; }
	void setTransport(@Nullable final HttpTransport transport) { this.transport = transport; }

	/** Orchestrator plus the cache it owns for the duration of one action. */
	private record Session(@Nonnull TranslationOrchestrator orchestrator, @Nullable TranslationCache cache)
		implements AutoCloseable {

		@Override
		public void close() {
			if (this.cache != null) {
				this.cache.close();
			}
		}
	}
}
