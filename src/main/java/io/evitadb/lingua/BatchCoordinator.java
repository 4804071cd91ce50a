package io.evitadb.lingua;

import io.evitadb.lingua.model.BatchOptions;
import io.evitadb.lingua.model.BatchProgress;
import io.evitadb.lingua.model.BatchResult;
import io.evitadb.lingua.model.BatchStatistics;
import io.evitadb.lingua.model.BatchUnit;
import io.evitadb.lingua.model.TranslationParameters;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Translates many files in parallel using a fixed thread pool.
 * Unsupported files are skipped up front; every supported file is translated independently, so one failure
 * never stops the others.
 */
public final class BatchCoordinator {

	public static final int DEFAULT_CONCURRENCY = 5;
	public static final int MAX_CONCURRENCY = 100;

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	private final ExecutorService executor;
	private final FileTranslator fileTranslator;
	private final Log log;
	private final int concurrency;

	/**
	 * Creates a coordinator with the default concurrency.
	 *
	 * @param fileTranslator per-file translation step
	 * @param log            Maven log for output
	 */
	public BatchCoordinator(@Nonnull FileTranslator fileTranslator, @Nonnull Log log) {
		this(fileTranslator, DEFAULT_CONCURRENCY, log);
	}

	/**
	 * Creates a coordinator translating at most {@code concurrency} files at the same time.
	 *
	 * @param fileTranslator per-file translation step
	 * @param concurrency    number of worker threads, 1 to 100
	 * @param log            Maven log for output
	 */
	public BatchCoordinator(@Nonnull FileTranslator fileTranslator, int concurrency, @Nonnull Log log) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be at least 1");
		}
		if (concurrency > MAX_CONCURRENCY) {
			throw new IllegalArgumentException("Concurrency cannot exceed " + MAX_CONCURRENCY);
		}
		this.fileTranslator = Objects.requireNonNull(fileTranslator, "fileTranslator must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.concurrency = concurrency;
		this.executor = Executors.newFixedThreadPool(concurrency);
	}

	/**
	 * Translates the given files. Returns only after every file has reached its final state.
	 *
	 * @param files      files to translate
	 * @param parameters translation parameters, including the target language
	 * @param options    output location, naming and progress reporting
	 * @return successful, failed and skipped units, each in input order
	 */
	@Nonnull
	public BatchResult translateFiles(
		@Nonnull List<Path> files,
		@Nonnull TranslationParameters parameters,
		@Nonnull BatchOptions options
	) {
		Objects.requireNonNull(files, "files must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");
		Objects.requireNonNull(options, "options must not be null");

		if (files.isEmpty()) {
			return BatchResult.empty();
		}

		final String targetLang = parameters.getTargetLang();
		final List<BatchUnit> skipped = new ArrayList<>();
		final List<Path> supported = new ArrayList<>(files.size());
		for (final Path file : files) {
			if (this.fileTranslator.isSupported(file)) {
				supported.add(file);
			} else {
				this.log.debug("Skipping unsupported file: " + file);
				skipped.add(BatchUnit.skipped(file, targetLang, BatchUnit.UNSUPPORTED_FILE_TYPE));
			}
		}

		final ProgressTracker progress = new ProgressTracker(supported.size(), options.progress(), this.log);
		final List<Future<BatchUnit>> futures = new ArrayList<>(supported.size());
		for (final Path file : supported) {
			futures.add(this.executor.submit(() -> translateUnit(file, parameters, options, progress)));
		}

		final List<BatchUnit> successful = new ArrayList<>();
		final List<BatchUnit> failed = new ArrayList<>();
		boolean interrupted = false;
		for (int i = 0; i < futures.size(); i++) {
			final Future<BatchUnit> future = futures.get(i);
			// every unit runs to its end, an interrupt is only passed on afterwards
			while (true) {
				try {
					final BatchUnit unit = await(future, supported.get(i), targetLang, options);
					if (unit.status() == BatchUnit.Status.SUCCESS) {
						successful.add(unit);
					} else {
						failed.add(unit);
					}
					break;
				} catch (InterruptedException e) {
					interrupted = true;
				}
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
		this.log.info("Translated " + successful.size() + " file(s) to " + targetLang + ", " +
			failed.size() + " failed, " + skipped.size() + " skipped");
		return new BatchResult(successful, failed, skipped);
	}

	/**
	 * Translates all supported files found in a directory. Without an explicit output directory translations
	 * are written next to their sources; the directory structure below {@code directory} is mirrored.
	 *
	 * @param directory  directory to scan
	 * @param parameters translation parameters, including the target language
	 * @param options    output location, naming, scan options and progress reporting
	 * @return batch result
	 * @throws IOException if the directory does not exist, is not a directory or cannot be scanned
	 */
	@Nonnull
	public BatchResult translateDirectory(
		@Nonnull Path directory,
		@Nonnull TranslationParameters parameters,
		@Nonnull BatchOptions options
	) throws IOException {
		Objects.requireNonNull(directory, "directory must not be null");
		Objects.requireNonNull(options, "options must not be null");

		final List<Path> found = new FileScanner(options.pattern(), options.recursive()).scan(directory);
		final List<Path> supported = new ArrayList<>(found.size());
		for (final Path file : found) {
			if (this.fileTranslator.isSupported(file)) {
				supported.add(file);
			}
		}
		this.log.debug("Found " + found.size() + " file(s) in " + directory + ", " + supported.size() + " supported");

		final Path root = directory.toAbsolutePath().normalize();
		final BatchOptions directoryOptions = options
			.withOutputDir(options.outputDir() != null ? options.outputDir() : root)
			.withBaseDir(root);
		return translateFiles(supported, parameters, directoryOptions);
	}

	/**
	 * Derives counts from a batch result.
	 *
	 * @param result batch result
	 * @return statistics
	 */
	@Nonnull
	public BatchStatistics getStatistics(@Nonnull BatchResult result) {
		Objects.requireNonNull(result, "result must not be null");
		final int successful = result.successful().size();
		final int failed = result.failed().size();
		final int skipped = result.skipped().size();
		return new BatchStatistics(successful + failed + skipped, successful, failed, skipped);
	}

	public int getConcurrency() {
		return this.concurrency;
	}

	/**
	 * Computes where the translation of a file goes.
	 *
	 * The file name comes from the output pattern ({@code {name}}, {@code {lang}} and {@code {ext}}, where
	 * {@code {ext}} includes the leading dot) or defaults to {@code {name}.{lang}{ext}}. The directory is the output
	 * directory, else the base directory, else the source file's directory; with a base directory the source's
	 * relative subdirectory is appended.
	 *
	 * @param sourceFile source file
	 * @param targetLang target language code
	 * @param options    batch options
	 * @return output path
	 */
	@Nonnull
	static Path outputPathFor(@Nonnull Path sourceFile, @Nonnull String targetLang, @Nonnull BatchOptions options) {
		final Path absolute = sourceFile.toAbsolutePath().normalize();
		final String ext = FileTranslator.extensionOf(absolute);
		final String fileName = String.valueOf(absolute.getFileName());
		final String name = fileName.substring(0, fileName.length() - ext.length());
		final String outputName = options.outputPattern() == null || options.outputPattern().isBlank()
			? name + "." + targetLang + ext
			: options.outputPattern()
				.replace("{name}", name)
				.replace("{lang}", targetLang)
				.replace("{ext}", ext);

		final Path baseDir = options.baseDir() == null ? null : options.baseDir().toAbsolutePath().normalize();
		Path outputDir = options.outputDir() != null ? options.outputDir() : baseDir;
		if (outputDir == null) {
			outputDir = absolute.getParent();
		}
		if (baseDir != null && absolute.startsWith(baseDir)) {
			final Path relativeParent = baseDir.relativize(absolute).getParent();
			if (relativeParent != null) {
				outputDir = outputDir.resolve(relativeParent);
			}
		}
		return outputDir.resolve(outputName);
	}

	@Nonnull
	private BatchUnit translateUnit(
		@Nonnull Path file,
		@Nonnull TranslationParameters parameters,
		@Nonnull BatchOptions options,
		@Nonnull ProgressTracker progress
	) {
		final String targetLang = parameters.getTargetLang();
		Path outputPath = null;
		BatchUnit unit;
		try {
			outputPath = outputPathFor(file, targetLang, options);
			this.fileTranslator.translate(file, outputPath, parameters);
			this.log.info("Translated: " + file + " -> " + outputPath);
			unit = BatchUnit.success(file, targetLang, outputPath);
		} catch (Exception e) {
			this.log.error("Translation failed for " + file + ": " + e.getMessage());
			unit = BatchUnit.failed(file, targetLang, outputPath, messageOf(e));
		}
		progress.unitFinished(file);
		return unit;
	}

	/**
	 * Waits for one unit. Throws only when the waiting thread is interrupted; the unit itself keeps running.
	 */
	@Nonnull
	private BatchUnit await(
		@Nonnull Future<BatchUnit> future,
		@Nonnull Path file,
		@Nonnull String targetLang,
		@Nonnull BatchOptions options
	) throws InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			this.log.error("Failed to get translation result for " + file + ": " + e.getCause().getMessage());
			return BatchUnit.failed(file, targetLang, safeOutputPath(file, targetLang, options), messageOf(e.getCause()));
		}
	}

	@Nullable
	private static Path safeOutputPath(@Nonnull Path file, @Nonnull String targetLang, @Nonnull BatchOptions options) {
		try {
			return outputPathFor(file, targetLang, options);
		} catch (InvalidPathException e) {
			return null;
		}
	}

	@Nonnull
	private static String messageOf(@Nonnull Throwable throwable) {
		return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
	}

	/**
	 * Shuts down the worker pool gracefully, waiting for pending units to complete.
	 */
	public void shutdown() {
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Batch executor did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}

	/**
	 * Counts finished units and reports them; callbacks are serialized so {@code completed} never goes back.
	 * A failing callback never changes the outcome of the unit it reports.
	 */
	private static final class ProgressTracker {
		private final int total;
		@Nullable
		private final Consumer<BatchProgress> callback;
		private final Log log;
		private int completed;

		ProgressTracker(int total, @Nullable Consumer<BatchProgress> callback, @Nonnull Log log) {
			this.total = total;
			this.callback = callback;
			this.log = log;
		}

		synchronized void unitFinished(@Nonnull Path file) {
			this.completed++;
			if (this.callback == null) {
				return;
			}
			try {
				this.callback.accept(new BatchProgress(this.completed, this.total, file.toString()));
			} catch (RuntimeException e) {
				this.log.warn("Progress callback failed: " + e.getMessage());
			}
		}
	}
}
