package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Options controlling where batch output goes and which files a directory scan picks up.
 *
 * @param outputDir     directory for translated files; null writes next to each input file
 * @param outputPattern file name template with {@code {name}}, {@code {lang}} and {@code {ext}}
 *                      placeholders ({@code {ext}} includes the leading dot); null uses {@code {name}.{lang}{ext}}
 * @param recursive     whether a directory scan descends into subdirectories
 * @param pattern       glob matched against file names during a directory scan; null matches everything
 * @param baseDir       when set, the input's directory relative to it is mirrored below {@code outputDir}
 * @param progress      callback invoked after each attempted unit; may be null
 */
public record BatchOptions(
	@Nullable Path outputDir,
	@Nullable String outputPattern,
	boolean recursive,
	@Nullable String pattern,
	@Nullable Path baseDir,
	@Nullable Consumer<BatchProgress> progress
) {

	@Nonnull
	public static BatchOptions defaults() {
		return new BatchOptions(null, null, true, null, null, null);
	}

	@Nonnull
	public BatchOptions withOutputDir(@Nullable Path newOutputDir) {
		return new BatchOptions(newOutputDir, this.outputPattern, this.recursive, this.pattern, this.baseDir, this.progress);
	}

	@Nonnull
	public BatchOptions withOutputPattern(@Nullable String newOutputPattern) {
		return new BatchOptions(this.outputDir, newOutputPattern, this.recursive, this.pattern, this.baseDir, this.progress);
	}

	@Nonnull
	public BatchOptions withRecursive(boolean newRecursive) {
		return new BatchOptions(this.outputDir, this.outputPattern, newRecursive, this.pattern, this.baseDir, this.progress);
	}

	@Nonnull
	public BatchOptions withPattern(@Nullable String newPattern) {
		return new BatchOptions(this.outputDir, this.outputPattern, this.recursive, newPattern, this.baseDir, this.progress);
	}

	@Nonnull
	public BatchOptions withBaseDir(@Nullable Path newBaseDir) {
		return new BatchOptions(this.outputDir, this.outputPattern, this.recursive, this.pattern, newBaseDir, this.progress);
	}

	@Nonnull
	public BatchOptions withProgress(@Nullable Consumer<BatchProgress> newProgress) {
		return new BatchOptions(this.outputDir, this.outputPattern, this.recursive, this.pattern, this.baseDir, newProgress);
	}
}
