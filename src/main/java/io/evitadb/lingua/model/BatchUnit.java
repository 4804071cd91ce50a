package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Terminal state of one file-to-language translation task within a batch.
 * A unit is created exactly once, when its outcome is known, and never changes afterwards.
 *
 * @param sourcePath the input file
 * @param targetLang the target language
 * @param outputPath the computed output file (null for skipped units and when no valid path could be computed)
 * @param status     the terminal status
 * @param message    error message for failed units, skip reason for skipped units, null otherwise
 */
public record BatchUnit(
	@Nonnull Path sourcePath,
	@Nonnull String targetLang,
	@Nullable Path outputPath,
	@Nonnull Status status,
	@Nullable String message
) {

	/** Skip reason used for files whose extension is not on the allowlist. */
	public static final String UNSUPPORTED_FILE_TYPE = "Unsupported file type";

	/**
	 * Terminal status of a batch unit.
	 */
	public enum Status {
		SUCCESS,
		FAILED,
		SKIPPED
	}

	public BatchUnit {
		Objects.requireNonNull(sourcePath, "sourcePath must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");
		Objects.requireNonNull(status, "status must not be null");
	}

	@Nonnull
	public static BatchUnit success(@Nonnull Path sourcePath, @Nonnull String targetLang, @Nonnull Path outputPath) {
		return new BatchUnit(sourcePath, targetLang, Objects.requireNonNull(outputPath, "outputPath must not be null"), Status.SUCCESS, null);
	}

	@Nonnull
	public static BatchUnit failed(
		@Nonnull Path sourcePath,
		@Nonnull String targetLang,
		@Nullable Path outputPath,
		@Nonnull String error
	) {
		return new BatchUnit(sourcePath, targetLang, outputPath, Status.FAILED, error);
	}

	@Nonnull
	public static BatchUnit skipped(@Nonnull Path sourcePath, @Nonnull String targetLang, @Nonnull String reason) {
		return new BatchUnit(sourcePath, targetLang, null, Status.SKIPPED, reason);
	}

	/**
	 * Returns the error message of a failed unit.
	 *
	 * @return error message or null when the unit did not fail
	 */
	@Nullable
	public String error() {
		return this.status == Status.FAILED ? this.message : null;
	}

	/**
	 * Returns the reason a unit was skipped.
	 *
	 * @return skip reason or null when the unit was not skipped
	 */
	@Nullable
	public String reason() {
		return this.status == Status.SKIPPED ? this.message : null;
	}
}
