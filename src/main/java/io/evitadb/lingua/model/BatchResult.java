package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a batch run, with every unit placed in the list matching its terminal status.
 *
 * @param successful units translated and written
 * @param failed     units whose translation or I/O failed
 * @param skipped    units never attempted
 */
public record BatchResult(
	@Nonnull List<BatchUnit> successful,
	@Nonnull List<BatchUnit> failed,
	@Nonnull List<BatchUnit> skipped
) {

	public BatchResult {
		successful = List.copyOf(Objects.requireNonNull(successful, "successful must not be null"));
		failed = List.copyOf(Objects.requireNonNull(failed, "failed must not be null"));
		skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped must not be null"));
	}

	@Nonnull
	public static BatchResult empty() {
		return new BatchResult(List.of(), List.of(), List.of());
	}

	public boolean hasFailures() {
		return !this.failed.isEmpty();
	}
}
