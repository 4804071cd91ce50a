package io.evitadb.lingua.model;

/**
 * Unit counts derived from a {@link BatchResult}.
 *
 * @param total      number of units of any status
 * @param successful number of successful units
 * @param failed     number of failed units
 * @param skipped    number of skipped units
 */
public record BatchStatistics(int total, int successful, int failed, int skipped) {

	@Override
	public String toString() {
		return String.format(
			"BatchStatistics[total=%d, successful=%d, failed=%d, skipped=%d]",
			this.total, this.successful, this.failed, this.skipped
		);
	}
}
