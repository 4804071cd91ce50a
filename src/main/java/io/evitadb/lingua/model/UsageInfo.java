package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Account usage for the current billing period.
 *
 * @param characterCount       characters translated so far
 * @param characterLimit       maximum characters allowed
 * @param apiKeyCharacterCount characters translated with the current API key, if reported
 * @param apiKeyCharacterLimit character limit of the current API key, if reported
 * @param startTime            start of the billing period, if reported
 * @param endTime              end of the billing period, if reported
 */
public record UsageInfo(
	long characterCount,
	long characterLimit,
	@Nullable Long apiKeyCharacterCount,
	@Nullable Long apiKeyCharacterLimit,
	@Nullable String startTime,
	@Nullable String endTime
) {

	/**
	 * Returns the used share of the limit in percent, rounded to two decimals.
	 *
	 * @return percentage used, 0 when the limit is zero
	 */
	public double percentageUsed() {
		if (this.characterLimit <= 0) {
			return 0.0;
		}
		return Math.round((double) this.characterCount / this.characterLimit * 100.0 * 100.0) / 100.0;
	}

	/**
	 * Returns the number of characters still available.
	 *
	 * @return remaining characters
	 */
	public long remaining() {
		return this.characterLimit - this.characterCount;
	}

	@Nonnull
	@Override
	public String toString() {
		return String.format(
			Locale.ROOT,
			"UsageInfo[characters=%d/%d (%.2f%%), remaining=%d]",
			this.characterCount, this.characterLimit, percentageUsed(), remaining()
		);
	}
}
