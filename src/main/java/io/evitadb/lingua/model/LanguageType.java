package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Direction of a language listing: languages accepted as input or produced as output.
 */
public enum LanguageType {
	SOURCE,
	TARGET;

	/**
	 * Returns the value of the {@code type} query parameter for this listing.
	 *
	 * @return lower-case parameter value
	 */
	@Nonnull
	public String parameterValue() {
		return name().toLowerCase(Locale.ROOT);
	}
}
