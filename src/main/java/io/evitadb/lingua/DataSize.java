package io.evitadb.lingua;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats human-readable byte sizes such as {@code 100}, {@code 512K}, {@code 100MB} or {@code 1.5G}.
 * Units are binary: K = 1024 bytes.
 */
public final class DataSize {

	private static final Pattern SIZE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([KMGT]B?|B)?$");
	private static final long KIB = 1024L;

	private DataSize() {
	}

	/**
	 * Parses a size.
	 *
	 * @param size size text, plain numbers are bytes
	 * @return number of bytes
	 * @throws IllegalArgumentException if the text is empty or not a size
	 */
	public static long parse(@Nonnull String size) {
		if (size == null || size.isBlank()) {
			throw new IllegalArgumentException("Size cannot be empty");
		}
		final Matcher matcher = SIZE.matcher(size.trim().toUpperCase(Locale.ROOT));
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Invalid size format: " + size + ". Use formats like: 100, 100K, 100MB, 1G");
		}
		final BigDecimal value = new BigDecimal(matcher.group(1));
		final String unit = matcher.group(2);
		final long multiplier = unit == null ? 1L : multiplierOf(unit.charAt(0));
		try {
			return value.multiply(BigDecimal.valueOf(multiplier)).toBigInteger().longValueExact();
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Size is too large: " + size, e);
		}
	}

	/**
	 * Formats a byte count with two decimals in the largest fitting unit.
	 *
	 * @param bytes number of bytes
	 * @return formatted size, e.g. {@code 1.50 MB}
	 */
	@Nonnull
	public static String format(long bytes) {
		if (bytes < KIB) {
			return bytes + " B";
		}
		if (bytes < KIB * KIB) {
			return String.format(Locale.ROOT, "%.2f KB", bytes / (double) KIB);
		}
		if (bytes < KIB * KIB * KIB) {
			return String.format(Locale.ROOT, "%.2f MB", bytes / (double) (KIB * KIB));
		}
		return String.format(Locale.ROOT, "%.2f GB", bytes / (double) (KIB * KIB * KIB));
	}

	private static long multiplierOf(char unit) {
		switch (unit) {
			case 'K':
				return KIB;
			case 'M':
				return KIB * KIB;
			case 'G':
				return KIB * KIB * KIB;
			case 'T':
				return KIB * KIB * KIB * KIB;
			default:
				return 1L;
		}
	}
}
