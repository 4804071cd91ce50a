package io.evitadb.lingua;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces fragments that must survive translation untouched with opaque tokens and puts them back afterwards.
 *
 * Placeholders ({@code ${name}}, {@code {name}}, {@code %s}, {@code %d}) are always protected. Markdown fenced
 * code blocks and inline code spans are protected only on request.
 */
public final class TextPreserver {

	private static final Pattern FENCED_CODE = Pattern.compile("```[\\s\\S]*?```");
	private static final Pattern INLINE_CODE = Pattern.compile("`[^`]+`");
	// order matters: ${name} must be consumed before {name}
	private static final List<Pattern> PLACEHOLDERS = List.of(
		Pattern.compile("\\$\\{[a-zA-Z0-9_]+}"),
		Pattern.compile("\\{[a-zA-Z0-9_]+}"),
		Pattern.compile("%[sd]")
	);

	private TextPreserver() {
	}

	/**
	 * Protects the text.
	 *
	 * @param text         original text
	 * @param preserveCode whether Markdown code should be protected as well
	 * @return protected text together with the token mapping
	 */
	@Nonnull
	public static Protected protect(@Nonnull String text, boolean preserveCode) {
		Objects.requireNonNull(text, "text must not be null");
		final Map<String, String> tokens = new LinkedHashMap<>();
		String processed = text;
		if (preserveCode) {
			final int[] counter = {0};
			processed = replace(processed, FENCED_CODE, "__CODE_", counter, tokens);
			processed = replace(processed, INLINE_CODE, "__CODE_", counter, tokens);
		}
		final int[] counter = {0};
		for (final Pattern pattern : PLACEHOLDERS) {
			processed = replace(processed, pattern, "__VAR_", counter, tokens);
		}
		return new Protected(processed, tokens);
	}

	@Nonnull
	private static String replace(
		@Nonnull String text,
		@Nonnull Pattern pattern,
		@Nonnull String prefix,
		@Nonnull int[] counter,
		@Nonnull Map<String, String> tokens
	) {
		final Matcher matcher = pattern.matcher(text);
		final StringBuilder result = new StringBuilder(text.length());
		while (matcher.find()) {
			final String token = prefix + counter[0]++ + "__";
			tokens.put(token, matcher.group());
			matcher.appendReplacement(result, Matcher.quoteReplacement(token));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	/**
	 * Text with protected fragments replaced by tokens.
	 *
	 * @param text   text to send for translation
	 * @param tokens token to original fragment, in replacement order
	 */
	public record Protected(@Nonnull String text, @Nonnull Map<String, String> tokens) {

		public Protected {
			tokens = Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
		}

		/**
		 * Puts the original fragments back into a translated text.
		 *
		 * @param translated text returned by the service
		 * @return text with all tokens restored
		 */
		@Nonnull
		public String restore(@Nonnull String translated) {
			String restored = translated;
			for (final Map.Entry<String, String> entry : this.tokens.entrySet()) {
				restored = restored.replace(entry.getKey(), entry.getValue());
			}
			return restored;
		}
	}
}
