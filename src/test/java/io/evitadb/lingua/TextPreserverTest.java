package io.evitadb.lingua;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextPreserver should shield placeholders and code from translation")
public class TextPreserverTest {

	@Test
	@DisplayName("shouldReplaceAllPlaceholderStyles")
	void shouldReplaceAllPlaceholderStyles() {
		final TextPreserver.Protected result = TextPreserver.protect("Hi ${user}, {count} items, %s and %d", false);

		assertEquals("Hi __VAR_0__, __VAR_1__ items, __VAR_2__ and __VAR_3__", result.text());
		assertEquals(
			Map.of("__VAR_0__", "${user}", "__VAR_1__", "{count}", "__VAR_2__", "%s", "__VAR_3__", "%d"),
			result.tokens()
		);
	}

	@Test
	@DisplayName("shouldLeaveCodeAloneUnlessAsked")
	void shouldLeaveCodeAloneUnlessAsked() {
		final String text = "Call `init()` first";

		assertEquals(text, TextPreserver.protect(text, false).text());
		assertEquals("Call __CODE_0__ first", TextPreserver.protect(text, true).text());
	}

	@Test
	@DisplayName("shouldNotTreatPlaceholdersInsideCodeAsSeparateTokens")
	void shouldNotTreatPlaceholdersInsideCodeAsSeparateTokens() {
		final TextPreserver.Protected result = TextPreserver.protect("Use `${HOME}` or {dir}", true);

		assertEquals("Use __CODE_0__ or __VAR_0__", result.text());
		assertEquals("`${HOME}`", result.tokens().get("__CODE_0__"));
	}

	@Test
	@DisplayName("shouldRestoreTokensAfterTranslation")
	void shouldRestoreTokensAfterTranslation() {
		final String original = "Intro\n```java\nString s = \"%s\";\n```\nValue: {value} and `x`";
		final TextPreserver.Protected result = TextPreserver.protect(original, true);

		final String translated = result.text().replace("Intro", "Einleitung").replace("Value", "Wert");

		assertEquals("Einleitung\n```java\nString s = \"%s\";\n```\nWert: {value} and `x`", result.restore(translated));
	}

	@Test
	@DisplayName("shouldKeepTextWithoutProtectedFragments")
	void shouldKeepTextWithoutProtectedFragments() {
		final TextPreserver.Protected result = TextPreserver.protect("Plain text, 100% sure {not closed", true);

		assertEquals("Plain text, 100% sure {not closed", result.text());
		assertTrue(result.tokens().isEmpty());
	}
}
