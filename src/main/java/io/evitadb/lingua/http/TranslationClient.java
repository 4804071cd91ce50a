package io.evitadb.lingua.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lingua.http.RemoteRequest.Parameter;
import io.evitadb.lingua.model.LanguageInfo;
import io.evitadb.lingua.model.LanguageType;
import io.evitadb.lingua.model.TranslationParameters;
import io.evitadb.lingua.model.TranslationResult;
import io.evitadb.lingua.model.UsageInfo;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed client of the translation, usage and language-listing endpoints.
 * All calls go through the {@link RequestExecutor}, so they share its retry policy and trace id.
 */
public final class TranslationClient {

	static final String TRANSLATE_PATH = "/v2/translate";
	static final String USAGE_PATH = "/v2/usage";
	static final String LANGUAGES_PATH = "/v2/languages";

	@Nonnull
	private final RequestExecutor executor;
	@Nonnull
	private final ObjectMapper objectMapper;

	public TranslationClient(@Nonnull RequestExecutor executor) {
		this(executor, new ObjectMapper());
	}

	public TranslationClient(@Nonnull RequestExecutor executor, @Nonnull ObjectMapper objectMapper) {
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Translates the texts in a single request. Results are returned in input order.
	 *
	 * @param texts      texts to translate, must not be empty
	 * @param parameters translation parameters
	 * @return one result per input text
	 * @throws RequestException when the call fails or the response does not match the request
	 */
	@Nonnull
	public List<TranslationResult> translate(@Nonnull List<String> texts, @Nonnull TranslationParameters parameters) {
		Objects.requireNonNull(texts, "texts must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");
		if (texts.isEmpty()) {
			return List.of();
		}
		final RemoteRequest request = RemoteRequest.postForm(TRANSLATE_PATH, buildTranslationParameters(texts, parameters));
		return this.executor.execute(request, response -> parseTranslations(response, texts.size(), parameters.getTargetLang()));
	}

	/**
	 * Returns usage of the current billing period.
	 *
	 * @return usage information
	 */
	@Nonnull
	public UsageInfo getUsage() {
		return this.executor.execute(RemoteRequest.get(USAGE_PATH, List.of()), this::parseUsage);
	}

	/**
	 * Returns languages supported as source or target.
	 *
	 * @param type listing direction
	 * @return supported languages
	 */
	@Nonnull
	public List<LanguageInfo> getSupportedLanguages(@Nonnull LanguageType type) {
		Objects.requireNonNull(type, "type must not be null");
		final RemoteRequest request = RemoteRequest.get(LANGUAGES_PATH, List.of(new Parameter("type", type.parameterValue())));
		return this.executor.execute(request, this::parseLanguages);
	}

	/**
	 * Returns the trace id of the most recent response, for error reports.
	 *
	 * @return last trace id or empty
	 */
	@Nonnull
	public Optional<String> getLastTraceId() {
		return this.executor.getLastTraceId();
	}

	@Nonnull
	static List<Parameter> buildTranslationParameters(@Nonnull List<String> texts, @Nonnull TranslationParameters p) {
		final List<Parameter> params = new ArrayList<>();
		for (final String text : texts) {
			params.add(new Parameter("text", text));
		}
		params.add(new Parameter("target_lang", p.getTargetLang().toUpperCase(Locale.ROOT)));
		if (p.getSourceLang() != null) {
			params.add(new Parameter("source_lang", p.getSourceLang().toUpperCase(Locale.ROOT)));
		}
		addIfPresent(params, "formality", p.getFormality());
		addIfPresent(params, "glossary_id", p.getGlossaryId());
		if (p.isPreserveFormatting()) {
			params.add(new Parameter("preserve_formatting", "1"));
		}
		addIfPresent(params, "context", p.getContext());
		if (p.getSplitSentences() != null) {
			final String split = switch (p.getSplitSentences()) {
				case "on" -> "1";
				case "off" -> "0";
				default -> p.getSplitSentences();
			};
			params.add(new Parameter("split_sentences", split));
		}
		addIfPresent(params, "tag_handling", p.getTagHandling());
		addIfPresent(params, "model_type", p.getModelType());
		if (p.isShowBilledCharacters()) {
			params.add(new Parameter("show_billed_characters", "1"));
		}
		if (p.getOutlineDetection() != null) {
			params.add(new Parameter("outline_detection", p.getOutlineDetection() ? "1" : "0"));
		}
		if (!p.getSplittingTags().isEmpty()) {
			params.add(new Parameter("splitting_tags", String.join(",", p.getSplittingTags())));
		}
		if (!p.getNonSplittingTags().isEmpty()) {
			params.add(new Parameter("non_splitting_tags", String.join(",", p.getNonSplittingTags())));
		}
		if (!p.getIgnoreTags().isEmpty()) {
			params.add(new Parameter("ignore_tags", String.join(",", p.getIgnoreTags())));
		}
		for (final String instruction : p.getCustomInstructions()) {
			params.add(new Parameter("custom_instructions", instruction));
		}
		addIfPresent(params, "style_id", p.getStyleId());
		return params;
	}

	private static void addIfPresent(@Nonnull List<Parameter> params, @Nonnull String name, @Nullable String value) {
		if (value != null && !value.isBlank()) {
			params.add(new Parameter(name, value));
		}
	}

	@Nonnull
	private List<TranslationResult> parseTranslations(
		@Nonnull RemoteResponse response,
		int expectedCount,
		@Nonnull String targetLang
	) throws IOException {
		final JsonNode root = this.objectMapper.readTree(response.body());
		final JsonNode translations = root == null ? null : root.get("translations");
		if (translations == null || !translations.isArray() || translations.isEmpty()) {
			throw new IOException("No translation returned for " + expectedCount + " text(s) to " + targetLang);
		}
		if (translations.size() != expectedCount) {
			throw new IOException(
				"Translation count mismatch: sent " + expectedCount + " texts but received " +
					translations.size() + " translations. Target language: " + targetLang
			);
		}
		final Integer responseBilled = intOrNull(root.get("billed_characters"));
		final List<TranslationResult> results = new ArrayList<>(expectedCount);
		for (final JsonNode translation : translations) {
			final JsonNode text = translation.get("text");
			if (text == null || !text.isTextual()) {
				throw new IOException("Translation entry without text");
			}
			final String detected = textOrNull(translation.get("detected_source_language"));
			final Integer billed = intOrNull(translation.get("billed_characters"));
			results.add(TranslationResult.remote(
				text.asText(),
				detected == null ? null : detected.toLowerCase(Locale.ROOT),
				billed != null ? billed : responseBilled,
				textOrNull(translation.get("model_type_used"))
			));
		}
		return results;
	}

	@Nonnull
	private UsageInfo parseUsage(@Nonnull RemoteResponse response) throws IOException {
		final JsonNode root = this.objectMapper.readTree(response.body());
		if (root == null || !root.hasNonNull("character_count") || !root.hasNonNull("character_limit")) {
			throw new IOException("Usage response without character_count or character_limit");
		}
		return new UsageInfo(
			root.get("character_count").asLong(),
			root.get("character_limit").asLong(),
			root.hasNonNull("api_key_character_count") ? root.get("api_key_character_count").asLong() : null,
			root.hasNonNull("api_key_character_limit") ? root.get("api_key_character_limit").asLong() : null,
			textOrNull(root.get("start_time")),
			textOrNull(root.get("end_time"))
		);
	}

	@Nonnull
	private List<LanguageInfo> parseLanguages(@Nonnull RemoteResponse response) throws IOException {
		final JsonNode root = this.objectMapper.readTree(response.body());
		if (root == null || !root.isArray()) {
			throw new IOException("Language listing is not an array");
		}
		final List<LanguageInfo> languages = new ArrayList<>(root.size());
		for (final JsonNode node : root) {
			final String language = textOrNull(node.get("language"));
			final String name = textOrNull(node.get("name"));
			if (language == null || name == null) {
				throw new IOException("Language entry without language or name");
			}
			final JsonNode formality = node.get("supports_formality");
			languages.add(new LanguageInfo(
				language.toLowerCase(Locale.ROOT),
				name,
				formality != null && formality.isBoolean() ? formality.asBoolean() : null
			));
		}
		return languages;
	}

	@Nullable
	private static String textOrNull(@Nullable JsonNode node) {
		return node != null && node.isTextual() ? node.asText() : null;
	}

	@Nullable
	private static Integer intOrNull(@Nullable JsonNode node) {
		return node != null && node.isNumber() ? node.asInt() : null;
	}
}
