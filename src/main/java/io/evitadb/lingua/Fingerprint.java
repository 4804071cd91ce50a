package io.evitadb.lingua;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.lingua.model.TranslationParameters;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes cache keys for translation requests: {@code translation:} followed by the hex SHA-256 of a JSON
 * document listing the text and every parameter that changes the translated output, always in the same order.
 */
public final class Fingerprint {

	public static final String PREFIX = "translation:";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private Fingerprint() {
	}

	/**
	 * Computes the cache key.
	 *
	 * @param text       text as sent to the service
	 * @param parameters translation parameters
	 * @return cache key
	 */
	@Nonnull
	public static String of(@Nonnull String text, @Nonnull TranslationParameters parameters) {
		final ObjectNode node = MAPPER.createObjectNode();
		node.put("text", text);
		node.put("targetLang", parameters.getTargetLang());
		node.put("sourceLang", parameters.getSourceLang());
		node.put("formality", parameters.getFormality());
		node.put("glossaryId", parameters.getGlossaryId());
		node.put("context", parameters.getContext());
		node.put("modelType", parameters.getModelType());
		node.put("tagHandling", parameters.getTagHandling());
		node.put("splitSentences", parameters.getSplitSentences());
		node.put("outlineDetection", parameters.getOutlineDetection());
		putAll(node.putArray("splittingTags"), parameters.getSplittingTags());
		putAll(node.putArray("nonSplittingTags"), parameters.getNonSplittingTags());
		putAll(node.putArray("ignoreTags"), parameters.getIgnoreTags());
		putAll(node.putArray("customInstructions"), parameters.getCustomInstructions());
		node.put("styleId", parameters.getStyleId());
		try {
			return PREFIX + sha256(MAPPER.writeValueAsString(node));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize fingerprint input", e);
		}
	}

	private static void putAll(@Nonnull ArrayNode array, @Nonnull List<String> values) {
		values.forEach(array::add);
	}

	@Nonnull
	private static String sha256(@Nonnull String input) {
		try {
			final MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
}
