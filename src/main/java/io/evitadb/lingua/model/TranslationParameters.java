package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Immutable set of parameters for a single translation request.
 * Everything except the target language is optional; unset values are not sent to the remote service.
 *
 * Instances are created through {@link #builder(String)} and derived through {@link #toBuilder()}.
 */
public final class TranslationParameters {

	@Nonnull
	private final String targetLang;
	@Nullable
	private final String sourceLang;
	@Nullable
	private final String formality;
	@Nullable
	private final String glossaryId;
	@Nullable
	private final String context;
	@Nullable
	private final String modelType;
	@Nullable
	private final String tagHandling;
	@Nullable
	private final String splitSentences;
	private final boolean preserveFormatting;
	@Nullable
	private final Boolean outlineDetection;
	@Nonnull
	private final List<String> splittingTags;
	@Nonnull
	private final List<String> nonSplittingTags;
	@Nonnull
	private final List<String> ignoreTags;
	@Nonnull
	private final List<String> customInstructions;
	@Nullable
	private final String styleId;
	private final boolean showBilledCharacters;

	private TranslationParameters(@Nonnull Builder builder) {
		this.targetLang = Objects.requireNonNull(builder.targetLang, "targetLang must not be null");
		if (this.targetLang.isBlank()) {
			throw new IllegalArgumentException("Target language is required");
		}
		this.sourceLang = builder.sourceLang;
		this.formality = builder.formality;
		this.glossaryId = builder.glossaryId;
		this.context = builder.context;
		this.modelType = builder.modelType;
		this.tagHandling = builder.tagHandling;
		this.splitSentences = builder.splitSentences;
		this.preserveFormatting = builder.preserveFormatting;
		this.outlineDetection = builder.outlineDetection;
		this.splittingTags = List.copyOf(builder.splittingTags);
		this.nonSplittingTags = List.copyOf(builder.nonSplittingTags);
		this.ignoreTags = List.copyOf(builder.ignoreTags);
		this.customInstructions = List.copyOf(builder.customInstructions);
		this.styleId = builder.styleId;
		this.showBilledCharacters = builder.showBilledCharacters;
	}

	/**
	 * Starts building parameters for the given target language.
	 *
	 * @param targetLang target language code, e.g. {@code de} or {@code en-US}
	 * @return a new builder
	 */
	@Nonnull
	public static Builder builder(@Nonnull String targetLang) {
		return new Builder(targetLang);
	}

	/**
	 * Returns a builder pre-populated with all values of this instance.
	 *
	 * @return a new builder
	 */
	@Nonnull
	public Builder toBuilder() {
		final Builder builder = new Builder(this.targetLang);
		builder.sourceLang = this.sourceLang;
		builder.formality = this.formality;
		builder.glossaryId = this.glossaryId;
		builder.context = this.context;
		builder.modelType = this.modelType;
		builder.tagHandling = this.tagHandling;
		builder.splitSentences = this.splitSentences;
		builder.preserveFormatting = this.preserveFormatting;
		builder.outlineDetection = this.outlineDetection;
		builder.splittingTags = this.splittingTags;
		builder.nonSplittingTags = this.nonSplittingTags;
		builder.ignoreTags = this.ignoreTags;
		builder.customInstructions = this.customInstructions;
		builder.styleId = this.styleId;
		builder.showBilledCharacters = this.showBilledCharacters;
		return builder;
	}

	/**
	 * Returns a copy of these parameters with a different target language.
	 *
	 * @param targetLang the new target language
	 * @return new parameters instance
	 */
	@Nonnull
	public TranslationParameters withTargetLang(@Nonnull String targetLang) {
		return toBuilder().targetLang(targetLang).build();
	}

	@Nonnull
	public String getTargetLang() {
		return this.targetLang;
	}

	@Nullable
	public String getSourceLang() {
		return this.sourceLang;
	}

	@Nullable
	public String getFormality() {
		return this.formality;
	}

	@Nullable
	public String getGlossaryId() {
		return this.glossaryId;
	}

	@Nullable
	public String getContext() {
		return this.context;
	}

	@Nullable
	public String getModelType() {
		return this.modelType;
	}

	@Nullable
	public String getTagHandling() {
		return this.tagHandling;
	}

	@Nullable
	public String getSplitSentences() {
		return this.splitSentences;
	}

	public boolean isPreserveFormatting() {
		return this.preserveFormatting;
	}

	@Nullable
	public Boolean getOutlineDetection() {
		return this.outlineDetection;
	}

	@Nonnull
	public List<String> getSplittingTags() {
		return this.splittingTags;
	}

	@Nonnull
	public List<String> getNonSplittingTags() {
		return this.nonSplittingTags;
	}

	@Nonnull
	public List<String> getIgnoreTags() {
		return this.ignoreTags;
	}

	@Nonnull
	public List<String> getCustomInstructions() {
		return this.customInstructions;
	}

	@Nullable
	public String getStyleId() {
		return this.styleId;
	}

	public boolean isShowBilledCharacters() {
		return this.showBilledCharacters;
	}

	@Override
	public String toString() {
		return "TranslationParameters[targetLang=" + this.targetLang +
			(this.sourceLang != null ? ", sourceLang=" + this.sourceLang : "") +
			(this.formality != null ? ", formality=" + this.formality : "") +
			(this.glossaryId != null ? ", glossaryId=" + this.glossaryId : "") +
			(this.modelType != null ? ", modelType=" + this.modelType : "") + "]";
	}

	/**
	 * Mutable builder of {@link TranslationParameters}.
	 */
	public static final class Builder {
		@Nonnull
		private String targetLang;
		private String sourceLang;
		private String formality;
		private String glossaryId;
		private String context;
		private String modelType;
		private String tagHandling;
		private String splitSentences;
		private boolean preserveFormatting;
		private Boolean outlineDetection;
		private List<String> splittingTags = List.of();
		private List<String> nonSplittingTags = List.of();
		private List<String> ignoreTags = List.of();
		private List<String> customInstructions = List.of();
		private String styleId;
		private boolean showBilledCharacters;

		private Builder(@Nonnull String targetLang) {
			this.targetLang = Objects.requireNonNull(targetLang, "targetLang must not be null");
		}

		@Nonnull
		public Builder targetLang(@Nonnull String targetLang) {
			this.targetLang = Objects.requireNonNull(targetLang, "targetLang must not be null");
			return this;
		}

		@Nonnull
		public Builder sourceLang(@Nullable String sourceLang) {
			this.sourceLang = sourceLang;
			return this;
		}

		@Nonnull
		public Builder formality(@Nullable String formality) {
			this.formality = formality;
			return this;
		}

		@Nonnull
		public Builder glossaryId(@Nullable String glossaryId) {
			this.glossaryId = glossaryId;
			return this;
		}

		@Nonnull
		public Builder context(@Nullable String context) {
			this.context = context;
			return this;
		}

		@Nonnull
		public Builder modelType(@Nullable String modelType) {
			this.modelType = modelType;
			return this;
		}

		@Nonnull
		public Builder tagHandling(@Nullable String tagHandling) {
			this.tagHandling = tagHandling;
			return this;
		}

		/**
		 * Sets sentence splitting: {@code on}, {@code off} or {@code nonewlines}.
		 */
		@Nonnull
		public Builder splitSentences(@Nullable String splitSentences) {
			this.splitSentences = splitSentences;
			return this;
		}

		@Nonnull
		public Builder preserveFormatting(boolean preserveFormatting) {
			this.preserveFormatting = preserveFormatting;
			return this;
		}

		@Nonnull
		public Builder outlineDetection(@Nullable Boolean outlineDetection) {
			this.outlineDetection = outlineDetection;
			return this;
		}

		@Nonnull
		public Builder splittingTags(@Nonnull List<String> splittingTags) {
			this.splittingTags = Objects.requireNonNull(splittingTags, "splittingTags must not be null");
			return this;
		}

		@Nonnull
		public Builder nonSplittingTags(@Nonnull List<String> nonSplittingTags) {
			this.nonSplittingTags = Objects.requireNonNull(nonSplittingTags, "nonSplittingTags must not be null");
			return this;
		}

		@Nonnull
		public Builder ignoreTags(@Nonnull List<String> ignoreTags) {
			this.ignoreTags = Objects.requireNonNull(ignoreTags, "ignoreTags must not be null");
			return this;
		}

		@Nonnull
		public Builder customInstructions(@Nonnull List<String> customInstructions) {
			this.customInstructions = Objects.requireNonNull(customInstructions, "customInstructions must not be null");
			return this;
		}

		@Nonnull
		public Builder styleId(@Nullable String styleId) {
			this.styleId = styleId;
			return this;
		}

		@Nonnull
		public Builder showBilledCharacters(boolean showBilledCharacters) {
			this.showBilledCharacters = showBilledCharacters;
			return this;
		}

		@Nonnull
		public TranslationParameters build() {
			return new TranslationParameters(this);
		}
	}
}
