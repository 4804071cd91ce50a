package io.evitadb.lingua;

import io.evitadb.lingua.model.TranslateOptions;
import io.evitadb.lingua.model.TranslationParameters;
import io.evitadb.lingua.model.TranslationResult;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Translates a single text file and writes the translation next to it or wherever the caller asks.
 * Only plain text and Markdown files are accepted; code in Markdown is kept untranslated.
 */
public final class FileTranslator {

	public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".md");

	@Nonnull
	private final TranslationOrchestrator orchestrator;

	public FileTranslator(@Nonnull TranslationOrchestrator orchestrator) {
		this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
	}

	/**
	 * Returns true if the file extension is on the allowlist (case-insensitive).
	 *
	 * @param file file to check
	 * @return whether the file can be translated
	 */
	public boolean isSupported(@Nonnull Path file) {
		return SUPPORTED_EXTENSIONS.contains(extensionOf(file).toLowerCase(Locale.ROOT));
	}

	/**
	 * Reads the source file, translates its content and writes the result to the target file. The target is
	 * replaced atomically, so readers never see a partially written file.
	 *
	 * @param sourceFile file to translate
	 * @param targetFile where the translation is written; parent directories are created
	 * @param parameters translation parameters
	 * @return the translation result
	 * @throws IOException if the source cannot be read, is unsupported or empty, or the target cannot be written
	 */
	@Nonnull
	public TranslationResult translate(
		@Nonnull Path sourceFile,
		@Nonnull Path targetFile,
		@Nonnull TranslationParameters parameters
	) throws IOException {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");

		if (!isSupported(sourceFile)) {
			throw new IOException("Unsupported file type: " + extensionOf(sourceFile));
		}
		if (Files.isSymbolicLink(sourceFile)) {
			throw new IOException("Symbolic links are not supported: " + sourceFile);
		}
		final String content;
		try {
			content = Files.readString(sourceFile, StandardCharsets.UTF_8);
		} catch (NoSuchFileException e) {
			throw new IOException("Input file not found: " + sourceFile, e);
		}
		if (content.isBlank()) {
			throw new IOException("Cannot translate empty file");
		}

		final TranslationResult result = this.orchestrator.translate(content, parameters, new TranslateOptions(true, false));
		write(result.text(), targetFile);
		return result;
	}

	/**
	 * Returns the extension including the leading dot, or an empty string.
	 *
	 * @param file file path
	 * @return extension such as {@code .md}
	 */
	@Nonnull
	static String extensionOf(@Nonnull Path file) {
		final Path fileName = file.getFileName();
		if (fileName == null) {
			return "";
		}
		final String name = fileName.toString();
		final int dot = name.lastIndexOf('.');
		return dot <= 0 ? "" : name.substring(dot);
	}

	private static void write(@Nonnull String content, @Nonnull Path targetFile) throws IOException {
		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		final Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
		try {
			Files.writeString(temp, content, StandardCharsets.UTF_8);
			try {
				Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException e) {
			Files.deleteIfExists(temp);
			throw e;
		}
	}
}
