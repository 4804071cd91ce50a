package io.evitadb.lingua;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Collects files below a directory whose names match a glob pattern.
 *
 * - Result order is deterministic: lexicographical order of the paths.
 * - Hidden files and directories (name starting with a dot) are ignored.
 * - Symbolic links are never followed and never returned.
 */
public final class FileScanner {

	public static final String DEFAULT_PATTERN = "*";

	@Nonnull
	private final PathMatcher nameMatcher;
	private final boolean recursive;

	/**
	 * Create a scanner.
	 *
	 * @param pattern   glob matched against file names, {@code *} when null
	 * @param recursive whether to descend into subdirectories
	 */
	public FileScanner(@Nullable String pattern, boolean recursive) {
		final String glob = pattern == null || pattern.isBlank() ? DEFAULT_PATTERN : pattern;
		this.nameMatcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
		this.recursive = recursive;
	}

	/**
	 * Scans the directory.
	 *
	 * @param directory directory to scan
	 * @return matching regular files
	 * @throws IOException when the directory does not exist, is not a directory or cannot be read
	 */
	@Nonnull
	public List<Path> scan(@Nonnull Path directory) throws IOException {
		Objects.requireNonNull(directory, "directory must not be null");
		if (!Files.exists(directory)) {
			throw new IOException("Directory not found: " + directory);
		}
		if (!Files.isDirectory(directory)) {
			throw new IOException("Not a directory: " + directory);
		}
		final List<Path> files = new ArrayList<>();
		collectFiles(directory.toAbsolutePath().normalize(), files);
		files.sort(Comparator.comparing(Path::toString));
		return files;
	}

	private void collectFiles(@Nonnull Path dir, @Nonnull List<Path> out) throws IOException {
		final List<Path> children = new ArrayList<>();
		try (Stream<Path> stream = Files.list(dir)) {
			stream.forEach(children::add);
		}
		children.sort(Comparator.comparing(Path::toString));
		for (final Path child : children) {
			final Path fileName = child.getFileName();
			if (fileName == null || fileName.toString().startsWith(".")) {
				continue;
			}
			final BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
			if (attrs.isDirectory()) {
				if (this.recursive) {
					collectFiles(child, out);
				}
			} else if (attrs.isRegularFile() && this.nameMatcher.matches(fileName)) {
				out.add(child);
			}
		}
	}
}
