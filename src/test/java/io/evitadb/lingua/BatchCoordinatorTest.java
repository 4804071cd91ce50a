package io.evitadb.lingua;

import io.evitadb.lingua.http.ErrorClassifier;
import io.evitadb.lingua.http.FakeTransport;
import io.evitadb.lingua.http.RemoteRequest;
import io.evitadb.lingua.http.RequestExecutor;
import io.evitadb.lingua.http.TranslationClient;
import io.evitadb.lingua.model.BatchOptions;
import io.evitadb.lingua.model.BatchProgress;
import io.evitadb.lingua.model.BatchResult;
import io.evitadb.lingua.model.BatchStatistics;
import io.evitadb.lingua.model.BatchUnit;
import io.evitadb.lingua.model.TranslationParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchCoordinator should translate many files in parallel")
public class BatchCoordinatorTest {

	private static final TranslationParameters GERMAN = TranslationParameters.builder("de").build();

	private Path tempDir;
	private TestLog log;
	private FakeTransport transport;
	private FileTranslator fileTranslator;
	private BatchCoordinator coordinator;

	@BeforeEach
	void setUp() throws IOException {
		tempDir = Files.createTempDirectory("batch-test-");
		log = new TestLog();
		transport = new FakeTransport().respondWith(FakeTransport.prefixingTranslator());
		final TranslationClient client = new TranslationClient(new RequestExecutor(
			transport, new ErrorClassifier(), 0, Duration.ofSeconds(5), millis -> {}, Clock.systemUTC(), log
		));
		fileTranslator = new FileTranslator(new TranslationOrchestrator(client, null, log));
		coordinator = new BatchCoordinator(fileTranslator, 2, log);
	}

	@AfterEach
	void tearDown() throws IOException {
		coordinator.shutdown();
		deleteRecursively(tempDir);
	}

	@Test
	@DisplayName("shouldPartitionFilesByOutcome")
	void shouldPartitionFilesByOutcome() throws IOException {
		final Path text = write("a.txt", "Hello");
		final Path pdf = write("b.pdf", "%PDF");
		final Path markdown = write("c.md", "# Title");
		final Path empty = write("d.md", "   ");

		final BatchResult result = coordinator.translateFiles(List.of(text, pdf, markdown, empty), GERMAN, BatchOptions.defaults());

		assertEquals(List.of(text, markdown), sources(result.successful()));
		assertEquals(List.of(empty), sources(result.failed()));
		assertEquals(List.of(pdf), sources(result.skipped()));
		assertEquals(BatchUnit.UNSUPPORTED_FILE_TYPE, result.skipped().get(0).reason());
		assertNull(result.skipped().get(0).outputPath());
		assertEquals("Cannot translate empty file", result.failed().get(0).error());
		assertTrue(result.hasFailures());

		assertEquals("[DE] Hello", Files.readString(tempDir.resolve("a.de.txt"), StandardCharsets.UTF_8));
		assertEquals("[DE] # Title", Files.readString(tempDir.resolve("c.de.md"), StandardCharsets.UTF_8));
		assertEquals(2, transport.requestCount());
	}

	@Test
	@DisplayName("shouldKeepGoingWhenRemoteCallFails")
	void shouldKeepGoingWhenRemoteCallFails() throws IOException {
		final Path good = write("good.txt", "fine");
		final Path bad = write("bad.txt", "explode");
		transport.respondWith(request -> {
			final boolean explode = request.parameters().contains(new RemoteRequest.Parameter("text", "explode"));
			return explode
				? FakeTransport.response(403, "{\"message\":\"Wrong key\"}")
				: FakeTransport.prefixingTranslator().respond(request);
		});

		final BatchResult result = coordinator.translateFiles(List.of(bad, good), GERMAN, BatchOptions.defaults());

		assertEquals(List.of(good), sources(result.successful()));
		assertEquals(List.of(bad), sources(result.failed()));
		assertEquals("Authentication failed: Invalid API key", result.failed().get(0).error());
		assertEquals(tempDir.toAbsolutePath().normalize().resolve("bad.de.txt"), result.failed().get(0).outputPath());
		assertTrue(log.hasError("Translation failed for"));
	}

	@Test
	@DisplayName("shouldNeverExceedConfiguredConcurrency")
	void shouldNeverExceedConfiguredConcurrency() throws IOException {
		transport.withDelay(40);
		final List<Path> files = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			files.add(write("file" + i + ".txt", "content " + i));
		}

		final BatchResult result = coordinator.translateFiles(files, GERMAN, BatchOptions.defaults());

		assertEquals(8, result.successful().size());
		assertEquals(files, sources(result.successful()));
		assertTrue(transport.maxInFlight() <= 2);
	}

	@Test
	@DisplayName("shouldReportMonotonicProgressForAttemptedUnitsOnly")
	void shouldReportMonotonicProgressForAttemptedUnitsOnly() throws IOException {
		final List<BatchProgress> reports = Collections.synchronizedList(new ArrayList<>());
		final List<Path> files = List.of(
			write("one.md", "1"), write("two.md", "2"), write("skip.docx", "x"), write("three.txt", "3")
		);

		coordinator.translateFiles(files, GERMAN, BatchOptions.defaults().withProgress(reports::add));

		assertEquals(3, reports.size());
		for (int i = 0; i < reports.size(); i++) {
			assertEquals(i + 1, reports.get(i).completed());
			assertEquals(3, reports.get(i).total());
		}
	}

	@Test
	@DisplayName("shouldKeepUnitStatusWhenProgressCallbackFails")
	void shouldKeepUnitStatusWhenProgressCallbackFails() throws IOException {
		final Path file = write("a.txt", "Hello");

		final BatchResult result = coordinator.translateFiles(
			List.of(file), GERMAN, BatchOptions.defaults().withProgress(p -> {
				throw new IllegalStateException("ui broke");
			})
		);

		assertEquals(List.of(file), sources(result.successful()));
		assertTrue(result.failed().isEmpty());
		assertEquals("[DE] Hello", Files.readString(tempDir.resolve("a.de.txt"), StandardCharsets.UTF_8));
		assertTrue(log.hasWarning("Progress callback failed: ui broke"));
	}

	@Test
	@DisplayName("shouldFinishAllUnitsWhenCallerIsInterrupted")
	void shouldFinishAllUnitsWhenCallerIsInterrupted() throws IOException {
		transport.withDelay(30);
		final List<Path> files = List.of(write("one.txt", "1"), write("two.txt", "2"), write("three.txt", "3"));

		Thread.currentThread().interrupt();
		final BatchResult result;
		try {
			result = coordinator.translateFiles(files, GERMAN, BatchOptions.defaults());
		} finally {
			assertTrue(Thread.interrupted(), "interrupt flag must be restored");
		}

		assertEquals(files, sources(result.successful()));
		assertTrue(result.failed().isEmpty());
		for (final String name : List.of("one.de.txt", "two.de.txt", "three.de.txt")) {
			assertTrue(Files.exists(tempDir.resolve(name)), name);
		}
	}

	@Test
	@DisplayName("shouldReportInvalidOutputPatternAsFailedUnit")
	void shouldReportInvalidOutputPatternAsFailedUnit() throws IOException {
		final List<BatchProgress> reports = Collections.synchronizedList(new ArrayList<>());
		final List<Path> files = List.of(write("a.txt", "A"), write("b.md", "B"));

		final BatchResult result = coordinator.translateFiles(
			files, GERMAN, BatchOptions.defaults().withOutputPattern("{name}\u0000{ext}").withProgress(reports::add)
		);

		assertTrue(result.successful().isEmpty());
		assertEquals(files, sources(result.failed()));
		for (final BatchUnit unit : result.failed()) {
			assertNull(unit.outputPath());
			assertNotNull(unit.error());
		}
		assertEquals(2, reports.size());
		assertEquals(0, transport.requestCount());
		assertTrue(log.hasError("Translation failed for"));
	}

	@Test
	@DisplayName("shouldReturnEmptyResultForNoFiles")
	void shouldReturnEmptyResultForNoFiles() {
		final List<BatchProgress> reports = new ArrayList<>();

		final BatchResult result = coordinator.translateFiles(List.of(), GERMAN, BatchOptions.defaults().withProgress(reports::add));

		assertEquals(new BatchStatistics(0, 0, 0, 0), coordinator.getStatistics(result));
		assertTrue(reports.isEmpty());
		assertEquals(0, transport.requestCount());
	}

	@Test
	@DisplayName("shouldMirrorDirectoryStructureIntoOutputDirectory")
	void shouldMirrorDirectoryStructureIntoOutputDirectory() throws IOException {
		final Path source = Files.createDirectories(tempDir.resolve("docs"));
		write("docs/index.md", "Index");
		write("docs/guide/intro.md", "Intro");
		write("docs/guide/diagram.svg", "<svg/>");
		write("docs/.drafts/secret.md", "Secret");
		final Path output = tempDir.resolve("out");

		final BatchResult result = coordinator.translateDirectory(source, GERMAN, BatchOptions.defaults().withOutputDir(output));

		assertEquals(2, result.successful().size());
		assertTrue(result.skipped().isEmpty());
		assertEquals("[DE] Index", Files.readString(output.resolve("index.de.md"), StandardCharsets.UTF_8));
		assertEquals("[DE] Intro", Files.readString(output.resolve("guide").resolve("intro.de.md"), StandardCharsets.UTF_8));
		assertFalse(Files.exists(output.resolve(".drafts")));
	}

	@Test
	@DisplayName("shouldWriteNextToSourcesWithoutOutputDirectory")
	void shouldWriteNextToSourcesWithoutOutputDirectory() throws IOException {
		final Path source = Files.createDirectories(tempDir.resolve("site"));
		write("site/top.txt", "Top");
		write("site/nested/inner.txt", "Inner");

		final BatchResult result = coordinator.translateDirectory(
			source, GERMAN, BatchOptions.defaults().withPattern("*.txt").withOutputPattern("{lang}_{name}{ext}")
		);

		assertEquals(2, result.successful().size());
		assertTrue(Files.exists(source.resolve("de_top.txt")));
		assertTrue(Files.exists(source.resolve("nested").resolve("de_inner.txt")));
	}

	@Test
	@DisplayName("shouldOnlyScanTopLevelWhenNotRecursive")
	void shouldOnlyScanTopLevelWhenNotRecursive() throws IOException {
		final Path source = Files.createDirectories(tempDir.resolve("flat"));
		write("flat/top.md", "Top");
		write("flat/sub/deep.md", "Deep");

		final BatchResult result = coordinator.translateDirectory(source, GERMAN, BatchOptions.defaults().withRecursive(false));

		assertEquals(1, result.successful().size());
		assertEquals("top.md", result.successful().get(0).sourcePath().getFileName().toString());
	}

	@Test
	@DisplayName("shouldFailForMissingDirectory")
	void shouldFailForMissingDirectory() {
		assertThrows(
			IOException.class,
			() -> coordinator.translateDirectory(tempDir.resolve("missing"), GERMAN, BatchOptions.defaults())
		);
	}

	@Test
	@DisplayName("shouldComputeOutputPaths")
	void shouldComputeOutputPaths() {
		final Path base = tempDir.toAbsolutePath().normalize();
		final Path file = base.resolve("docs").resolve("readme.md");

		assertEquals(base.resolve("docs").resolve("readme.fr.md"), BatchCoordinator.outputPathFor(file, "fr", BatchOptions.defaults()));
		assertEquals(
			base.resolve("out").resolve("readme-fr.md"),
			BatchCoordinator.outputPathFor(file, "fr", BatchOptions.defaults().withOutputDir(base.resolve("out")).withOutputPattern("{name}-{lang}{ext}"))
		);
		assertEquals(
			base.resolve("out").resolve("docs").resolve("readme.fr.md"),
			BatchCoordinator.outputPathFor(file, "fr", BatchOptions.defaults().withOutputDir(base.resolve("out")).withBaseDir(base))
		);
		assertEquals(
			base.resolve("docs").resolve("readme.fr.md"),
			BatchCoordinator.outputPathFor(file, "fr", BatchOptions.defaults().withBaseDir(base))
		);
	}

	@Test
	@DisplayName("shouldCountUnitsInStatistics")
	void shouldCountUnitsInStatistics() throws IOException {
		final BatchResult result = coordinator.translateFiles(
			List.of(write("x.txt", "x"), write("y.bin", "y"), write("z.md", "")), GERMAN, BatchOptions.defaults()
		);

		assertEquals(new BatchStatistics(3, 1, 1, 1), coordinator.getStatistics(result));
	}

	@Test
	@DisplayName("shouldValidateConcurrency")
	void shouldValidateConcurrency() {
		assertEquals(
			"Concurrency must be at least 1",
			assertThrows(IllegalArgumentException.class, () -> new BatchCoordinator(fileTranslator, 0, log)).getMessage()
		);
		assertEquals(
			"Concurrency cannot exceed 100",
			assertThrows(IllegalArgumentException.class, () -> new BatchCoordinator(fileTranslator, 101, log)).getMessage()
		);
		final BatchCoordinator defaults = new BatchCoordinator(fileTranslator, log);
		assertEquals(BatchCoordinator.DEFAULT_CONCURRENCY, defaults.getConcurrency());
		defaults.shutdown();
	}

	private Path write(String relativePath, String content) throws IOException {
		final Path file = tempDir.resolve(relativePath);
		Files.createDirectories(file.getParent());
		Files.writeString(file, content, StandardCharsets.UTF_8);
		return file;
	}

	private static List<Path> sources(List<BatchUnit> units) {
		return units.stream().map(BatchUnit::sourcePath).collect(Collectors.toList());
	}

	private static void deleteRecursively(Path path) throws IOException {
		if (!Files.exists(path)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(path)) {
			walk.sorted(Comparator.reverseOrder()).forEach(p -> {
				try {
					Files.deleteIfExists(p);
				} catch (IOException e) {
					throw new RuntimeException(e);
				}
			});
		}
	}
}
