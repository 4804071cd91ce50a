package io.evitadb.lingua.cache;

import io.evitadb.lingua.MutableClock;
import io.evitadb.lingua.TestLog;
import io.evitadb.lingua.model.TranslationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationCache should persist bounded, expiring entries")
public class TranslationCacheTest {

	private Path tempDir;
	private Path databasePath;
	private MutableClock clock;
	private TestLog log;
	private TranslationCache cache;

	@BeforeEach
	void setUp() throws IOException {
		tempDir = Files.createTempDirectory("cache-test-");
		databasePath = tempDir.resolve("db").resolve("cache");
		clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
		log = new TestLog();
		cache = new TranslationCache(databasePath, 1024 * 1024, Duration.ofDays(30), clock, log);
	}

	@AfterEach
	void tearDown() throws IOException {
		cache.close();
		deleteRecursively(tempDir);
	}

	@Test
	@DisplayName("shouldReturnStoredValue")
	void shouldReturnStoredValue() {
		final TranslationResult stored = TranslationResult.remote("Hallo", "en", 5, null);
		cache.set("k1", stored);

		final Optional<CacheHit<TranslationResult>> hit = cache.get("k1", TranslationResult.class);

		assertTrue(hit.isPresent());
		assertEquals(stored, hit.get().value());
		assertEquals(clock.instant(), hit.get().insertedAt());
		assertTrue(cache.get("missing", TranslationResult.class).isEmpty());
	}

	@Test
	@DisplayName("shouldDistinguishStoredNullFromMissingEntry")
	void shouldDistinguishStoredNullFromMissingEntry() {
		cache.set("nothing", null);

		final Optional<CacheHit<String>> hit = cache.get("nothing", String.class);

		assertTrue(hit.isPresent());
		assertNull(hit.get().value());
	}

	@Test
	@DisplayName("shouldKeepValuesAcrossReopen")
	void shouldKeepValuesAcrossReopen() throws IOException {
		cache.set("k", Map.of("text", "persisted"));
		cache.close();

		cache = new TranslationCache(databasePath, 1024 * 1024, Duration.ofDays(30), clock, log);

		assertEquals("persisted", cache.get("k", Map.class).orElseThrow().value().get("text"));
		assertEquals(1, cache.stats().entryCount());
	}

	@Test
	@DisplayName("shouldReplaceValueAndTrackSize")
	void shouldReplaceValueAndTrackSize() {
		cache.set("k", "short");
		cache.set("k", "a considerably longer value");

		final CacheStats stats = cache.stats();

		assertEquals(1, stats.entryCount());
		assertEquals(jsonSize("a considerably longer value"), stats.totalSize());
		assertEquals("a considerably longer value", cache.get("k", String.class).orElseThrow().value());
	}

	@Test
	@DisplayName("shouldEvictOldestEntryWhenBoundIsExceeded")
	void shouldEvictOldestEntryWhenBoundIsExceeded() throws IOException {
		cache.close();
		cache = new TranslationCache(databasePath, 100, Duration.ofDays(30), clock, log);
		// each value serializes to exactly 60 bytes including the JSON quotes
		final String sixty = "x".repeat(58);

		cache.set("a", sixty);
		clock.advance(Duration.ofSeconds(1));
		cache.set("b", sixty);

		assertTrue(cache.get("a", String.class).isEmpty());
		assertTrue(cache.get("b", String.class).isPresent());
		assertEquals(60, cache.stats().totalSize());
	}

	@Test
	@DisplayName("shouldNotRefreshEntryOnRead")
	void shouldNotRefreshEntryOnRead() throws IOException {
		cache.close();
		cache = new TranslationCache(databasePath, 100, Duration.ofDays(30), clock, log);
		// each value serializes to exactly 40 bytes including the JSON quotes
		final String forty = "x".repeat(38);

		cache.set("a", forty);
		clock.advance(Duration.ofSeconds(1));
		cache.set("c", forty);
		clock.advance(Duration.ofSeconds(1));
		assertTrue(cache.get("a", String.class).isPresent());
		clock.advance(Duration.ofSeconds(1));
		cache.set("b", forty);

		assertTrue(cache.get("a", String.class).isEmpty());
		assertTrue(cache.get("c", String.class).isPresent());
		assertTrue(cache.get("b", String.class).isPresent());
		assertEquals(80, cache.stats().totalSize());
	}

	@Test
	@DisplayName("shouldNeverExceedMaxSize")
	void shouldNeverExceedMaxSize() throws IOException {
		cache.close();
		cache = new TranslationCache(databasePath, 500, Duration.ofDays(30), clock, log);

		for (int i = 0; i < 50; i++) {
			cache.set("key-" + i, "value-" + "y".repeat(i % 40));
			assertTrue(cache.stats().totalSize() <= 500, "size bound violated after entry " + i);
		}
		assertTrue(cache.get("key-49", String.class).isPresent());
	}

	@Test
	@DisplayName("shouldEvictInInsertionOrderWithinSameMillisecond")
	void shouldEvictInInsertionOrderWithinSameMillisecond() throws IOException {
		cache.close();
		cache = new TranslationCache(databasePath, 25, Duration.ofDays(30), clock, log);

		cache.set("z", "1234567");
		cache.set("a", "1234567");
		cache.set("m", "1234567");

		assertTrue(cache.get("z", String.class).isEmpty());
		assertTrue(cache.get("a", String.class).isPresent());
		assertTrue(cache.get("m", String.class).isPresent());
	}

	@Test
	@DisplayName("shouldExpireEntriesAfterTtlWithoutExplicitCleanup")
	void shouldExpireEntriesAfterTtlWithoutExplicitCleanup() {
		cache.set("k", "v");

		clock.advance(Duration.ofDays(30).minusMillis(1));
		assertTrue(cache.get("k", String.class).isPresent());

		clock.advance(Duration.ofMillis(1));
		assertTrue(cache.get("k", String.class).isEmpty());
		assertEquals(0, cache.stats().entryCount());
		assertEquals(0, cache.stats().totalSize());
	}

	@Test
	@DisplayName("shouldNotExpireWhenTtlIsZero")
	void shouldNotExpireWhenTtlIsZero() throws IOException {
		cache.close();
		cache = new TranslationCache(databasePath, 1024, Duration.ZERO, clock, log);
		cache.set("k", "v");

		clock.advance(Duration.ofDays(3650));

		assertTrue(cache.get("k", String.class).isPresent());
	}

	@Test
	@DisplayName("shouldRemoveExpiredEntriesOnForcedCleanup")
	void shouldRemoveExpiredEntriesOnForcedCleanup() {
		cache.set("old", "v");
		clock.advance(Duration.ofDays(20));
		cache.set("young", "v");
		clock.advance(Duration.ofDays(15));

		cache.forceCleanup();

		assertEquals(1, cache.stats().entryCount());
		assertTrue(cache.get("young", String.class).isPresent());
	}

	@Test
	@DisplayName("shouldDropEntryThatCannotBeRead")
	void shouldDropEntryThatCannotBeRead() throws Exception {
		cache.set("broken", TranslationResult.remote("Hallo", null, null, null));
		cache.close();
		try (Connection connection = DriverManager.getConnection("jdbc:h2:file:" + databasePath.toAbsolutePath().normalize());
		     PreparedStatement statement = connection.prepareStatement("UPDATE translation_cache SET cache_value = ? WHERE cache_key = ?")) {
			statement.setString(1, "{not json");
			statement.setString(2, "broken");
			statement.executeUpdate();
		}
		cache = new TranslationCache(databasePath, 1024 * 1024, Duration.ofDays(30), clock, log);

		assertTrue(cache.get("broken", TranslationResult.class).isEmpty());
		assertTrue(log.hasWarning("unreadable cache entry broken"));
		assertEquals(0, cache.stats().entryCount());
	}

	@Test
	@DisplayName("shouldIgnoreReadsAndWritesWhenDisabled")
	void shouldIgnoreReadsAndWritesWhenDisabled() {
		cache.set("k", "v");
		cache.disable();

		assertFalse(cache.isEnabled());
		assertTrue(cache.get("k", String.class).isEmpty());
		cache.set("other", "v");
		assertFalse(cache.stats().enabled());

		cache.enable();
		assertTrue(cache.get("k", String.class).isPresent());
		assertTrue(cache.get("other", String.class).isEmpty());
	}

	@Test
	@DisplayName("shouldClearAllEntries")
	void shouldClearAllEntries() {
		cache.set("a", "1");
		cache.set("b", "2");

		cache.clear();

		final CacheStats stats = cache.stats();
		assertEquals(0, stats.entryCount());
		assertEquals(0, stats.totalSize());
		assertEquals(1024 * 1024, stats.maxSize());
	}

	@Test
	@DisplayName("shouldApplyNewMaxSizeOnNextWrite")
	void shouldApplyNewMaxSizeOnNextWrite() {
		cache.set("a", "x".repeat(100));
		cache.set("b", "x".repeat(100));

		cache.setMaxSize(150);
		assertEquals(2, cache.stats().entryCount());
		cache.set("c", "x".repeat(10));

		assertTrue(cache.stats().totalSize() <= 150);
		assertTrue(cache.get("a", String.class).isEmpty());
		assertThrows(IllegalArgumentException.class, () -> cache.setMaxSize(-1));
	}

	@Test
	@DisplayName("shouldRecreateDatabaseThatCannotBeOpened")
	void shouldRecreateDatabaseThatCannotBeOpened() throws IOException {
		cache.close();
		Files.writeString(Path.of(databasePath.toAbsolutePath().normalize() + ".mv.db"), "garbage that is not a database",
			StandardCharsets.UTF_8);

		cache = new TranslationCache(databasePath, 1024, Duration.ofDays(30), clock, log);

		assertTrue(log.hasWarning("recreating"));
		assertEquals(0, cache.stats().entryCount());
		cache.set("k", "v");
		assertTrue(cache.get("k", String.class).isPresent());
	}

	@Test
	@DisplayName("shouldRejectUseAfterClose")
	void shouldRejectUseAfterClose() {
		cache.close();
		cache.close();

		assertThrows(IllegalStateException.class, () -> cache.get("k", String.class));
		assertThrows(IllegalStateException.class, () -> cache.set("k", "v"));
	}

	private static long jsonSize(String value) {
		return ("\"" + value + "\"").getBytes(StandardCharsets.UTF_8).length;
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
