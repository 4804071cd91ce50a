package io.evitadb.lingua.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persistent, size-bounded and TTL-aware key/value cache backed by an embedded H2 database file.
 *
 * Values are stored as JSON text. Every entry carries its insertion time and the UTF-8 size of the stored
 * text. When a new entry would push the total size over the bound, the oldest other entries are evicted
 * first. Lookups never refresh an entry's position, so the eviction order is by last write only.
 *
 * One instance owns one JDBC connection; all database access is serialized on the instance monitor.
 */
public final class TranslationCache implements AutoCloseable {

	/** Default size bound: 1 GiB. */
	public static final long DEFAULT_MAX_SIZE = 1024L * 1024L * 1024L;
	/** Default time to live: 30 days. */
	public static final Duration DEFAULT_TTL = Duration.ofDays(30);

	/** Stored in place of a null value; cannot collide with any JSON document. */
	static final String NULL_SENTINEL = "__lingua_cache_null__";

	private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS translation_cache (" +
		"cache_key VARCHAR(1024) PRIMARY KEY, " +
		"cache_value CLOB NOT NULL, " +
		"inserted_at BIGINT NOT NULL, " +
		"insert_seq BIGINT NOT NULL, " +
		"entry_size BIGINT NOT NULL)";
	private static final String CREATE_INDEX =
		"CREATE INDEX IF NOT EXISTS idx_translation_cache_inserted_at ON translation_cache (inserted_at)";
	private static final String SELECT_ENTRY =
		"SELECT cache_value, inserted_at FROM translation_cache WHERE cache_key = ?";
	private static final String SELECT_SIZE =
		"SELECT entry_size FROM translation_cache WHERE cache_key = ?";
	private static final String MERGE_ENTRY =
		"MERGE INTO translation_cache (cache_key, cache_value, inserted_at, insert_seq, entry_size) " +
			"KEY (cache_key) VALUES (?, ?, ?, ?, ?)";
	private static final String DELETE_ENTRY = "DELETE FROM translation_cache WHERE cache_key = ?";
	private static final String SELECT_EVICTION_CANDIDATES =
		"SELECT cache_key, entry_size FROM translation_cache WHERE cache_key <> ? " +
			"ORDER BY inserted_at ASC, insert_seq ASC";
	private static final String SELECT_EXPIRED_SIZE =
		"SELECT COALESCE(SUM(entry_size), 0) FROM translation_cache WHERE inserted_at <= ?";
	private static final String DELETE_EXPIRED = "DELETE FROM translation_cache WHERE inserted_at <= ?";
	private static final String SELECT_TOTALS =
		"SELECT COUNT(*), COALESCE(SUM(entry_size), 0), COALESCE(MAX(insert_seq), 0) FROM translation_cache";

	private final Path databasePath;
	private final long ttlMillis;
	private final Clock clock;
	private final Log log;
	private final ObjectMapper objectMapper = new ObjectMapper();
	private final Connection connection;
	private volatile boolean enabled = true;
	private volatile long maxSize;
	private long totalSize;
	private long sequence;
	private boolean closed;

	/**
	 * Opens (or creates) the cache database with default bound and TTL.
	 *
	 * @param databasePath database location without the H2 file suffix
	 * @param log          Maven log for warnings
	 * @throws IOException if the database cannot be opened even after recreating it
	 */
	public TranslationCache(@Nonnull Path databasePath, @Nonnull Log log) throws IOException {
		this(databasePath, DEFAULT_MAX_SIZE, DEFAULT_TTL, Clock.systemUTC(), log);
	}

	/**
	 * Opens (or creates) the cache database.
	 *
	 * @param databasePath database location without the H2 file suffix
	 * @param maxSize      size bound in bytes
	 * @param ttl          time to live of entries, {@link Duration#ZERO} disables expiry
	 * @param clock        clock used for insertion times and expiry checks
	 * @param log          Maven log for warnings
	 * @throws IOException if the database cannot be opened even after recreating it
	 */
	public TranslationCache(
		@Nonnull Path databasePath,
		long maxSize,
		@Nonnull Duration ttl,
		@Nonnull Clock clock,
		@Nonnull Log log
	) throws IOException {
		Objects.requireNonNull(ttl, "ttl must not be null");
		if (maxSize < 0) {
			throw new IllegalArgumentException("maxSize must not be negative");
		}
		if (ttl.isNegative()) {
			throw new IllegalArgumentException("ttl must not be negative");
		}
		this.databasePath = Objects.requireNonNull(databasePath, "databasePath must not be null").toAbsolutePath().normalize();
		this.maxSize = maxSize;
		this.ttlMillis = ttl.toMillis();
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.connection = openOrRecreate();
		loadTotals();
	}

	/**
	 * Returns the default database location: {@code ~/.cache/lingua/cache}.
	 *
	 * @return default cache path
	 */
	@Nonnull
	public static Path defaultLocation() {
		return Path.of(System.getProperty("user.home"), ".cache", "lingua", "cache");
	}

	/**
	 * Looks up a value. Expired entries and entries that no longer deserialize into the requested type are
	 * removed and reported as absent.
	 *
	 * @param key  cache key
	 * @param type expected value type
	 * @param <T>  value type
	 * @return the hit, or empty when disabled, absent, expired or unreadable
	 */
	@Nonnull
	public synchronized <T> Optional<CacheHit<T>> get(@Nonnull String key, @Nonnull Class<T> type) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(type, "type must not be null");
		assertOpen();
		if (!this.enabled) {
			return Optional.empty();
		}
		try {
			sweepExpired();
			final String stored;
			final long insertedAt;
			try (PreparedStatement statement = this.connection.prepareStatement(SELECT_ENTRY)) {
				statement.setString(1, key);
				try (ResultSet rs = statement.executeQuery()) {
					if (!rs.next()) {
						return Optional.empty();
					}
					stored = rs.getString(1);
					insertedAt = rs.getLong(2);
				}
			}
			if (isExpired(insertedAt)) {
				removeEntry(key);
				return Optional.empty();
			}
			if (NULL_SENTINEL.equals(stored)) {
				return Optional.of(new CacheHit<>(null, Instant.ofEpochMilli(insertedAt)));
			}
			try {
				final T value = this.objectMapper.readValue(stored, type);
				return Optional.of(new CacheHit<>(value, Instant.ofEpochMilli(insertedAt)));
			} catch (JsonProcessingException e) {
				this.log.warn("Removing unreadable cache entry " + key + ": " + e.getOriginalMessage());
				removeEntry(key);
				return Optional.empty();
			}
		} catch (SQLException e) {
			throw new CacheAccessException("Failed to read cache entry " + key, e);
		}
	}

	/**
	 * Stores a value, evicting the oldest other entries when the size bound would be exceeded.
	 *
	 * @param key   cache key
	 * @param value JSON-serializable value, may be null
	 */
	public synchronized void set(@Nonnull String key, @Nullable Object value) {
		Objects.requireNonNull(key, "key must not be null");
		assertOpen();
		if (!this.enabled) {
			return;
		}
		final String serialized;
		try {
			serialized = value == null ? NULL_SENTINEL : this.objectMapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Value for cache key " + key + " is not serializable: " + e.getOriginalMessage(), e);
		}
		final long entrySize = serialized.getBytes(StandardCharsets.UTF_8).length;
		try {
			sweepExpired();
			final long replacedSize = sizeOf(key);
			evictFor(key, entrySize - replacedSize);
			try (PreparedStatement statement = this.connection.prepareStatement(MERGE_ENTRY)) {
				statement.setString(1, key);
				statement.setString(2, serialized);
				statement.setLong(3, this.clock.millis());
				statement.setLong(4, ++this.sequence);
				statement.setLong(5, entrySize);
				statement.executeUpdate();
			}
			this.totalSize += entrySize - replacedSize;
		} catch (SQLException e) {
			throw new CacheAccessException("Failed to write cache entry " + key, e);
		}
	}

	/**
	 * Returns current counters read from the database.
	 *
	 * @return cache statistics
	 */
	@Nonnull
	public synchronized CacheStats stats() {
		assertOpen();
		try (Statement statement = this.connection.createStatement();
		     ResultSet rs = statement.executeQuery(SELECT_TOTALS)) {
			rs.next();
			return new CacheStats(rs.getLong(1), rs.getLong(2), this.maxSize, this.enabled);
		} catch (SQLException e) {
			throw new CacheAccessException("Failed to read cache statistics", e);
		}
	}

	/**
	 * Removes all entries.
	 */
	public synchronized void clear() {
		assertOpen();
		try (Statement statement = this.connection.createStatement()) {
			statement.executeUpdate("DELETE FROM translation_cache");
			this.totalSize = 0;
		} catch (SQLException e) {
			throw new CacheAccessException("Failed to clear cache", e);
		}
	}

	/**
	 * Removes all expired entries now instead of waiting for the next lookup or store.
	 */
	public synchronized void forceCleanup() {
		assertOpen();
		try {
			sweepExpired();
		} catch (SQLException e) {
			throw new CacheAccessException("Failed to remove expired cache entries", e);
		}
	}

	/**
	 * Changes the size bound. Already stored entries are not evicted until the next store.
	 *
	 * @param maxSize new bound in bytes
	 */
	public void setMaxSize(long maxSize) {
		if (maxSize < 0) {
			throw new IllegalArgumentException("maxSize must not be negative");
		}
		this.maxSize = maxSize;
	}

	public void enable() {
		this.enabled = true;
	}

	public void disable() {
		this.enabled = false;
	}

	public boolean isEnabled() {
		return this.enabled;
	}

	@Nonnull
	public Path getDatabasePath() {
		return this.databasePath;
	}

	@Override
	public synchronized void close() {
		if (this.closed) {
			return;
		}
		this.closed = true;
		try {
			this.connection.close();
		} catch (SQLException e) {
			this.log.warn("Failed to close translation cache: " + e.getMessage());
		}
	}

	/**
	 * Opens the database; a file that cannot be opened is deleted and created anew.
	 */
	@Nonnull
	private Connection openOrRecreate() throws IOException {
		try {
			Files.createDirectories(this.databasePath.getParent());
		} catch (IOException e) {
			throw new IOException("Cannot create cache directory " + this.databasePath.getParent() + ": " + e.getMessage(), e);
		}
		try {
			return openConnection();
		} catch (SQLException first) {
			this.log.warn("Translation cache at " + this.databasePath + " cannot be opened (" + first.getMessage() +
				"), recreating it");
			Files.deleteIfExists(Path.of(this.databasePath + ".mv.db"));
			Files.deleteIfExists(Path.of(this.databasePath + ".trace.db"));
			try {
				return openConnection();
			} catch (SQLException second) {
				second.addSuppressed(first);
				throw new IOException("Cannot open translation cache at " + this.databasePath + ": " + second.getMessage(), second);
			}
		}
	}

	@Nonnull
	private Connection openConnection() throws SQLException {
		final Connection created = DriverManager.getConnection("jdbc:h2:file:" + this.databasePath);
		try (Statement statement = created.createStatement()) {
			statement.execute(CREATE_TABLE);
			statement.execute(CREATE_INDEX);
			return created;
		} catch (SQLException e) {
			created.close();
			throw e;
		}
	}

	private void loadTotals() throws IOException {
		try (Statement statement = this.connection.createStatement();
		     ResultSet rs = statement.executeQuery(SELECT_TOTALS)) {
			rs.next();
			this.totalSize = rs.getLong(2);
			this.sequence = rs.getLong(3);
		} catch (SQLException e) {
			throw new IOException("Cannot read translation cache at " + this.databasePath + ": " + e.getMessage(), e);
		}
	}

	private boolean isExpired(long insertedAt) {
		return this.ttlMillis > 0 && this.clock.millis() - insertedAt >= this.ttlMillis;
	}

	private void sweepExpired() throws SQLException {
		if (this.ttlMillis <= 0) {
			return;
		}
		final long cutoff = this.clock.millis() - this.ttlMillis;
		final long expiredSize;
		try (PreparedStatement statement = this.connection.prepareStatement(SELECT_EXPIRED_SIZE)) {
			statement.setLong(1, cutoff);
			try (ResultSet rs = statement.executeQuery()) {
				rs.next();
				expiredSize = rs.getLong(1);
			}
		}
		if (expiredSize == 0) {
			return;
		}
		try (PreparedStatement statement = this.connection.prepareStatement(DELETE_EXPIRED)) {
			statement.setLong(1, cutoff);
			final int removed = statement.executeUpdate();
			this.log.debug("Removed " + removed + " expired cache entries");
		}
		this.totalSize -= expiredSize;
	}

	private long sizeOf(@Nonnull String key) throws SQLException {
		try (PreparedStatement statement = this.connection.prepareStatement(SELECT_SIZE)) {
			statement.setString(1, key);
			try (ResultSet rs = statement.executeQuery()) {
				return rs.next() ? rs.getLong(1) : 0L;
			}
		}
	}

	private void removeEntry(@Nonnull String key) throws SQLException {
		final long size = sizeOf(key);
		try (PreparedStatement statement = this.connection.prepareStatement(DELETE_ENTRY)) {
			statement.setString(1, key);
			if (statement.executeUpdate() > 0) {
				this.totalSize -= size;
			}
		}
	}

	/**
	 * Evicts the oldest entries other than {@code key} until {@code growth} more bytes fit under the bound.
	 */
	private void evictFor(@Nonnull String key, long growth) throws SQLException {
		if (this.totalSize + growth <= this.maxSize) {
			return;
		}
		final long toFree = this.totalSize + growth - this.maxSize + 1;
		final List<String> victims = new ArrayList<>();
		long freed = 0;
		try (PreparedStatement statement = this.connection.prepareStatement(SELECT_EVICTION_CANDIDATES)) {
			statement.setString(1, key);
			try (ResultSet rs = statement.executeQuery()) {
				while (freed < toFree && rs.next()) {
					victims.add(rs.getString(1));
					freed += rs.getLong(2);
				}
			}
		}
		if (victims.isEmpty()) {
			return;
		}
		try (PreparedStatement statement = this.connection.prepareStatement(DELETE_ENTRY)) {
			for (final String victim : victims) {
				statement.setString(1, victim);
				statement.addBatch();
			}
			statement.executeBatch();
		}
		this.totalSize -= freed;
		this.log.debug("Evicted " + victims.size() + " cache entries (" + freed + " bytes)");
	}

	private void assertOpen() {
		if (this.closed) {
			throw new IllegalStateException("Translation cache is closed");
		}
	}
}
