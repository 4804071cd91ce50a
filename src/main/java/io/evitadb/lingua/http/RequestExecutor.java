package io.evitadb.lingua.http;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues logical calls to the remote service and retries transient failures.
 *
 * Retry policy:
 * - only failures whose {@link RequestErrorKind#isRetryable()} is true are retried
 * - at most {@code maxRetries} retries follow the first attempt (0 disables retrying)
 * - the delay starts at one second and doubles after every retry, capped at ten seconds
 * - a {@code Retry-After} header of a 429 response overrides the computed delay (clamped to 60 seconds)
 *
 * Every attempt is bounded by the configured timeout. The trace id of the most recent response,
 * successful or not, is kept per executor instance.
 */
public final class RequestExecutor {

	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	public static final String TRACE_ID_HEADER = "X-Trace-ID";

	static final long INITIAL_DELAY_MILLIS = 1_000;
	static final long MAX_DELAY_MILLIS = 10_000;
	static final long RETRY_AFTER_MAX_MILLIS = 60_000;

	@Nonnull
	private final HttpTransport transport;
	@Nonnull
	private final ErrorClassifier classifier;
	private final int maxRetries;
	@Nonnull
	private final Duration timeout;
	@Nonnull
	private final Sleeper sleeper;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Log log;
	@Nonnull
	private final AtomicReference<String> lastTraceId = new AtomicReference<>();

	/**
	 * Creates an executor that waits between attempts with {@link Thread#sleep(long)}.
	 *
	 * @param transport  transport performing single exchanges
	 * @param maxRetries number of retries after the first attempt, must not be negative
	 * @param timeout    time bound of a single attempt
	 * @param log        Maven log for diagnostics
	 */
	public RequestExecutor(
		@Nonnull HttpTransport transport,
		int maxRetries,
		@Nonnull Duration timeout,
		@Nonnull Log log
	) {
		this(transport, new ErrorClassifier(), maxRetries, timeout, Thread::sleep, Clock.systemUTC(), log);
	}

	/**
	 * Creates an executor with all collaborators supplied.
	 *
	 * @param transport  transport performing single exchanges
	 * @param classifier maps failures to error kinds
	 * @param maxRetries number of retries after the first attempt, must not be negative
	 * @param timeout    time bound of a single attempt, must be positive
	 * @param sleeper    waits between attempts
	 * @param clock      clock used to evaluate {@code Retry-After} dates
	 * @param log        Maven log for diagnostics
	 */
	public RequestExecutor(
		@Nonnull HttpTransport transport,
		@Nonnull ErrorClassifier classifier,
		int maxRetries,
		@Nonnull Duration timeout,
		@Nonnull Sleeper sleeper,
		@Nonnull Clock clock,
		@Nonnull Log log
	) {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must not be negative");
		}
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (timeout.isZero() || timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		this.transport = Objects.requireNonNull(transport, "transport must not be null");
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.maxRetries = maxRetries;
		this.timeout = timeout;
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Performs the call, retrying retryable failures until the budget is spent.
	 *
	 * @param request the request to send
	 * @param parser  converts the successful response
	 * @param <T>     the result type
	 * @return the parsed result
	 * @throws RequestException the last classified failure
	 */
	@Nonnull
	public <T> T execute(@Nonnull RemoteRequest request, @Nonnull ResponseParser<T> parser) {
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(parser, "parser must not be null");

		int remainingRetries = this.maxRetries;
		long backoffMillis = INITIAL_DELAY_MILLIS;
		while (true) {
			RequestException failure;
			Long retryAfterMillis = null;
			try {
				final RemoteResponse response = sendOnce(request);
				final String traceId = recordTraceId(response);
				if (response.isSuccessful()) {
					return parse(response, parser, traceId);
				}
				failure = this.classifier.classifyStatus(response.statusCode(), response.body(), traceId);
				if (failure.getKind() == RequestErrorKind.RATE_LIMIT) {
					retryAfterMillis = response.header("Retry-After").map(this::parseRetryAfter).orElse(null);
				}
			} catch (RequestException e) {
				failure = e;
			}

			if (!failure.isRetryable() || remainingRetries == 0) {
				throw failure;
			}
			remainingRetries--;

			final long delayMillis = retryAfterMillis != null ? retryAfterMillis : backoffMillis;
			this.log.debug(
				"Retrying " + request + " in " + delayMillis + "ms after " + failure.getKind() +
					" (" + remainingRetries + " retries left): " + failure.getMessage()
			);
			pause(delayMillis);
			backoffMillis = Math.min(backoffMillis * 2, MAX_DELAY_MILLIS);
		}
	}

	/**
	 * Returns the trace id of the most recent response observed by this executor.
	 *
	 * @return last trace id or empty when no response carried one yet
	 */
	@Nonnull
	public Optional<String> getLastTraceId() {
		return Optional.ofNullable(this.lastTraceId.get());
	}

	public int getMaxRetries() {
		return this.maxRetries;
	}

	@Nonnull
	public Duration getTimeout() {
		return this.timeout;
	}

	@Nonnull
	private RemoteResponse sendOnce(@Nonnull RemoteRequest request) {
		final long start = System.nanoTime();
		try {
			final RemoteResponse response = this.transport.send(request, this.timeout);
			if (this.log.isDebugEnabled()) {
				final long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
				this.log.debug("HTTP " + request + " completed in " + elapsedMillis + "ms (status " + response.statusCode() + ")");
			}
			return response;
		} catch (IOException e) {
			throw this.classifier.classifyTransportFailure(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestException(RequestErrorKind.NETWORK, "Network error: request interrupted", null, null, e);
		}
	}

	@Nonnull
	private <T> T parse(@Nonnull RemoteResponse response, @Nonnull ResponseParser<T> parser, @Nullable String traceId) {
		try {
			return parser.parse(response);
		} catch (IOException | RuntimeException e) {
			final String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			throw this.classifier.malformed(response.statusCode(), detail, traceId, e);
		}
	}

	/**
	 * Stores the response's trace id, if any, and returns the trace id to attach to errors.
	 */
	@Nullable
	private String recordTraceId(@Nonnull RemoteResponse response) {
		final Optional<String> traceId = response.header(TRACE_ID_HEADER);
		traceId.ifPresent(this.lastTraceId::set);
		return traceId.orElse(this.lastTraceId.get());
	}

	private void pause(long millis) {
		try {
			this.sleeper.sleep(millis);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestException(RequestErrorKind.NETWORK, "Network error: interrupted while waiting to retry", null, null, e);
		}
	}

	/**
	 * Parses a {@code Retry-After} value given either as delta-seconds or as an HTTP date.
	 *
	 * @param value header value
	 * @return delay in milliseconds clamped to [0, 60s], or null when the value is not understood
	 */
	@Nullable
	Long parseRetryAfter(@Nonnull String value) {
		final String trimmed = value.trim();
		try {
			final double seconds = Double.parseDouble(trimmed);
			if (!Double.isNaN(seconds) && !Double.isInfinite(seconds)) {
				return clampRetryAfter(Math.round(seconds * 1000));
			}
			return null;
		} catch (NumberFormatException notSeconds) {
			try {
				final ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
				return clampRetryAfter(date.toInstant().toEpochMilli() - this.clock.millis());
			} catch (DateTimeParseException notDate) {
				this.log.debug("Ignoring unparseable Retry-After header: " + value);
				return null;
			}
		}
	}

	private static long clampRetryAfter(long millis) {
		return Math.max(0, Math.min(millis, RETRY_AFTER_MAX_MILLIS));
	}

	/**
	 * Waits between attempts. Replaceable in tests.
	 */
	@FunctionalInterface
	public interface Sleeper {
		void sleep(long millis) throws InterruptedException;
	}
}
