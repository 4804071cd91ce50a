package io.evitadb.lingua.http;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Classified failure of a remote call. Thrown by {@link RequestExecutor} once retries are exhausted
 * or the failure is not retryable, and propagated unchanged through the orchestrator.
 *
 * The message already contains the trace id suffix when one was observed.
 */
public final class RequestException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	@Nonnull
	private final RequestErrorKind kind;
	@Nullable
	private final String traceId;
	@Nullable
	private final Integer statusCode;

	/**
	 * Creates a new RequestException.
	 *
	 * @param kind       the classified error kind
	 * @param message    the error message without trace id
	 * @param traceId    diagnostic trace id of the failed response, if known
	 * @param statusCode HTTP status of the failed response, if there was one
	 * @param cause      underlying cause, if any
	 */
	public RequestException(
		@Nonnull RequestErrorKind kind,
		@Nonnull String message,
		@Nullable String traceId,
		@Nullable Integer statusCode,
		@Nullable Throwable cause
	) {
		super(formatMessage(message, traceId), cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.traceId = traceId;
		this.statusCode = statusCode;
	}

	@Nonnull
	private static String formatMessage(@Nonnull String message, @Nullable String traceId) {
		Objects.requireNonNull(message, "message must not be null");
		if (traceId != null && !traceId.isBlank()) {
			return message + " (Trace ID: " + traceId + ")";
		}
		return message;
	}

	@Nonnull
	public RequestErrorKind getKind() {
		return this.kind;
	}

	public boolean isRetryable() {
		return this.kind.isRetryable();
	}

	@Nullable
	public String getTraceId() {
		return this.traceId;
	}

	@Nullable
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@Nonnull
	public String getSuggestion() {
		return this.kind.getSuggestion();
	}
}
