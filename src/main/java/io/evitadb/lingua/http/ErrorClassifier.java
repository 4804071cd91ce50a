package io.evitadb.lingua.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * Maps failed exchanges with the remote service to {@link RequestException}s of a specific
 * {@link RequestErrorKind}.
 *
 * - 403 authentication, 456 quota, 429 rate limit
 * - 503 and every other 5xx: service unavailable
 * - timeouts and connection failures: network
 * - 2xx with an unusable payload: malformed
 * - anything else: unknown
 */
public final class ErrorClassifier {

	public static final int STATUS_FORBIDDEN = 403;
	public static final int STATUS_TOO_MANY_REQUESTS = 429;
	public static final int STATUS_QUOTA_EXCEEDED = 456;
	public static final int STATUS_SERVICE_UNAVAILABLE = 503;

	@Nonnull
	private final ObjectMapper objectMapper;

	public ErrorClassifier() {
		this(new ObjectMapper());
	}

	public ErrorClassifier(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Classifies a response with a non-successful status code.
	 *
	 * @param statusCode HTTP status code
	 * @param body       response body, used to extract the service's error message
	 * @param traceId    trace id observed for the response
	 * @return the classified exception (not thrown)
	 */
	@Nonnull
	public RequestException classifyStatus(int statusCode, @Nullable String body, @Nullable String traceId) {
		switch (statusCode) {
			case STATUS_FORBIDDEN:
				return new RequestException(RequestErrorKind.AUTHENTICATION, "Authentication failed: Invalid API key", traceId, statusCode, null);
			case STATUS_QUOTA_EXCEEDED:
				return new RequestException(RequestErrorKind.QUOTA, "Quota exceeded: Character limit reached", traceId, statusCode, null);
			case STATUS_TOO_MANY_REQUESTS:
				return new RequestException(RequestErrorKind.RATE_LIMIT, "Rate limit exceeded: Too many requests", traceId, statusCode, null);
			case STATUS_SERVICE_UNAVAILABLE:
				return new RequestException(RequestErrorKind.SERVICE_UNAVAILABLE, "Service temporarily unavailable: Please try again later", traceId, statusCode, null);
			default:
				final String detail = extractMessage(body, statusCode);
				if (statusCode >= 500 && statusCode < 600) {
					return new RequestException(RequestErrorKind.SERVICE_UNAVAILABLE, "Server error (" + statusCode + "): " + detail, traceId, statusCode, null);
				}
				return new RequestException(RequestErrorKind.UNKNOWN, "API error: " + detail, traceId, statusCode, null);
		}
	}

	/**
	 * Classifies a failure that prevented any response from arriving.
	 *
	 * @param failure the I/O failure of the transport
	 * @return the classified exception (not thrown)
	 */
	@Nonnull
	public RequestException classifyTransportFailure(@Nonnull IOException failure) {
		Objects.requireNonNull(failure, "failure must not be null");
		if (failure instanceof HttpTimeoutException) {
			return new RequestException(RequestErrorKind.NETWORK, "Network error: request timed out", null, null, failure);
		}
		final String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
		return new RequestException(RequestErrorKind.NETWORK, "Network error: " + message, null, null, failure);
	}

	/**
	 * Classifies a successful response whose payload could not be understood.
	 *
	 * @param statusCode HTTP status of the response
	 * @param detail     what was wrong with the payload
	 * @param traceId    trace id observed for the response
	 * @param cause      parsing failure, if any
	 * @return the classified exception (not thrown)
	 */
	@Nonnull
	public RequestException malformed(int statusCode, @Nonnull String detail, @Nullable String traceId, @Nullable Throwable cause) {
		return new RequestException(RequestErrorKind.MALFORMED, "Malformed response: " + detail, traceId, statusCode, cause);
	}

	/**
	 * Extracts the {@code message} field of a JSON error body, falling back to the raw body or status.
	 */
	@Nonnull
	private String extractMessage(@Nullable String body, int statusCode) {
		if (body == null || body.isBlank()) {
			return "HTTP " + statusCode;
		}
		final String fromJson = jsonMessage(body);
		if (fromJson != null) {
			return fromJson;
		}
		final String trimmed = body.strip();
		return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
	}

	@Nullable
	private String jsonMessage(@Nonnull String body) {
		try {
			final JsonNode root = this.objectMapper.readTree(body);
			final JsonNode message = root == null ? null : root.get("message");
			return message != null && message.isTextual() && !message.asText().isBlank() ? message.asText() : null;
		} catch (IOException notJson) {
			return null;
		}
	}
}
