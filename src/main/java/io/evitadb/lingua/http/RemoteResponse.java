package io.evitadb.lingua.http;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw response of the remote service as seen by {@link RequestExecutor}.
 * Header names are matched case-insensitively.
 */
public final class RemoteResponse {

	private final int statusCode;
	@Nonnull
	private final Map<String, List<String>> headers;
	@Nonnull
	private final String body;

	/**
	 * Creates a response.
	 *
	 * @param statusCode HTTP status code
	 * @param headers    response headers
	 * @param body       response body, empty string when there is none
	 */
	public RemoteResponse(int statusCode, @Nonnull Map<String, List<String>> headers, @Nonnull String body) {
		Objects.requireNonNull(headers, "headers must not be null");
		this.statusCode = statusCode;
		final TreeMap<String, List<String>> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((name, values) -> {
			// the JDK client reports the HTTP/1.1 status line under a null key
			if (name != null) {
				sorted.put(name, List.copyOf(values));
			}
		});
		this.headers = Collections.unmodifiableMap(sorted);
		this.body = Objects.requireNonNull(body, "body must not be null");
	}

	public int statusCode() {
		return this.statusCode;
	}

	@Nonnull
	public Map<String, List<String>> headers() {
		return this.headers;
	}

	@Nonnull
	public String body() {
		return this.body;
	}

	public boolean isSuccessful() {
		return this.statusCode >= 200 && this.statusCode < 300;
	}

	/**
	 * Returns the first value of the header, ignoring the case of its name.
	 *
	 * @param name header name
	 * @return first non-blank value or empty
	 */
	@Nonnull
	public Optional<String> header(@Nonnull String name) {
		final List<String> values = this.headers.get(name);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.ofNullable(values.get(0)).filter(v -> !v.isBlank());
	}

	@Override
	public String toString() {
		return "RemoteResponse[status=" + this.statusCode + ", bodyLength=" + this.body.length() + "]";
	}
}
