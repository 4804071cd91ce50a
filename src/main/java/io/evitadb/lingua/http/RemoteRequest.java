package io.evitadb.lingua.http;

import javax.annotation.Nonnull;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Descriptor of one logical call to the remote service, independent of the HTTP library.
 * GET parameters are sent in the query string, POST parameters as a form-encoded body.
 *
 * @param method     HTTP method, {@code GET} or {@code POST}
 * @param path       path relative to the service base URL, e.g. {@code /v2/translate}
 * @param parameters ordered parameters; a name may repeat
 */
public record RemoteRequest(
	@Nonnull String method,
	@Nonnull String path,
	@Nonnull List<Parameter> parameters
) {

	public RemoteRequest {
		Objects.requireNonNull(method, "method must not be null");
		Objects.requireNonNull(path, "path must not be null");
		parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
	}

	@Nonnull
	public static RemoteRequest get(@Nonnull String path, @Nonnull List<Parameter> parameters) {
		return new RemoteRequest("GET", path, parameters);
	}

	@Nonnull
	public static RemoteRequest postForm(@Nonnull String path, @Nonnull List<Parameter> parameters) {
		return new RemoteRequest("POST", path, parameters);
	}

	public boolean isGet() {
		return "GET".equals(this.method);
	}

	/**
	 * Returns the parameters URL-encoded as {@code name=value} pairs joined by {@code &}.
	 *
	 * @return encoded parameters, empty string when there are none
	 */
	@Nonnull
	public String encodedParameters() {
		return this.parameters.stream()
			.map(p -> URLEncoder.encode(p.name(), StandardCharsets.UTF_8) + "=" + URLEncoder.encode(p.value(), StandardCharsets.UTF_8))
			.collect(Collectors.joining("&"));
	}

	@Override
	public String toString() {
		return this.method + " " + this.path;
	}

	/**
	 * Single request parameter.
	 *
	 * @param name  parameter name
	 * @param value parameter value
	 */
	public record Parameter(@Nonnull String name, @Nonnull String value) {

		public Parameter {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}
	}
}
