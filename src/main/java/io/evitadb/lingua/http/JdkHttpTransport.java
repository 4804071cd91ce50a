package io.evitadb.lingua.http;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 * Authenticates every request with the {@code DeepL-Auth-Key} scheme and honours an
 * {@code HTTPS_PROXY} / {@code HTTP_PROXY} environment variable when present.
 */
public final class JdkHttpTransport implements HttpTransport {

	public static final String FREE_API_URL = "https://api-free.deepl.com";
	public static final String PRO_API_URL = "https://api.deepl.com";

	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final String USER_AGENT = "lingua-maven-plugin";

	@Nonnull
	private final HttpClient httpClient;
	@Nonnull
	private final String baseUrl;
	@Nonnull
	private final String apiKey;

	/**
	 * Creates a transport.
	 *
	 * @param baseUrl service base URL without trailing slash, e.g. {@link #FREE_API_URL}
	 * @param apiKey  API key used for authentication
	 */
	public JdkHttpTransport(@Nonnull String baseUrl, @Nonnull String apiKey) {
		this(baseUrl, apiKey, System.getenv());
	}

	JdkHttpTransport(@Nonnull String baseUrl, @Nonnull String apiKey, @Nonnull Map<String, String> environment) {
		Objects.requireNonNull(baseUrl, "baseUrl must not be null");
		Objects.requireNonNull(apiKey, "apiKey must not be null");
		if (apiKey.isBlank()) {
			throw new IllegalArgumentException("API key is required");
		}
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.apiKey = apiKey;

		final HttpClient.Builder builder = HttpClient.newBuilder()
			.connectTimeout(CONNECT_TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL);
		proxyFromEnvironment(environment).ifPresent(builder::proxy);
		this.httpClient = builder.build();
	}

	/**
	 * Chooses the default base URL for the account type.
	 *
	 * @param usePro true for a Pro account
	 * @return the matching base URL
	 */
	@Nonnull
	public static String defaultBaseUrl(boolean usePro) {
		return usePro ? PRO_API_URL : FREE_API_URL;
	}

	@Nonnull
	@Override
	public RemoteResponse send(@Nonnull RemoteRequest request, @Nonnull Duration timeout) throws IOException, InterruptedException {
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");

		final String encoded = request.encodedParameters();
		final HttpRequest.Builder builder = HttpRequest.newBuilder()
			.timeout(timeout)
			.header("Authorization", "DeepL-Auth-Key " + this.apiKey)
			.header("User-Agent", USER_AGENT);

		if (request.isGet()) {
			final String query = encoded.isEmpty() ? "" : "?" + encoded;
			builder.uri(URI.create(this.baseUrl + request.path() + query)).GET();
		} else {
			builder.uri(URI.create(this.baseUrl + request.path()))
				.header("Content-Type", "application/x-www-form-urlencoded")
				.method(request.method(), HttpRequest.BodyPublishers.ofString(encoded));
		}

		final HttpResponse<String> response = this.httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
		final String body = response.body();
		return new RemoteResponse(response.statusCode(), response.headers().map(), body == null ? "" : body);
	}

	/**
	 * Resolves a proxy from {@code HTTPS_PROXY} or {@code HTTP_PROXY} (either case).
	 *
	 * @param environment environment variables
	 * @return proxy selector or empty when no proxy is configured
	 * @throws IllegalArgumentException when the variable does not hold a valid URL
	 */
	@Nonnull
	static Optional<ProxySelector> proxyFromEnvironment(@Nonnull Map<String, String> environment) {
		final String proxyUrl = firstNonBlank(
			environment.get("HTTPS_PROXY"), environment.get("https_proxy"),
			environment.get("HTTP_PROXY"), environment.get("http_proxy")
		);
		if (proxyUrl == null) {
			return Optional.empty();
		}
		try {
			final URI uri = new URI(proxyUrl);
			if (uri.getHost() == null) {
				throw new IllegalArgumentException("Invalid proxy URL: missing host");
			}
			final int port = uri.getPort() != -1 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
			return Optional.of(ProxySelector.of(new InetSocketAddress(uri.getHost(), port)));
		} catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid proxy URL: " + e.getMessage(), e);
		}
	}

	@Nullable
	private static String firstNonBlank(@Nonnull String... values) {
		for (final String value : values) {
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}
}
