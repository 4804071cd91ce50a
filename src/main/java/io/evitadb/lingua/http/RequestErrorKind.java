package io.evitadb.lingua.http;

import javax.annotation.Nonnull;

/**
 * Classification of a failed call to the remote translation service.
 * Each kind carries whether retrying the same request can succeed and a hint for the user.
 */
public enum RequestErrorKind {

	AUTHENTICATION(false, "Check the configured API key (lingua.apiKey)."),
	QUOTA(false, "Check your usage with the 'usage' action, or upgrade your plan."),
	RATE_LIMIT(true, "Wait a moment and retry, or lower lingua.concurrency."),
	SERVICE_UNAVAILABLE(true, "The service is temporarily unavailable, try again later."),
	NETWORK(true, "Check your internet connection and proxy settings (HTTPS_PROXY)."),
	MALFORMED(false, "The service returned an unexpected response; report it together with the trace id."),
	UNKNOWN(false, "Check the request parameters.");

	private final boolean retryable;
	@Nonnull
	private final String suggestion;

	RequestErrorKind(boolean retryable, @Nonnull String suggestion) {
		this.retryable = retryable;
		this.suggestion = suggestion;
	}

	/**
	 * Returns true if a failure of this kind may succeed when the request is repeated.
	 *
	 * @return true for transient failures
	 */
	public boolean isRetryable() {
		return this.retryable;
	}

	@Nonnull
	public String getSuggestion() {
		return this.suggestion;
	}
}
