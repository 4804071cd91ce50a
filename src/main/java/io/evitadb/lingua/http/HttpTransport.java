package io.evitadb.lingua.http;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;

/**
 * Performs a single HTTP exchange with the remote service. Implementations do not retry and do not
 * interpret status codes; that is the job of {@link RequestExecutor}.
 */
@FunctionalInterface
public interface HttpTransport {

	/**
	 * Sends the request and returns the response regardless of its status code.
	 *
	 * @param request the request descriptor
	 * @param timeout maximum time to wait for the response
	 * @return the response
	 * @throws java.net.http.HttpTimeoutException when the timeout elapses
	 * @throws IOException                        on connection failures
	 * @throws InterruptedException               when the calling thread is interrupted
	 */
	@Nonnull
	RemoteResponse send(@Nonnull RemoteRequest request, @Nonnull Duration timeout) throws IOException, InterruptedException;
}
