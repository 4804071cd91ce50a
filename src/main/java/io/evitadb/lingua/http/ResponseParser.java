package io.evitadb.lingua.http;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Converts a successful response into a typed value.
 *
 * @param <T> the parsed type
 */
@FunctionalInterface
public interface ResponseParser<T> {

	/**
	 * Parses the response.
	 *
	 * @param response a response with a 2xx status
	 * @return the parsed value
	 * @throws IOException when the payload is not valid JSON or lacks expected fields
	 */
	@Nonnull
	T parse(@Nonnull RemoteResponse response) throws IOException;
}
