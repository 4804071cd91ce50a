package io.evitadb.lingua.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdkHttpTransport should be configured from its arguments and environment")
public class JdkHttpTransportTest {

	@Test
	@DisplayName("shouldRequireApiKey")
	void shouldRequireApiKey() {
		final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> new JdkHttpTransport(JdkHttpTransport.FREE_API_URL, " ", Map.of()));
		assertEquals("API key is required", e.getMessage());
	}

	@Test
	@DisplayName("shouldChooseEndpointByAccountType")
	void shouldChooseEndpointByAccountType() {
		assertEquals("https://api-free.deepl.com", JdkHttpTransport.defaultBaseUrl(false));
		assertEquals("https://api.deepl.com", JdkHttpTransport.defaultBaseUrl(true));
	}

	@Test
	@DisplayName("shouldResolveProxyFromEnvironment")
	void shouldResolveProxyFromEnvironment() {
		assertTrue(JdkHttpTransport.proxyFromEnvironment(Map.of()).isEmpty());
		assertTrue(JdkHttpTransport.proxyFromEnvironment(Map.of("https_proxy", "http://proxy.local:3128")).isPresent());
		assertThrows(IllegalArgumentException.class,
			() -> JdkHttpTransport.proxyFromEnvironment(Map.of("HTTP_PROXY", "not a url")));
	}
}
