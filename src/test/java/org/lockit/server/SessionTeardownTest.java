package org.lockit.server;

import org.lockit.client.Http;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SessionTeardownTest {

	private final AtomicBoolean done = new AtomicBoolean();
	private HttpServer server;

	@AfterEach
	public void stop() {
		if (server != null)
			server.stop(0);
	}

	private Http start(SessionTeardown teardown) throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/logout", ex -> {
			teardown.destroy(ex, () -> done.set(true));
			ex.sendResponseHeaders(204, -1);
			ex.close();
		});
		server.start();
		return new Http("http://127.0.0.1:" + server.getAddress().getPort());
	}

	@Test
	public void testDestroysStoredSession() throws Exception {
		SessionStore store = new InMemorySessionStore();
		String token = store.open("alice");
		String other = store.open("bob");
		Http http = start(new SessionTeardown(store));
		http.setToken(token);

		assertEquals(204, http.exchange("POST", "/logout", null).statusCode());
		assertTrue(done.get());
		assertFalse(store.isAuthenticated(token));
		assertTrue(store.isAuthenticated(other));
	}

	@Test
	public void testWithoutStoreClearsClientToken() throws Exception {
		Http http = start(new SessionTeardown(null));
		http.setToken("client-held");

		HttpResponse<String> r = http.exchange("POST", "/logout", null);
		assertEquals(204, r.statusCode());
		assertTrue(done.get());
		assertEquals("", r.headers().firstValue(RouteGuard.TOKEN_HEADER).orElse(null));
	}
}
