package org.lockit.server;

import com.sun.net.httpserver.HttpExchange;

/**
 * Logs a request's session out. With a backing store the session is destroyed server
 * side; without one the session lives only in the client's token, so the response tells
 * the client to drop it.
 */
public final class SessionTeardown {
	private final SessionStore store;

	/** @param store backing store, or {@code null} for client-held sessions */
	public SessionTeardown(SessionStore store) {
		this.store = store;
	}

	public void destroy(HttpExchange ex, Runnable done) {
		if (store != null)
			store.destroy(ex.getRequestHeaders().getFirst(RouteGuard.TOKEN_HEADER));
		else
			ex.getResponseHeaders().set(RouteGuard.TOKEN_HEADER, "");
		done.run();
	}
}
