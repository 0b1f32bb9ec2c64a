package org.lockit.server;

import org.lockit.common.UriComponent;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.net.URI;

/**
 * Lets only authenticated sessions through. Others get a bare 401 in REST mode, or a
 * redirect to the login route that remembers the page they asked for.
 */
public final class RouteGuard extends Filter {
	public static final String TOKEN_HEADER = "X-Session-Token";

	private final SessionStore sessions;
	private final String loginRoute;
	private final boolean rest;

	public RouteGuard(SessionStore sessions, LockitConfig config) {
		this.sessions = sessions;
		this.loginRoute = config.loginRoute();
		this.rest = config.rest();
	}

	@Override
	public void doFilter(HttpExchange ex, Chain chain) throws IOException {
		String token = ex.getRequestHeaders().getFirst(TOKEN_HEADER);
		if (sessions.isAuthenticated(token)) {
			chain.doFilter(ex);
			return;
		}
		if (rest) {
			ex.sendResponseHeaders(401, -1);
			ex.close();
			return;
		}
		ex.getResponseHeaders().set("Location", loginRoute + "?redirect=" + UriComponent.encode(requestedPath(ex.getRequestURI())));
		ex.sendResponseHeaders(302, -1);
		ex.close();
	}

	@Override
	public String description() {
		return "session gate, login route " + loginRoute;
	}

	static String requestedPath(URI u) {
		String q = u.getRawQuery();
		return q == null ? u.getRawPath() : u.getRawPath() + "?" + q;
	}
}
