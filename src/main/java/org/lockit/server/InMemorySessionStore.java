package org.lockit.server;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySessionStore implements SessionStore {
	private final Map<String, String> sessions = new ConcurrentHashMap<>(); // token -> account

	@Override
	public String open(String account) {
		String token = UUID.randomUUID().toString();
		sessions.put(token, account);
		return token;
	}

	@Override
	public boolean isAuthenticated(String token) {
		return token != null && sessions.containsKey(token);
	}

	@Override
	public Optional<String> account(String token) {
		return token == null ? Optional.empty() : Optional.ofNullable(sessions.get(token));
	}

	@Override
	public void destroy(String token) {
		if (token != null)
			sessions.remove(token);
	}
}
