package org.lockit.server;

import java.util.Optional;

/**
 * Server-side sessions keyed by the opaque token handed to the client.
 */
public interface SessionStore {
	/** Opens an authenticated session and returns its token. */
	String open(String account);

	boolean isAuthenticated(String token);

	Optional<String> account(String token);

	void destroy(String token);
}
