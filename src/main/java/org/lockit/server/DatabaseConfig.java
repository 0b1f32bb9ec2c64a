package org.lockit.server;

/**
 * Structured connection descriptor; {@code name} and {@code collection} are only read by
 * the adapters, never by the resolver.
 */
public record DatabaseConfig(String url, String name, String collection) {
	public static DatabaseConfig of(String url) {
		return new DatabaseConfig(url, null, null);
	}
}
