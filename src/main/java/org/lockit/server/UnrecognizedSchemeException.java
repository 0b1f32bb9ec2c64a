package org.lockit.server;

/**
 * The connection string names no database Lockit has an adapter for.
 */
public class UnrecognizedSchemeException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public UnrecognizedSchemeException(String message) {
		super(message);
	}
}
