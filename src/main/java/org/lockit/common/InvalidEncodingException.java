package org.lockit.common;

/**
 * Raised when a base32 secret violates the alphabet or padding rules.
 */
public class InvalidEncodingException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public InvalidEncodingException(String message) {
		super(message);
	}
}
