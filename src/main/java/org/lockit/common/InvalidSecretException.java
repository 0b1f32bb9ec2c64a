package org.lockit.common;

/**
 * Raised when a secret cannot be used as HMAC keying material (null or empty).
 */
public class InvalidSecretException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public InvalidSecretException(String message) {
		super(message);
	}
}
