package org.lockit.common;

import java.security.SecureRandom;

public final class Secrets {
	private static final SecureRandom RNG = new SecureRandom();
	public static final int DEFAULT_LENGTH = 20; // SHA-1 digest size
	public static final int MIN_LENGTH = 10;

	private Secrets() {
	}

	public static byte[] random() {
		return random(DEFAULT_LENGTH);
	}

	public static byte[] random(int len) {
		if (len < MIN_LENGTH)
			throw new IllegalArgumentException("secret length must be at least " + MIN_LENGTH + " bytes, got " + len);
		byte[] b = new byte[len];
		RNG.nextBytes(b);
		return b;
	}

	/**
	 * Fails fast on keying material that must never produce a code.
	 */
	public static byte[] requireUsable(byte[] secret) {
		if (secret == null)
			throw new InvalidSecretException("secret is null");
		if (secret.length == 0)
			throw new InvalidSecretException("secret is empty");
		return secret;
	}
}
