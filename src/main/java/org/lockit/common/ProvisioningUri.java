package org.lockit.common;

/**
 * Builds the {@code otpauth://totp/} key URI that authenticator apps enroll from.
 */
public final class ProvisioningUri {
	public static final String DEFAULT_ISSUER = "Lockit";
	private static final String PREFIX = "otpauth://totp/";

	private ProvisioningUri() {
	}

	public static String build(byte[] secret, String accountLabel) {
		return build(secret, accountLabel, DEFAULT_ISSUER);
	}

	/**
	 * {@code otpauth://totp/<issuer:account>?secret=<base32>&issuer=<issuer>}, every
	 * variable part percent-encoded.
	 */
	public static String build(byte[] secret, String accountLabel, String issuer) {
		if (accountLabel == null)
			throw new IllegalArgumentException("accountLabel is null");
		if (issuer == null)
			throw new IllegalArgumentException("issuer is null");

		String encoded = SecretCodec.encode(secret);
		String label = issuer + ":" + accountLabel;
		return PREFIX + UriComponent.encode(label)
				+ "?secret=" + UriComponent.encode(encoded)
				+ "&issuer=" + UriComponent.encode(issuer);
	}
}
