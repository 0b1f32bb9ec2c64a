package org.lockit.common;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;

/**
 * HOTP (RFC 4226) code derivation and TOTP (RFC 6238) window verification.
 * <p>
 * Stateless: every call works only on its arguments, so one instance can be shared
 * between threads. The current time is always passed in by the caller.
 */
public final class OtpEngine {
	public static final int DEFAULT_DIGITS = 6;
	public static final int MAX_DIGITS = 9;
	private static final String HMAC = "HmacSHA1";
	private static final int[] POWERS = { 1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000,
			100_000_000, 1_000_000_000 };

	private final int digits;

	public OtpEngine() {
		this(DEFAULT_DIGITS);
	}

	public OtpEngine(int digits) {
		this.digits = checkDigits(digits);
	}

	public int digits() {
		return digits;
	}

	public String generate(byte[] secret, long counter) {
		return generate(secret, counter, digits);
	}

	/**
	 * Code for {@code counter}: HMAC-SHA1 over the counter as 8 big-endian bytes, then
	 * dynamic truncation to a 31-bit integer reduced modulo 10^digits.
	 */
	public String generate(byte[] secret, long counter, int digits) {
		checkDigits(digits);
		return hotp(hmac(secret), counter, digits);
	}

	public static long counterAt(long unixSeconds, int timeStep) {
		if (timeStep <= 0)
			throw new IllegalArgumentException("timeStep must be > 0, got " + timeStep);
		return Math.floorDiv(unixSeconds, (long) timeStep);
	}

	/** TOTP code of the step containing {@code unixSeconds}. */
	public String generateAt(byte[] secret, long unixSeconds, VerificationWindow window) {
		return generate(secret, counterAt(unixSeconds, window.timeStep()));
	}

	public VerifyResult verify(String submittedCode, byte[] secret, long nowSeconds) {
		return verify(submittedCode, secret, VerificationWindow.DEFAULT, nowSeconds);
	}

	public VerifyResult verify(String submittedCode, byte[] secret, VerificationWindow window, Instant now) {
		return verify(submittedCode, secret, window, now.getEpochSecond());
	}

	/**
	 * Searches {@code current - windowSize .. current + windowSize}, trying offset 0 first,
	 * then growing distance with the past offset ahead of the future one. Reports the first
	 * offset whose code equals {@code submittedCode}.
	 */
	public VerifyResult verify(String submittedCode, byte[] secret, VerificationWindow window, long nowSeconds) {
		Mac mac = hmac(secret);
		if (!wellFormed(submittedCode))
			return VerifyResult.NO_MATCH;

		byte[] submitted = submittedCode.getBytes(StandardCharsets.US_ASCII);
		long current = counterAt(nowSeconds, window.timeStep());
		for (int distance = 0; distance <= window.windowSize(); distance++) {
			if (matches(mac, current - distance, submitted))
				return VerifyResult.at(-distance);
			if (distance > 0 && current <= Long.MAX_VALUE - distance && matches(mac, current + distance, submitted))
				return VerifyResult.at(distance);
		}
		return VerifyResult.NO_MATCH;
	}

	private boolean matches(Mac mac, long counter, byte[] submitted) {
		if (counter < 0)
			return false; // before the first step
		byte[] expected = hotp(mac, counter, digits).getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(expected, submitted);
	}

	private boolean wellFormed(String code) {
		if (code == null || code.length() != digits)
			return false;
		for (int i = 0; i < code.length(); i++) {
			char c = code.charAt(i);
			if (c < '0' || c > '9')
				return false;
		}
		return true;
	}

	private static String hotp(Mac mac, long counter, int digits) {
		byte[] msg = ByteBuffer.allocate(8).putLong(counter).array();
		byte[] hash = mac.doFinal(msg);

		int offset = hash[hash.length - 1] & 0x0F;
		int binary = ((hash[offset] & 0x7F) << 24)
				| ((hash[offset + 1] & 0xFF) << 16)
				| ((hash[offset + 2] & 0xFF) << 8)
				| (hash[offset + 3] & 0xFF);
		String code = Integer.toString(binary % POWERS[digits]);
		return "0".repeat(digits - code.length()) + code;
	}

	private static Mac hmac(byte[] secret) {
		Secrets.requireUsable(secret);
		try {
			Mac mac = Mac.getInstance(HMAC);
			mac.init(new SecretKeySpec(secret, HMAC));
			return mac;
		} catch (NoSuchAlgorithmException | InvalidKeyException e) {
			throw new IllegalStateException("HMAC-SHA1 unavailable", e);
		}
	}

	private static int checkDigits(int digits) {
		if (digits < 1 || digits > MAX_DIGITS)
			throw new IllegalArgumentException("digits must be between 1 and " + MAX_DIGITS + ", got " + digits);
		return digits;
	}
}
