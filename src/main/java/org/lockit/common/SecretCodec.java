package org.lockit.common;

import org.apache.commons.codec.binary.Base32;

/**
 * Base32 (RFC 4648) text form of a shared secret, as shown to users and carried in
 * provisioning URIs. Encoding is always upper case and '=' padded; decoding is case
 * insensitive and also takes input whose padding was stripped.
 */
public final class SecretCodec {
	private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
	private static final char PAD = '=';
	private static final int BLOCK = 8;

	// discarded low bits of the last character, indexed by data chars in the final block;
	// -1 marks a length no byte sequence encodes to
	private static final int[] TAIL_MASK = { 0, -1, 0x03, -1, 0x0F, 0x01, -1, 0x07 };

	private static final Base32 BASE32 = new Base32();

	private SecretCodec() {
	}

	public static String encode(byte[] secret) {
		if (secret == null)
			throw new InvalidSecretException("secret is null");
		return BASE32.encodeToString(secret);
	}

	public static byte[] decode(String text) {
		if (text == null)
			throw new InvalidEncodingException("encoded secret is null");
		String s = upperAscii(text);

		int end = s.length();
		while (end > 0 && s.charAt(end - 1) == PAD)
			end--;
		int pads = s.length() - end;

		for (int i = 0; i < end; i++) {
			char c = s.charAt(i);
			if (ALPHABET.indexOf(c) < 0)
				throw new InvalidEncodingException("invalid base32 character '" + c + "' at index " + i);
		}

		int tail = end % BLOCK;
		if (TAIL_MASK[tail] < 0)
			throw new InvalidEncodingException("invalid base32 length " + end);
		if (pads != 0 && (tail == 0 || pads != BLOCK - tail))
			throw new InvalidEncodingException("inconsistent padding: " + pads + " '=' after " + end + " characters");
		if (tail != 0 && (ALPHABET.indexOf(s.charAt(end - 1)) & TAIL_MASK[tail]) != 0)
			throw new InvalidEncodingException("non-zero trailing bits in last character");

		return BASE32.decode(s);
	}

	// only a-z fold; any other character is left for the alphabet check to reject
	private static String upperAscii(String text) {
		char[] out = text.toCharArray();
		for (int i = 0; i < out.length; i++) {
			char c = out[i];
			if (c >= 'a' && c <= 'z')
				out[i] = (char) (c - ('a' - 'A'));
		}
		return new String(out);
	}
}
